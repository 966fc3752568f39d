package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Attribute types a feature property can take in the spatial outputs.
 */
public enum PropertyType {
	STRING("TEXT"),
	FLOAT("REAL"),
	INT("INTEGER");

	private final String sqlType;

	PropertyType(String sqlType) {
		this.sqlType = sqlType;
	}

	public String getSqlType() {
		return sqlType;
	}

	/**
	 * Converts a cached record value to the Java type used for this property.
	 * Nulls and blank strings become {@code null} for numeric properties.
	 */
	public Object coerce(Object value) {
		if (value == null) {
			return null;
		}
		switch (this) {
			case STRING:
				return value.toString();
			case FLOAT:
				if (value instanceof Number) return ((Number) value).doubleValue();
				return parse(value.toString(), true);
			case INT:
				if (value instanceof BigDecimal) return exactLong((BigDecimal) value, value);
				if (value instanceof BigInteger) return exactLong(new BigDecimal((BigInteger) value), value);
				if (value instanceof Double || value instanceof Float) return exactLong((Number) value);
				if (value instanceof Number) return ((Number) value).longValue();
				return parse(value.toString(), false);
			default:
				throw new IllegalStateException("Unhandled property type " + this);
		}
	}

	private Object exactLong(Number floating) {
		double d = floating.doubleValue();
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			throw invalid(floating, null);
		}
		return exactLong(new BigDecimal(d), floating);
	}

	private Object exactLong(BigDecimal decimal, Object original) {
		try {
			return decimal.longValueExact();
		} catch (ArithmeticException e) {
			throw invalid(original, e);
		}
	}

	private SchemaException invalid(Object value, Exception cause) {
		return new SchemaException("Value '" + value + "' is not a valid " + name().toLowerCase(Locale.ROOT) + " property",
				cause);
	}

	private Object parse(String text, boolean decimal) {
		String trimmed = text.trim();
		if (trimmed.isEmpty()) {
			return null;
		}
		try {
			return decimal ? (Object) Double.valueOf(trimmed) : (Object) new BigDecimal(trimmed).longValueExact();
		} catch (NumberFormatException | ArithmeticException e) {
			throw invalid(text, e);
		}
	}
}
