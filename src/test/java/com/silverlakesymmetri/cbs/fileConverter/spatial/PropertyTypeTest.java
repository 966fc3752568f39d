package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PropertyTypeTest {

	@Test
	void integralValuesBecomeLongs() {
		assertEquals(7L, PropertyType.INT.coerce(7));
		assertEquals(3L, PropertyType.INT.coerce(3.0d));
		assertEquals(3L, PropertyType.INT.coerce(new BigDecimal("3.00")));
		assertEquals(Long.MAX_VALUE, PropertyType.INT.coerce(BigInteger.valueOf(Long.MAX_VALUE)));
		assertEquals(42L, PropertyType.INT.coerce(" 42 "));
		assertNull(PropertyType.INT.coerce(" "));
	}

	@Test
	void fractionalNumbersAreRejectedLikeFractionalText() {
		assertThrows(SchemaException.class, () -> PropertyType.INT.coerce("3.5"));
		assertThrows(SchemaException.class, () -> PropertyType.INT.coerce(3.5d));
		assertThrows(SchemaException.class, () -> PropertyType.INT.coerce(3.5f));
		assertThrows(SchemaException.class, () -> PropertyType.INT.coerce(new BigDecimal("3.5")));
	}

	@Test
	void outOfRangeNumbersAreRejected() {
		SchemaException e = assertThrows(SchemaException.class,
				() -> PropertyType.INT.coerce(BigInteger.ONE.shiftLeft(64)));

		assertEquals("Value '18446744073709551616' is not a valid int property", e.getMessage());
		assertThrows(SchemaException.class, () -> PropertyType.INT.coerce(1e19d));
		assertThrows(SchemaException.class, () -> PropertyType.INT.coerce(Double.NaN));
		assertThrows(SchemaException.class, () -> PropertyType.INT.coerce(Double.POSITIVE_INFINITY));
	}

	@Test
	void floatAndStringCoercion() {
		assertEquals(3.5d, PropertyType.FLOAT.coerce(new BigDecimal("3.5")));
		assertEquals(2.0d, PropertyType.FLOAT.coerce("2"));
		assertEquals("12", PropertyType.STRING.coerce(12));
	}
}
