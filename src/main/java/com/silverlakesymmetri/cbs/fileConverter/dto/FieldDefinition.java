package com.silverlakesymmetri.cbs.fileConverter.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A datastore field: its id and its datastore type name (e.g. {@code text}, {@code int4}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FieldDefinition {

	private final String id;
	private final String type;

	@JsonCreator
	public FieldDefinition(@JsonProperty("id") String id, @JsonProperty("type") String type) {
		this.id = Objects.requireNonNull(id, "field id");
		this.type = type;
	}

	public String getId() {
		return id;
	}

	public String getType() {
		return type;
	}

	/**
	 * Type name with digits stripped, so {@code float8} becomes {@code float}.
	 */
	public String getBaseType() {
		if (type == null) return null;
		StringBuilder sb = new StringBuilder(type.length());
		for (char c : type.toCharArray()) {
			if (!Character.isDigit(c)) sb.append(c);
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof FieldDefinition)) return false;
		FieldDefinition that = (FieldDefinition) o;
		return id.equals(that.id) && Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, type);
	}

	@Override
	public String toString() {
		return id + ":" + type;
	}
}
