package com.github.micycle1.hydromesh.source;

import java.util.Objects;

import org.apache.commons.lang3.Validate;

/**
 * Coordinate reference system tag, e.g. {@code EPSG:5070}. Two tags are the
 * same system exactly when their normalised identifiers are equal.
 */
public final class Crs {

	private final String id;

	private Crs(String id) {
		this.id = id;
	}

	public static Crs of(String id) {
		Validate.notBlank(id, "CRS identifier must not be blank");
		return new Crs(id.trim().toUpperCase());
	}

	public static Crs epsg(int code) {
		return new Crs("EPSG:" + code);
	}

	public String getId() {
		return id;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Crs)) {
			return false;
		}
		return id.equals(((Crs) o).id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}

	@Override
	public String toString() {
		return id;
	}
}
