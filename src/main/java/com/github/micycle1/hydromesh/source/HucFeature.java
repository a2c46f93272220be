package com.github.micycle1.hydromesh.source;

import java.util.Objects;

import org.locationtech.jts.geom.Polygon;

/**
 * A hydrologic unit: its code and boundary polygon.
 */
public final class HucFeature {

	private final String code;
	private final Polygon shape;

	public HucFeature(String code, Polygon shape) {
		this.code = HucCodes.normalize(code);
		this.shape = Objects.requireNonNull(shape);
	}

	public String getCode() {
		return code;
	}

	public int getLevel() {
		return code.length();
	}

	public Polygon getShape() {
		return shape;
	}

	public HucFeature withShape(Polygon shape) {
		return new HucFeature(code, shape);
	}

	@Override
	public String toString() {
		return "HUC" + getLevel() + "[" + code + "]";
	}
}
