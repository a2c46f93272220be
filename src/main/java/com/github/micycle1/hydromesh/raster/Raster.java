package com.github.micycle1.hydromesh.raster;

import org.apache.commons.lang3.Validate;

/**
 * Single-band raster: a row-major grid of samples and its profile.
 */
public final class Raster {

	private final double[][] data;
	private final RasterProfile profile;

	public Raster(double[][] data, RasterProfile profile) {
		Validate.notNull(profile);
		Validate.isTrue(data.length == profile.getHeight(), "Expected %d rows, got %d", profile.getHeight(), data.length);
		for (double[] row : data) {
			Validate.isTrue(row.length == profile.getWidth(), "Expected %d columns, got %d", profile.getWidth(), row.length);
		}
		this.data = data;
		this.profile = profile;
	}

	public double get(int row, int col) {
		return data[row][col];
	}

	public double[][] getData() {
		return data;
	}

	public RasterProfile getProfile() {
		return profile;
	}

	public int getWidth() {
		return profile.getWidth();
	}

	public int getHeight() {
		return profile.getHeight();
	}
}
