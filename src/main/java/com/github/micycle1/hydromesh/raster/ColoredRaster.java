package com.github.micycle1.hydromesh.raster;

import org.locationtech.jts.geom.Envelope;

/**
 * Integer label raster produced by painting shapes, with the world bounds the
 * grid actually covers (the requested bounds rounded outward to whole pixels).
 */
public final class ColoredRaster {

	private final int[][] colors;
	private final RasterProfile profile;

	ColoredRaster(int[][] colors, RasterProfile profile) {
		this.colors = colors;
		this.profile = profile;
	}

	public int get(int row, int col) {
		return colors[row][col];
	}

	public int[][] getColors() {
		return colors;
	}

	public RasterProfile getProfile() {
		return profile;
	}

	public Envelope getBounds() {
		return profile.bounds();
	}

	/**
	 * The labels as a floating-point raster, for sampling.
	 */
	public Raster toRaster() {
		double[][] data = new double[colors.length][];
		for (int r = 0; r < colors.length; r++) {
			data[r] = new double[colors[r].length];
			for (int c = 0; c < colors[r].length; c++) {
				data[r][c] = colors[r][c];
			}
		}
		return new Raster(data, profile);
	}
}
