package com.github.micycle1.hydromesh.raster;

/**
 * How raster values are read at arbitrary points.
 */
public enum SamplingAlgorithm {

	/** Value of the pixel containing the point; nodata outside the grid. */
	NEAREST,
	/** Bilinear interpolation between the four surrounding pixel centres. */
	PIECEWISE_BILINEAR;
}
