package com.github.micycle1.hydromesh;

public class HydroConstants {

	public static final double ZERO_LENGTH = 1e-12;
	public static final double ZERO_AREA = 1e-12;
	// relative tolerance between the domain area and the summed triangle areas
	public static final double AREA_REL_TOL = 1e-6;
	/**
	 * Fraction of a pixel kept between a bilinear sample and the raster edge. Zero
	 * keeps pixel-centre samples exact on the outermost row/column.
	 */
	public static final double RASTER_EDGE_EPS = 0;
	public static final double DEFAULT_SNAP_RADIUS_FACTOR = 3.0;
	public static final int DEFAULT_MAX_REFINEMENT_PASSES = 64;
	public static final int DEFAULT_DIGITS = 7;
	public static final double DEFAULT_SHRINK_FACTOR = 1e-5;
}
