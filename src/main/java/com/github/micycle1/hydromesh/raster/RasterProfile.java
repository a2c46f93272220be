package com.github.micycle1.hydromesh.raster;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.geom.util.NoninvertibleTransformationException;

import com.github.micycle1.hydromesh.source.Crs;

/**
 * Georeferencing of a raster grid: the affine transform from pixel space
 * (column, row), with (0, 0) the top-left corner of the first pixel, to world
 * space, plus grid size and nodata value.
 */
public final class RasterProfile {

	private final Crs crs;
	private final AffineTransformation transform;
	private final AffineTransformation inverse;
	private final int width;
	private final int height;
	private final double nodata;

	public RasterProfile(Crs crs, AffineTransformation transform, int width, int height, double nodata) {
		Validate.notNull(crs);
		Validate.isTrue(width > 0 && height > 0, "Raster must have at least one pixel");
		this.crs = crs;
		this.transform = new AffineTransformation(transform);
		try {
			this.inverse = transform.getInverse();
		} catch (NoninvertibleTransformationException e) {
			throw new IllegalArgumentException("Raster transform is not invertible: " + transform, e);
		}
		this.width = width;
		this.height = height;
		this.nodata = nodata;
	}

	/**
	 * North-up profile whose top-left corner is (x0, y1) with square pixels of
	 * size {@code dx}.
	 */
	public static RasterProfile fromOrigin(Crs crs, double x0, double y1, double dx, int width, int height, double nodata) {
		Validate.isTrue(dx > 0, "Pixel size must be positive: %f", dx);
		return new RasterProfile(crs, new AffineTransformation(dx, 0, x0, 0, -dx, y1), width, height, nodata);
	}

	/**
	 * World coordinate of the pixel-space point (col, row).
	 */
	public Coordinate toWorld(double col, double row) {
		return transform.transform(new Coordinate(col, row), new Coordinate());
	}

	/**
	 * Fractional pixel-space coordinate (x = column, y = row) of a world point.
	 */
	public Coordinate toPixel(Coordinate world) {
		return inverse.transform(world, new Coordinate());
	}

	public Coordinate pixelCenter(int row, int col) {
		return toWorld(col + 0.5, row + 0.5);
	}

	public Envelope bounds() {
		Envelope env = new Envelope(toWorld(0, 0));
		env.expandToInclude(toWorld(width, 0));
		env.expandToInclude(toWorld(0, height));
		env.expandToInclude(toWorld(width, height));
		return env;
	}

	public Crs getCrs() {
		return crs;
	}

	public AffineTransformation getTransform() {
		return new AffineTransformation(transform);
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public double getNodata() {
		return nodata;
	}

	@Override
	public String toString() {
		return "RasterProfile{crs=" + crs + ", width=" + width + ", height=" + height + ", nodata=" + nodata + ", transform=" + transform + "}";
	}
}
