package com.github.micycle1.hydromesh.raster;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.HydroConstants;
import com.github.micycle1.hydromesh.source.CoordinateReprojector;
import com.github.micycle1.hydromesh.source.Crs;
import com.github.micycle1.hydromesh.triangulation.Mesh;

/**
 * Reads raster values at mesh vertices and paints shapes onto rasters.
 */
public class RasterSampler {

	private static final Logger LOGGER = LoggerFactory.getLogger(RasterSampler.class);

	private final CoordinateReprojector reprojector;

	public RasterSampler(CoordinateReprojector reprojector) {
		this.reprojector = Objects.requireNonNull(reprojector);
	}

	/**
	 * Samples the raster at each point, after reprojecting the points into the
	 * raster's CRS.
	 */
	public double[] valuesFromRaster(Coordinate[] points, Crs pointsCrs, Raster raster, SamplingAlgorithm algorithm) {
		RasterProfile profile = raster.getProfile();
		Coordinate[] local = reprojector.reproject(points, pointsCrs, profile.getCrs());
		double[] out = new double[local.length];
		for (int k = 0; k < local.length; k++) {
			Coordinate pixel = profile.toPixel(local[k]);
			out[k] = algorithm == SamplingAlgorithm.NEAREST ? nearest(raster, pixel) : bilinear(raster, pixel);
		}
		return out;
	}

	/**
	 * Drapes a 2D mesh onto an elevation raster.
	 */
	public Mesh elevate(Mesh mesh, Crs meshCrs, Raster dem, SamplingAlgorithm algorithm) {
		LOGGER.info("");
		LOGGER.info("Elevating Triangulation to DEM");
		LOGGER.info("------------------------------");
		Coordinate[] points = new Coordinate[mesh.getVertexCount()];
		for (int i = 0; i < points.length; i++) {
			double[] v = mesh.getVertices()[i];
			points[i] = new Coordinate(v[0], v[1]);
		}
		return mesh.withElevation(valuesFromRaster(points, meshCrs, dem, algorithm));
	}

	static double nearest(Raster raster, Coordinate pixel) {
		int col = (int) Math.floor(pixel.x);
		int row = (int) Math.floor(pixel.y);
		if (col < 0 || row < 0 || col >= raster.getWidth() || row >= raster.getHeight()) {
			return raster.getProfile().getNodata();
		}
		return raster.get(row, col);
	}

	/*
	 * Interpolates between pixel centres. Positions are clamped to the grid of
	 * centres, so points near or beyond the edge take the edge values.
	 */
	static double bilinear(Raster raster, Coordinate pixel) {
		double eps = HydroConstants.RASTER_EDGE_EPS;
		double i = clamp(pixel.y - 0.5, eps, raster.getHeight() - 1 - eps);
		double j = clamp(pixel.x - 0.5, eps, raster.getWidth() - 1 - eps);
		int i0 = (int) Math.floor(i);
		int j0 = (int) Math.floor(j);
		int i1 = Math.min(i0 + 1, raster.getHeight() - 1);
		int j1 = Math.min(j0 + 1, raster.getWidth() - 1);
		double ii = i - i0;
		double jj = j - j0;

		// zero weights are skipped so a nodata or NaN neighbour cannot leak in
		double up = raster.get(i0, j0);
		if (jj > 0) {
			up += jj * (raster.get(i0, j1) - up);
		}
		if (ii == 0) {
			return up;
		}
		double dn = raster.get(i1, j0);
		if (jj > 0) {
			dn += jj * (raster.get(i1, j1) - dn);
		}
		return up + (dn - up) * ii;
	}

	private static double clamp(double v, double lo, double hi) {
		return Math.max(lo, Math.min(hi, v));
	}

	/**
	 * Paints each shape with its colour onto a new grid covering {@code bounds}
	 * rounded outward to whole pixels. A pixel takes the colour of the last shape
	 * containing its centre; pixels in no shape keep {@code nodata}.
	 */
	public static ColoredRaster colorRasterFromShapes(Envelope bounds, double dx, List<? extends Geometry> shapes, int[] colors, Crs crs,
			int nodata) {
		Validate.isTrue(dx > 0, "Pixel size must be positive: %f", dx);
		Validate.isTrue(shapes.size() == colors.length, "Got %d shapes but %d colors", shapes.size(), colors.length);
		Validate.isTrue(!shapes.isEmpty(), "Nothing to color");

		double x0 = Math.rint(bounds.getMinX() - dx / 2);
		double y1 = Math.rint(bounds.getMaxY() + dx / 2);
		int width = (int) Math.ceil((bounds.getMaxX() + dx / 2 - x0) / dx);
		int height = (int) Math.ceil((y1 - bounds.getMinY() - dx / 2) / dx);
		RasterProfile profile = RasterProfile.fromOrigin(crs, x0, y1, dx, width, height, nodata);

		LOGGER.info("Coloring shapes onto raster:");
		LOGGER.info("  target_bounds = {}", bounds);
		LOGGER.info("  out_bounds = {}", profile.bounds());
		LOGGER.info("  pixel_size = {}", dx);
		LOGGER.info("  width = {}, height = {}", width, height);
		LOGGER.info("  and {} independent colors", countDistinct(colors));

		int[][] out = new int[height][width];
		for (int[] row : out) {
			Arrays.fill(row, nodata);
		}
		for (int s = 0; s < shapes.size(); s++) {
			paint(out, profile, shapes.get(s), colors[s]);
		}
		return new ColoredRaster(out, profile);
	}

	/**
	 * Copy of the raster with every pixel whose centre lies outside the shape set
	 * to {@code nodata}. The shape must be in the raster's CRS.
	 */
	public static Raster mask(Raster raster, Geometry shape, double nodata) {
		RasterProfile p = raster.getProfile();
		IndexedPointInAreaLocator locator = new IndexedPointInAreaLocator(shape);
		double[][] out = new double[p.getHeight()][p.getWidth()];
		for (int r = 0; r < p.getHeight(); r++) {
			for (int c = 0; c < p.getWidth(); c++) {
				out[r][c] = locator.locate(p.pixelCenter(r, c)) == Location.EXTERIOR ? nodata : raster.get(r, c);
			}
		}
		RasterProfile masked = new RasterProfile(p.getCrs(), p.getTransform(), p.getWidth(), p.getHeight(), nodata);
		LOGGER.info(" raster bounds = {}", masked.bounds());
		return new Raster(out, masked);
	}

	private static void paint(int[][] out, RasterProfile profile, Geometry shape, int color) {
		IndexedPointInAreaLocator locator = new IndexedPointInAreaLocator(shape);
		Envelope env = shape.getEnvelopeInternal();
		// pixel window covering the shape's envelope
		Coordinate a = profile.toPixel(new Coordinate(env.getMinX(), env.getMaxY()));
		Coordinate b = profile.toPixel(new Coordinate(env.getMaxX(), env.getMinY()));
		int c0 = Math.max(0, (int) Math.floor(Math.min(a.x, b.x)));
		int c1 = Math.min(profile.getWidth() - 1, (int) Math.ceil(Math.max(a.x, b.x)));
		int r0 = Math.max(0, (int) Math.floor(Math.min(a.y, b.y)));
		int r1 = Math.min(profile.getHeight() - 1, (int) Math.ceil(Math.max(a.y, b.y)));
		for (int r = r0; r <= r1; r++) {
			for (int c = c0; c <= c1; c++) {
				if (locator.locate(profile.pixelCenter(r, c)) != Location.EXTERIOR) {
					out[r][c] = color;
				}
			}
		}
	}

	private static int countDistinct(int[] colors) {
		Set<Integer> seen = new HashSet<>();
		for (int c : colors) {
			seen.add(c);
		}
		return seen.size();
	}
}
