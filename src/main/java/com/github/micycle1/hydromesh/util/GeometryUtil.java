package com.github.micycle1.hydromesh.util;

import java.util.Arrays;

import org.locationtech.jts.algorithm.Angle;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateList;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Triangle;

public class GeometryUtil {

	/**
	 * Unsigned area of the triangle formed by the first three coordinates.
	 */
	public static double triangleArea(Coordinate[] triangle) {
		return Triangle.area(triangle[0], triangle[1], triangle[2]);
	}

	/**
	 * Twice the signed area of (a, b, c); positive when the vertices are
	 * counter-clockwise.
	 */
	public static double signedArea2(Coordinate a, Coordinate b, Coordinate c) {
		return (b.x - a.x) * (c.y - a.y) - (b.y - a.y) * (c.x - a.x);
	}

	public static Coordinate centroid(Coordinate[] triangle) {
		return Triangle.centroid(triangle[0], triangle[1], triangle[2]);
	}

	/**
	 * Index i of the longest edge (triangle[i], triangle[(i+1)%3]).
	 */
	public static int longestEdge(Coordinate[] triangle) {
		int longest = 0;
		double max = -1;
		for (int i = 0; i < 3; i++) {
			double d = triangle[i].distance(triangle[(i + 1) % 3]);
			if (d > max) {
				max = d;
				longest = i;
			}
		}
		return longest;
	}

	public static double maxEdgeLength(Coordinate[] triangle) {
		int i = longestEdge(triangle);
		return triangle[i].distance(triangle[(i + 1) % 3]);
	}

	/**
	 * Smallest interior angle of the triangle, in degrees.
	 */
	public static double minAngleDegrees(Coordinate[] triangle) {
		double min = Double.POSITIVE_INFINITY;
		for (int i = 0; i < 3; i++) {
			Coordinate p = triangle[i];
			Coordinate prev = triangle[(i + 2) % 3];
			Coordinate next = triangle[(i + 1) % 3];
			min = Math.min(min, Angle.angleBetween(prev, p, next));
		}
		return Angle.toDegrees(min);
	}

	/**
	 * Lengths of each segment of the line, in order.
	 */
	public static double[] segmentLengths(LineString line) {
		Coordinate[] coords = line.getCoordinates();
		if (coords.length < 2) {
			return new double[0];
		}
		double[] lengths = new double[coords.length - 1];
		for (int i = 1; i < coords.length; i++) {
			lengths[i - 1] = coords[i - 1].distance(coords[i]);
		}
		return lengths;
	}

	public static double min(double[] values) {
		return Arrays.stream(values).min().orElse(Double.NaN);
	}

	public static double median(double[] values) {
		if (values.length == 0) {
			return Double.NaN;
		}
		double[] sorted = values.clone();
		Arrays.sort(sorted);
		int mid = sorted.length / 2;
		return sorted.length % 2 == 1 ? sorted[mid] : 0.5 * (sorted[mid - 1] + sorted[mid]);
	}

	/**
	 * Copy of the line with consecutive duplicate coordinates collapsed.
	 */
	public static LineString removeRepeatedPoints(LineString line) {
		CoordinateList list = new CoordinateList(line.getCoordinates(), false);
		if (list.size() == line.getNumPoints()) {
			return line;
		}
		if (list.size() < 2) {
			// fully degenerate; keep the endpoints so callers can detect it
			return line.getFactory().createLineString(new Coordinate[] { line.getCoordinateN(0).copy(), line.getCoordinateN(0).copy() });
		}
		return line.getFactory().createLineString(list.toCoordinateArray());
	}

	/**
	 * Rounds every ordinate of the geometry, in place, to the given number of
	 * decimal digits.
	 */
	public static void round(Geometry geometry, int digits) {
		final double scale = Math.pow(10, digits);
		geometry.apply(new CoordinateSequenceFilter() {
			@Override
			public void filter(CoordinateSequence seq, int i) {
				seq.setOrdinate(i, CoordinateSequence.X, Math.round(seq.getX(i) * scale) / scale);
				seq.setOrdinate(i, CoordinateSequence.Y, Math.round(seq.getY(i) * scale) / scale);
			}

			@Override
			public boolean isDone() {
				return false;
			}

			@Override
			public boolean isGeometryChanged() {
				return true;
			}
		});
		geometry.geometryChanged();
	}
}
