package com.github.micycle1.hydromesh.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

class GeometryUtilTest {

	private static final double E = 1e-12;
	private static final GeometryFactory GF = new GeometryFactory();

	private static Coordinate[] tri(double... xy) {
		return new Coordinate[] { new Coordinate(xy[0], xy[1]), new Coordinate(xy[2], xy[3]), new Coordinate(xy[4], xy[5]) };
	}

	@Test
	@DisplayName("Area and signed area of a right triangle")
	void triangleArea() {
		Coordinate[] t = tri(0, 0, 4, 0, 0, 3);
		assertEquals(6, GeometryUtil.triangleArea(t), E);
		assertEquals(12, GeometryUtil.signedArea2(t[0], t[1], t[2]), E);
		assertEquals(-12, GeometryUtil.signedArea2(t[0], t[2], t[1]), E);
	}

	@Test
	@DisplayName("Longest edge is the hypotenuse")
	void longestEdge() {
		Coordinate[] t = tri(0, 0, 4, 0, 0, 3);
		// edge 1 runs (4,0) -> (0,3)
		assertEquals(1, GeometryUtil.longestEdge(t));
		assertEquals(5, GeometryUtil.maxEdgeLength(t), E);
	}

	@Test
	void minAngleOfEquilateralTriangle() {
		Coordinate[] t = tri(0, 0, 2, 0, 1, Math.sqrt(3));
		assertEquals(60, GeometryUtil.minAngleDegrees(t), 1e-9);
	}

	@Test
	void centroid() {
		Coordinate c = GeometryUtil.centroid(tri(0, 0, 3, 0, 0, 3));
		assertEquals(1, c.x, E);
		assertEquals(1, c.y, E);
	}

	@Test
	void segmentLengthsMinAndMedian() {
		LineString line = GF.createLineString(new Coordinate[] { new Coordinate(0, 0), new Coordinate(3, 0), new Coordinate(3, 1),
				new Coordinate(3, 3) });
		double[] lengths = GeometryUtil.segmentLengths(line);
		assertArrayEquals(new double[] { 3, 1, 2 }, lengths, E);
		assertEquals(1, GeometryUtil.min(lengths), E);
		assertEquals(2, GeometryUtil.median(lengths), E);
		assertEquals(1.5, GeometryUtil.median(new double[] { 2, 1 }), E);
		assertTrue(Double.isNaN(GeometryUtil.median(new double[0])));
	}

	@Test
	void removeRepeatedPoints() {
		LineString line = GF.createLineString(new Coordinate[] { new Coordinate(0, 0), new Coordinate(0, 0), new Coordinate(1, 0),
				new Coordinate(1, 0), new Coordinate(2, 0) });
		assertEquals(3, GeometryUtil.removeRepeatedPoints(line).getNumPoints());
	}

	@Test
	void roundInPlace() {
		LineString line = GF.createLineString(new Coordinate[] { new Coordinate(0.123456, 1.987654), new Coordinate(2.5, 3.25) });
		GeometryUtil.round(line, 2);
		assertEquals(0.12, line.getCoordinateN(0).x, E);
		assertEquals(1.99, line.getCoordinateN(0).y, E);
		assertEquals(3.25, line.getCoordinateN(1).y, E);
	}
}
