package com.github.micycle1.hydromesh.triangulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.split.SplitBoundary;
import com.github.micycle1.hydromesh.util.CanonicalSegment;

class PslgTest {

	private final WKTReader reader = new WKTReader();

	@Test
	void sharedWallIsOneSegment() throws ParseException {
		Polygon a = (Polygon) reader.read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
		Polygon b = (Polygon) reader.read("POLYGON ((10 0, 20 0, 20 10, 10 10, 10 0))");
		SplitBoundary boundary = new SplitBoundary(Arrays.asList(a, b));
		Pslg pslg = Pslg.from(boundary, RiverForest.empty(boundary.getFactory()));

		assertEquals(6, pslg.getVertices().size());
		assertEquals(7, pslg.getSegments().size());
		assertTrue(pslg.getHoles().isEmpty());
		assertEquals(200, pslg.getDomain().getArea(), 1e-9);
	}

	@Test
	void riversAddInteriorConstraints() throws ParseException {
		Polygon a = (Polygon) reader.read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
		SplitBoundary boundary = new SplitBoundary(Collections.singletonList(a));
		LineString reach = (LineString) reader.read("LINESTRING (5 5, 10 0)");
		Pslg pslg = Pslg.from(boundary, RiverForest.build(Collections.singletonList(reach), 0.1));

		// the outlet coincides with a corner
		assertEquals(5, pslg.getVertices().size());
		assertEquals(5, pslg.getSegments().size());
		int mid = pslg.getVertices().indexOf(new Coordinate(5, 5));
		int corner = pslg.getVertices().indexOf(new Coordinate(10, 0));
		assertTrue(pslg.getSegments().contains(new CanonicalSegment(corner, mid)));
	}

	@Test
	void holeGetsAMarkerInside() throws ParseException {
		Polygon donut = (Polygon) reader.read("POLYGON ((0 0, 30 0, 30 30, 0 30, 0 0), (10 10, 20 10, 20 20, 10 20, 10 10))");
		SplitBoundary boundary = new SplitBoundary(Collections.singletonList(donut));
		Pslg pslg = Pslg.from(boundary, RiverForest.empty(boundary.getFactory()));

		assertEquals(1, pslg.getHoles().size());
		Coordinate h = pslg.getHoles().get(0);
		assertTrue(h.x > 10 && h.x < 20 && h.y > 10 && h.y < 20);
		assertEquals(8, pslg.getVertices().size());
		assertEquals(8, pslg.getSegments().size());
	}
}
