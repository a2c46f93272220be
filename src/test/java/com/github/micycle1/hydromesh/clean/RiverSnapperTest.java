package com.github.micycle1.hydromesh.clean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.split.SplitBoundary;

class RiverSnapperTest {

	private final WKTReader reader = new WKTReader();
	private SplitBoundary boundary;

	private LineString line(String wkt) throws ParseException {
		return (LineString) reader.read(wkt);
	}

	@BeforeEach
	void setUp() throws ParseException {
		Polygon a = (Polygon) reader.read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
		Polygon b = (Polygon) reader.read("POLYGON ((10 0, 20 0, 20 10, 10 10, 10 0))");
		boundary = new SplitBoundary(Arrays.asList(a, b));
	}

	@Test
	@DisplayName("An endpoint within the snap radius lands exactly on the boundary vertex")
	void snapsEndpointExactly() throws ParseException {
		RiverForest forest = RiverForest.build(Arrays.asList(line("LINESTRING (5 5, 9.9 0.1)")), 0.1);
		int moved = RiverSnapper.snap(boundary, forest, 0.1, 0.3, false);
		assertEquals(1, moved);
		Coordinate outlet = forest.node(0).outlet();
		assertEquals(10.0, outlet.x, 0);
		assertEquals(0.0, outlet.y, 0);
		assertTrue(forest.node(0).inlet().equals2D(new Coordinate(5, 5)));
	}

	@Test
	void endpointOutsideRadiusIsLeftAlone() throws ParseException {
		RiverForest forest = RiverForest.build(Arrays.asList(line("LINESTRING (5 5, 9 1)")), 0.1);
		assertEquals(0, RiverSnapper.snap(boundary, forest, 0.1, 0.3, false));
		assertTrue(forest.node(0).outlet().equals2D(new Coordinate(9, 1)));
	}

	@Test
	@DisplayName("Reaches meeting at a junction move together")
	void junctionMovesAsOne() throws ParseException {
		List<LineString> reaches = Arrays.asList(line("LINESTRING (9.9 0.1, 5 -5)"), line("LINESTRING (3 3, 9.9 0.1)"));
		RiverForest forest = RiverForest.build(reaches, 0.01);
		assertEquals(1, RiverSnapper.snap(boundary, forest, 0.1, 0.3, false));
		Coordinate corner = new Coordinate(10, 0);
		assertTrue(forest.node(0).inlet().equals2D(corner));
		assertTrue(forest.node(1).outlet().equals2D(corner));
	}

	@Test
	@DisplayName("Equidistant vertices: the first in boundary order wins")
	void tieGoesToFirstBoundaryVertex() throws ParseException {
		Coordinate bottom = new Coordinate(10, 0);
		Coordinate top = new Coordinate(10, 10);
		Coordinate expected = null;
		for (LineString piece : boundary.segments()) {
			for (Coordinate c : piece.getCoordinates()) {
				if (expected == null && (c.equals2D(bottom) || c.equals2D(top))) {
					expected = c;
				}
			}
		}
		assertNotNull(expected);

		RiverForest forest = RiverForest.build(Arrays.asList(line("LINESTRING (5 5, 10 5)")), 0.1);
		RiverSnapper.snap(boundary, forest, 0.1, 6, false);
		assertTrue(forest.node(0).outlet().equals2D(expected));
	}

	@Test
	@DisplayName("A river crossing a wall gets a shared vertex in both lines")
	void cutsCrossings() throws ParseException {
		RiverForest forest = RiverForest.build(Arrays.asList(line("LINESTRING (5 5, 15 5)")), 0.1);
		RiverSnapper.snap(boundary, forest, 0.1, 0, true);

		Coordinate crossing = new Coordinate(10, 5);
		LineString wall = boundary.sharedPieces(0, 1).get(0);
		assertEquals(3, wall.getNumPoints());
		assertTrue(wall.getCoordinateN(1).equals2D(crossing));
		LineString reach = forest.node(0).getReach();
		assertEquals(3, reach.getNumPoints());
		assertTrue(reach.getCoordinateN(1).equals2D(crossing));

		assertEquals(100, boundary.polygon(0).getArea(), 1e-9);
		assertEquals(100, boundary.polygon(1).getArea(), 1e-9);
	}

	private SplitBoundary square() throws ParseException {
		Polygon p = (Polygon) reader.read("POLYGON ((0 0, 100 0, 100 100, 0 100, 0 0))");
		return new SplitBoundary(Collections.singletonList(p));
	}

	private static boolean contains(LineString line, Coordinate c) {
		for (Coordinate v : line.getCoordinates()) {
			if (v.equals2D(c)) {
				return true;
			}
		}
		return false;
	}

	@Test
	@DisplayName("A crossing next to a boundary corner is routed through the corner")
	void crossingNearCornerUsesCorner() throws ParseException {
		SplitBoundary sq = square();
		RiverForest forest = RiverForest.build(Collections.singletonList(line("LINESTRING (50 50, 150 148.5)")), 0.1);
		RiverSnapper.snap(sq, forest, 1.0, 3.0, true);

		LineString reach = forest.node(0).getReach();
		assertEquals(3, reach.getNumPoints());
		assertTrue(reach.getCoordinateN(1).equals2D(new Coordinate(100, 100)));
		assertEquals(5, sq.piece(0).getNumPoints());
		// the river now only touches the boundary at the shared corner
		assertTrue(reach.intersection(sq.piece(0)).equalsTopo(reach.getFactory().createPoint(new Coordinate(100, 100))));
	}

	@Test
	void riverVertexOnBoundaryIsAddedToThePiece() throws ParseException {
		SplitBoundary sq = square();
		RiverForest forest = RiverForest.build(Collections.singletonList(line("LINESTRING (50 50, 100 50, 150 60)")), 0.1);
		RiverSnapper.snap(sq, forest, 0.1, 0, true);

		assertEquals(6, sq.piece(0).getNumPoints());
		assertTrue(contains(sq.piece(0), new Coordinate(100, 50)));
		assertEquals(3, forest.node(0).getReach().getNumPoints());
		assertEquals(10000, sq.polygon(0).getArea(), 1e-9);
	}

	@Test
	void boundaryVertexOnRiverIsAddedToTheReach() throws ParseException {
		SplitBoundary sq = square();
		RiverForest forest = RiverForest.build(Collections.singletonList(line("LINESTRING (50 -50, 150 50)")), 0.1);
		RiverSnapper.snap(sq, forest, 0.1, 0, true);

		LineString reach = forest.node(0).getReach();
		assertEquals(3, reach.getNumPoints());
		assertTrue(reach.getCoordinateN(1).equals2D(new Coordinate(100, 0)));
		assertEquals(5, sq.piece(0).getNumPoints());
	}

	@Test
	void emptyForestIsUntouched() {
		RiverForest forest = RiverForest.empty(boundary.getFactory());
		assertEquals(0, RiverSnapper.snap(boundary, forest, 0.1, 0.3, true));
		assertSame(boundary.getFactory(), forest.getFactory());
	}
}
