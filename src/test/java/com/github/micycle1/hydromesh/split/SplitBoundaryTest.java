package com.github.micycle1.hydromesh.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.algorithm.distance.DiscreteHausdorffDistance;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import com.github.micycle1.hydromesh.TopologyException;

class SplitBoundaryTest {

	private static final double DELTA = 1e-9;
	private final WKTReader reader = new WKTReader();

	private Polygon poly(String wkt) throws ParseException {
		return (Polygon) reader.read(wkt);
	}

	private SplitBoundary twoSquares() throws ParseException {
		Polygon a = poly("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
		Polygon b = poly("POLYGON ((10 0, 20 0, 20 10, 10 10, 10 0))");
		return new SplitBoundary(Arrays.asList(a, b));
	}

	private SplitBoundary wigglyWall() throws ParseException {
		Polygon a = poly("POLYGON ((0 0, 10 0, 10.05 3, 9.95 6, 10 10, 0 10, 0 0))");
		Polygon b = poly("POLYGON ((10 0, 20 0, 20 10, 10 10, 9.95 6, 10.05 3, 10 0))");
		return new SplitBoundary(Arrays.asList(a, b));
	}

	@Test
	@DisplayName("Two squares share exactly one wall, each keeps one unique piece")
	void twoSquaresScenario() throws ParseException {
		SplitBoundary sb = twoSquares();
		assertEquals(2, sb.getPolygonCount());
		assertEquals(3, sb.getPieceCount());

		List<LineString> shared = sb.sharedPieces(0, 1);
		assertEquals(1, shared.size());
		assertTrue(shared.get(0).equalsTopo(reader.read("LINESTRING (10 0, 10 10)")));
		assertEquals(2, shared.get(0).getNumPoints());

		for (int i = 0; i < 2; i++) {
			List<LineString> unique = sb.uniquePieces(i);
			assertEquals(1, unique.size());
			assertEquals(4, unique.get(0).getNumPoints());
			assertEquals(30, unique.get(0).getLength(), DELTA);
		}
		assertEquals(1, sb.sharedPieceIds().size());
		for (int i = 0; i < 2; i++) {
			assertEquals(0, sb.polygon(i).getNumInteriorRing());
		}
	}

	@Test
	@DisplayName("Polygons are reconstructed from their pieces")
	void roundTrip() throws ParseException {
		Polygon a = poly("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
		Polygon b = poly("POLYGON ((10 0, 20 0, 20 10, 10 10, 10 0))");
		Polygon c = poly("POLYGON ((0 10, 20 10, 20 15, 0 15, 0 10))");
		SplitBoundary sb = new SplitBoundary(Arrays.asList(a, b, c));
		assertTrue(sb.polygon(0).equalsTopo(a));
		assertTrue(sb.polygon(1).equalsTopo(b));
		assertTrue(sb.polygon(2).equalsTopo(c));

		double total = 0;
		for (LineString piece : sb.segments()) {
			total += piece.getLength();
		}
		// every wall counted once: outer rectangle 70 plus internal walls 10 + 20
		assertEquals(100, total, DELTA);
	}

	@Test
	void polygonWithHoleRoundTrips() throws ParseException {
		Polygon donut = poly("POLYGON ((0 0, 30 0, 30 30, 0 30, 0 0), (10 10, 20 10, 20 20, 10 20, 10 10))");
		Polygon inner = poly("POLYGON ((10 10, 20 10, 20 20, 10 20, 10 10))");
		SplitBoundary sb = new SplitBoundary(Arrays.asList(donut, inner));
		assertTrue(sb.polygon(0).equalsTopo(donut));
		assertEquals(1, sb.polygon(0).getNumInteriorRing());
		assertEquals(1, sb.sharedPieces(0, 1).size());
		assertEquals(900, sb.exterior().getArea(), DELTA);
	}

	@Test
	void exteriorAndExteriorBoundary() throws ParseException {
		SplitBoundary sb = twoSquares();
		Geometry exterior = sb.exterior();
		assertEquals(200, exterior.getArea(), DELTA);
		assertEquals(60, sb.exteriorBoundary().getLength(), DELTA);
	}

	@Test
	@DisplayName("Simplifying a shared wall cannot open a crack")
	void simplifyKeepsNeighboursTogether() throws ParseException {
		SplitBoundary sb = wigglyWall();
		sb.simplify(0.5);

		LineString wall = sb.sharedPieces(0, 1).get(0);
		assertEquals(2, wall.getNumPoints());
		Polygon a = sb.polygon(0);
		Polygon b = sb.polygon(1);
		assertTrue(a.isValid());
		assertTrue(b.isValid());
		assertEquals(0, a.intersection(b).getArea(), DELTA);
		assertEquals(200, a.union(b).getArea(), DELTA);
		assertEquals(200, sb.exterior().getArea(), DELTA);
	}

	@Test
	void simplifyIsIdempotentWithinTolerance() throws ParseException {
		double tol = 0.5;
		SplitBoundary sb = wigglyWall();
		sb.simplify(tol);
		Polygon once = sb.polygon(0);
		sb.simplify(tol);
		Polygon twice = sb.polygon(0);
		assertTrue(DiscreteHausdorffDistance.distance(once, twice) <= tol);
	}

	@Test
	void simplifyWithZeroToleranceIsNoOp() throws ParseException {
		SplitBoundary sb = wigglyWall();
		int before = sb.sharedPieces(0, 1).get(0).getNumPoints();
		sb.simplify(0);
		assertEquals(before, sb.sharedPieces(0, 1).get(0).getNumPoints());
	}

	@Test
	@DisplayName("A wall claimed by three polygons is rejected")
	void wallSharedByThreePolygonsThrows() throws ParseException {
		Polygon a = poly("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
		Polygon b = poly("POLYGON ((10 0, 20 0, 20 10, 10 10, 10 0))");
		Polygon c = poly("POLYGON ((10 2, 12 2, 12 8, 10 8, 10 2))");
		assertThrows(TopologyException.class, () -> new SplitBoundary(Arrays.asList(a, b, c)));
	}

	@Test
	void replacePieceMustKeepEndpoints() throws ParseException {
		SplitBoundary sb = twoSquares();
		int id = sb.sharedPieceIds().get(PieceKey.of(0, 1)).get(0);
		LineString wall = sb.piece(id);
		LineString moved = (LineString) reader.read("LINESTRING (10 1, 10 10)");
		assertThrows(IllegalArgumentException.class, () -> sb.replacePiece(id, moved));

		LineString bent = sb.getFactory().createLineString(new Coordinate[] { wall.getCoordinateN(0),
				new Coordinate(10, 5), wall.getCoordinateN(1) });
		sb.replacePiece(id, bent);
		assertEquals(3, sb.sharedPieces(0, 1).get(0).getNumPoints());
		assertEquals(100, sb.polygon(0).getArea(), DELTA);
	}
}
