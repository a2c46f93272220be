package com.github.micycle1.hydromesh.clean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
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

class TopologyCleanerTest {

	private final WKTReader reader = new WKTReader();
	private final TopologyCleaner cleaner = new TopologyCleaner();
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
	void filterKeepsReachesTouchingTheBufferedShape() throws ParseException {
		List<LineString> reaches = Arrays.asList(line("LINESTRING (5 5, 6 6)"), line("LINESTRING (20.05 5, 30 5)"),
				line("LINESTRING (50 50, 60 60)"));
		List<LineString> kept = TopologyCleaner.filterRiversToShape(boundary.exterior(), reaches, 0.1);
		assertEquals(2, kept.size());
		assertEquals(1, TopologyCleaner.filterRiversToShape(boundary.exterior(), reaches, 0).size());
	}

	@Test
	@DisplayName("Pipeline snaps the outlet onto the boundary and drops far reaches")
	void simplifyAndPrune() throws ParseException {
		List<LineString> reaches = Arrays.asList(line("LINESTRING (5 5, 9.9 0.1)"), line("LINESTRING (100 100, 110 110)"));
		CleanedTopology result = cleaner.simplifyAndPrune(boundary, reaches, 0.1, 0, false);

		RiverForest rivers = result.getRivers();
		assertEquals(1, rivers.nodeCount());
		assertTrue(rivers.node(0).outlet().equals2D(new Coordinate(10, 0)));
		assertEquals(1, result.getRiverStats().getLineCount());
		assertEquals(3, result.getBoundaryStats().getLineCount());
		assertEquals(10, result.getBoundaryStats().getMin(), 1e-9);
	}

	@Test
	@DisplayName("No reach inside the boundary is a valid, empty result")
	void emptyResultIsNotAnError() throws ParseException {
		List<LineString> reaches = Collections.singletonList(line("LINESTRING (100 100, 110 110)"));
		CleanedTopology result = cleaner.simplifyAndPrune(boundary, reaches, 0.1, 0, false);
		assertTrue(result.getRivers().isEmpty());
		assertEquals(0, result.getRiverStats().getLineCount());
		assertTrue(Double.isNaN(result.getRiverStats().getMin()));
		assertEquals(200, result.getBoundary().exterior().getArea(), 1e-9);
	}

	@Test
	void pruningEverythingIsNotAnError() throws ParseException {
		List<LineString> reaches = Arrays.asList(line("LINESTRING (2 2, 4 4)"), line("LINESTRING (12 2, 14 4)"));
		CleanedTopology result = cleaner.simplifyAndPrune(boundary, reaches, 0.1, 2, false);
		assertTrue(result.getRivers().isEmpty());
	}

	@Test
	void negativeToleranceIsRejected() {
		assertThrows(IllegalArgumentException.class,
				() -> cleaner.simplifyAndPrune(boundary, Collections.emptyList(), -1, 0, false));
	}
}
