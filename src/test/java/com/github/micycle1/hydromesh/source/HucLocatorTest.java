package com.github.micycle1.hydromesh.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HucLocatorTest {

	private static final Crs CRS = Crs.epsg(5070);

	private final WKTReader reader = new WKTReader();
	private final HucLocator locator = new HucLocator(CoordinateReprojector.identity());

	@Mock
	private ShapeSource source;

	private HucFeature huc(String code, double x0, double y0, double x1, double y1) throws ParseException {
		Polygon p = (Polygon) reader.read(String.format("POLYGON ((%s %s, %s %s, %s %s, %s %s, %s %s))", x0, y0, x1, y0, x1, y1, x0, y1, x0, y0));
		return new HucFeature(code, p);
	}

	private Geometry box(double x0, double y0, double x1, double y1) throws ParseException {
		return huc("00", x0, y0, x1, y1).getShape();
	}

	@BeforeEach
	void setUp() throws ParseException {
		when(source.getHuc("06")).thenReturn(new ShapeCollection<>(CRS, Collections.singletonList(huc("06", 0, 0, 100, 100))));
	}

	@Test
	void descendsThroughFullContainment() throws ParseException {
		when(source.getLowestLevel()).thenReturn(6);
		when(source.getHucs("06", 4)).thenReturn(new ShapeCollection<>(CRS, Arrays.asList(huc("0601", 0, 0, 50, 100), huc("0602", 50, 0, 100, 100))));
		when(source.getHucs("0601", 6))
				.thenReturn(new ShapeCollection<>(CRS, Arrays.asList(huc("060101", 0, 50, 50, 100), huc("060102", 0, 0, 50, 50))));

		assertEquals("060102", locator.find(source, box(10, 10, 20, 20), CRS, "06", 1e-5));
	}

	@Test
	void partialContainmentStopsAtTheHint() throws ParseException {
		when(source.getLowestLevel()).thenReturn(12);
		when(source.getHucs("06", 4)).thenReturn(new ShapeCollection<>(CRS, Arrays.asList(huc("0601", 0, 0, 50, 100), huc("0602", 50, 0, 100, 100))));

		assertEquals("06", locator.find(source, box(40, 10, 60, 20), CRS, "6", 1e-5));
	}

	@Test
	void stopsAtTheLowestLevel() throws ParseException {
		when(source.getLowestLevel()).thenReturn(2);
		assertEquals("06", locator.find(source, box(10, 10, 20, 20), CRS, "06", 1e-5));
		verify(source, never()).getHucs("06", 4);
	}

	@Test
	void shapeOutsideHintIsAnError() throws ParseException {
		when(source.getName()).thenReturn("test");
		assertThrows(IllegalStateException.class, () -> locator.find(source, box(200, 200, 210, 210), CRS, "06", 1e-5));
	}
}
