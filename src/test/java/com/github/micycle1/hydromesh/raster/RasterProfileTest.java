package com.github.micycle1.hydromesh.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;

import com.github.micycle1.hydromesh.source.Crs;

class RasterProfileTest {

	private final RasterProfile profile = RasterProfile.fromOrigin(Crs.epsg(5070), 100, 300, 10, 4, 3, -9999);

	@Test
	void pixelAndWorldAgree() {
		Coordinate centre = profile.pixelCenter(1, 2);
		assertEquals(125, centre.x, 1e-12);
		assertEquals(285, centre.y, 1e-12);
		Coordinate pixel = profile.toPixel(centre);
		assertEquals(2.5, pixel.x, 1e-12);
		assertEquals(1.5, pixel.y, 1e-12);
	}

	@Test
	void bounds() {
		assertEquals(new Envelope(100, 140, 270, 300), profile.bounds());
	}

	@Test
	void singularTransformIsRejected() {
		AffineTransformation flat = new AffineTransformation(1, 0, 0, 1, 0, 0);
		assertThrows(IllegalArgumentException.class, () -> new RasterProfile(Crs.epsg(5070), flat, 4, 3, 0));
	}
}
