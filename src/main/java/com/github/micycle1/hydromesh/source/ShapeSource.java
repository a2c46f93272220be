package com.github.micycle1.hydromesh.source;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;

import com.github.micycle1.hydromesh.raster.Raster;

/**
 * A provider of watershed boundaries, hydrography and rasters, e.g. a national
 * dataset. Implementations handle download and caching.
 */
public interface ShapeSource {

	String getName();

	/**
	 * Finest HUC level this source can return.
	 */
	int getLowestLevel();

	/**
	 * All HUCs of the given level inside {@code huc}.
	 */
	ShapeCollection<HucFeature> getHucs(String huc, int level);

	/**
	 * The single HUC with the given code.
	 */
	default ShapeCollection<HucFeature> getHuc(String huc) {
		String code = HucCodes.normalize(huc);
		ShapeCollection<HucFeature> found = getHucs(code, code.length());
		if (found.size() != 1) {
			throw new IllegalStateException(getName() + ": expected one HUC for '" + code + "', found " + found.size());
		}
		return found;
	}

	/**
	 * Reaches in {@code huc}, optionally restricted to those intersecting the
	 * bounds.
	 *
	 * @param bounds    may be null
	 * @param boundsCrs CRS of the bounds; ignored when bounds is null
	 */
	ShapeCollection<LineString> getHydro(String huc, Envelope bounds, Crs boundsCrs);

	/**
	 * A raster covering the shape.
	 */
	Raster getRaster(Geometry shape, Crs crs);
}
