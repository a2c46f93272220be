package com.github.micycle1.hydromesh.source;

import java.util.Objects;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the smallest HUC containing a shape by descending the HUC hierarchy
 * from a hint.
 */
public class HucLocator {

	private static final Logger LOGGER = LoggerFactory.getLogger(HucLocator.class);

	private enum Containment {
		NONE, PARTIAL, FULL
	}

	private final CoordinateReprojector reprojector;

	public HucLocator(CoordinateReprojector reprojector) {
		this.reprojector = Objects.requireNonNull(reprojector);
	}

	/**
	 * @param shape        shape to locate, in {@code crs}
	 * @param hint         HUC to start from; must contain the shape
	 * @param shrinkFactor fraction of the shape's equivalent radius it is shrunk
	 *                     by before containment checks, so shapes lying on a HUC
	 *                     boundary still count as inside
	 * @return code of the smallest HUC fully containing the shape
	 * @throws IllegalStateException if the hint does not contain the shape
	 */
	public String find(ShapeSource source, Geometry shape, Crs crs, String hint, double shrinkFactor) {
		Validate.isTrue(shrinkFactor >= 0, "Shrink factor must be non-negative: %f", shrinkFactor);
		double radius = Math.sqrt(shape.getArea() / Math.PI);
		Geometry shrunk = shape.buffer(-shrinkFactor * radius);

		String code = HucCodes.normalize(hint);
		ShapeCollection<HucFeature> hinted = source.getHuc(code);
		Geometry hintShape = reprojector.reproject(hinted.getItems().get(0).getShape(), hinted.getCrs(), crs);
		if (containment(shrunk, hintShape) != Containment.FULL) {
			throw new IllegalStateException(source.getName() + ": shape not found in hinted HUC '" + code + "'");
		}
		return descend(source, shrunk, crs, code);
	}

	private String descend(ShapeSource source, Geometry shape, Crs crs, String hint) {
		LOGGER.debug("searching: {}", hint);
		int searchLevel = hint.length() + 2;
		if (searchLevel > source.getLowestLevel()) {
			return hint;
		}
		ShapeCollection<HucFeature> subs = source.getHucs(hint, searchLevel);
		for (HucFeature sub : subs.getItems()) {
			Geometry subShape = reprojector.reproject(sub.getShape(), subs.getCrs(), crs);
			switch (containment(shape, subShape)) {
				case FULL:
					LOGGER.debug("  subhuc: {} contains", sub.getCode());
					return descend(source, shape, crs, sub.getCode());
				case PARTIAL:
					LOGGER.debug("  subhuc: {} partially contains", sub.getCode());
					return hint;
				default:
					LOGGER.debug("  subhuc: {} does not contain", sub.getCode());
			}
		}
		throw new IllegalStateException(source.getName() + ": no level " + searchLevel + " HUC in '" + hint + "' intersects the shape");
	}

	private static Containment containment(Geometry shape, Geometry huc) {
		if (huc.contains(shape)) {
			return Containment.FULL;
		}
		return huc.intersects(shape) ? Containment.PARTIAL : Containment.NONE;
	}
}
