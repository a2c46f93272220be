package com.github.micycle1.hydromesh.triangulation;

import org.locationtech.jts.geom.Coordinate;

/**
 * Decides whether a triangle is too coarse. Kernels may call it any number of
 * times, so implementations must be side-effect free.
 */
@FunctionalInterface
public interface RefinementPredicate {

	/**
	 * @param triangle the triangle's three vertices
	 * @param area     its (unsigned) area
	 * @return true if the triangle should be split
	 */
	boolean needsRefinement(Coordinate[] triangle, double area);

	default RefinementPredicate or(RefinementPredicate other) {
		return (t, a) -> needsRefinement(t, a) || other.needsRefinement(t, a);
	}

	static RefinementPredicate never() {
		return (t, a) -> false;
	}
}
