package com.github.micycle1.hydromesh.triangulation;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.operation.distance.IndexedFacetDistance;

import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.util.GeometryUtil;

/**
 * Factory methods for the standard refinement criteria.
 */
public class RefinementPredicates {

	private RefinementPredicates() {
	}

	/**
	 * Refines triangles larger than {@code maxArea}.
	 */
	public static RefinementPredicate maxArea(double maxArea) {
		Validate.isTrue(maxArea > 0, "Max area must be positive: %f", maxArea);
		return (triangle, area) -> area > maxArea;
	}

	/**
	 * Refines by an area ceiling that depends on the distance d from the
	 * triangle's centroid to the nearest river: {@code nearArea} when d is below
	 * {@code nearDistance}, {@code farArea} when above {@code farDistance}, and
	 * linearly interpolated in between. With no rivers every triangle is "far".
	 */
	public static RefinementPredicate riverDistance(double nearDistance, double nearArea, double farDistance, double farArea,
			RiverForest forest) {
		Validate.isTrue(nearDistance >= 0 && farDistance > nearDistance, "Need 0 <= nearDistance < farDistance");
		Validate.isTrue(nearArea > 0 && farArea > 0, "Area ceilings must be positive");
		final IndexedFacetDistance rivers = forest.isEmpty() ? null : new IndexedFacetDistance(forest.forestToList());
		return (triangle, area) -> {
			double d = rivers == null ? Double.POSITIVE_INFINITY
					: rivers.distance(forest.getFactory().createPoint(GeometryUtil.centroid(triangle)));
			return area > areaCeiling(d, nearDistance, nearArea, farDistance, farArea);
		};
	}

	static double areaCeiling(double d, double nearDistance, double nearArea, double farDistance, double farArea) {
		if (d < nearDistance) {
			return nearArea;
		}
		if (d > farDistance) {
			return farArea;
		}
		return nearArea + (farArea - nearArea) * (d - nearDistance) / (farDistance - nearDistance);
	}

	/**
	 * Refines triangles with any edge longer than {@code maxLength}.
	 */
	public static RefinementPredicate maxEdgeLength(double maxLength) {
		Validate.isTrue(maxLength > 0, "Max edge length must be positive: %f", maxLength);
		return (triangle, area) -> GeometryUtil.maxEdgeLength(triangle) > maxLength;
	}

	/**
	 * Refines when at least one of the predicates does; an empty list never
	 * refines.
	 */
	public static RefinementPredicate anyOf(List<RefinementPredicate> predicates) {
		final List<RefinementPredicate> copy = new ArrayList<>(predicates);
		return (triangle, area) -> {
			for (RefinementPredicate p : copy) {
				if (p.needsRefinement(triangle, area)) {
					return true;
				}
			}
			return false;
		};
	}
}
