package com.github.micycle1.hydromesh.triangulation;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.operation.distance.IndexedFacetDistance;

import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.util.GeometryUtil;

/**
 * Per-triangle quality measures of a finished mesh: area, distance from the
 * centroid to the nearest river and whether the refinement predicate still
 * fires.
 */
public final class TriangulationDiagnostics {

	private final double[] areas;
	private final double[] riverDistances;
	private final boolean[] flagged;

	private TriangulationDiagnostics(double[] areas, double[] riverDistances, boolean[] flagged) {
		this.areas = areas;
		this.riverDistances = riverDistances;
		this.flagged = flagged;
	}

	public static TriangulationDiagnostics of(Mesh mesh, RiverForest forest, RefinementPredicate predicate) {
		int n = mesh.getTriangleCount();
		double[] areas = new double[n];
		double[] distances = new double[n];
		boolean[] flagged = new boolean[n];
		IndexedFacetDistance rivers = forest.isEmpty() ? null : new IndexedFacetDistance(forest.forestToList());
		GeometryFactory gf = forest.getFactory();
		for (int t = 0; t < n; t++) {
			Coordinate[] tri = mesh.triangle(t);
			areas[t] = GeometryUtil.triangleArea(tri);
			distances[t] = rivers == null ? Double.POSITIVE_INFINITY : rivers.distance(gf.createPoint(GeometryUtil.centroid(tri)));
			flagged[t] = predicate.needsRefinement(tri, areas[t]);
		}
		return new TriangulationDiagnostics(areas, distances, flagged);
	}

	public double[] getAreas() {
		return areas;
	}

	public double[] getRiverDistances() {
		return riverDistances;
	}

	public boolean[] getFlagged() {
		return flagged;
	}

	public int flaggedCount() {
		int count = 0;
		for (boolean f : flagged) {
			if (f) {
				count++;
			}
		}
		return count;
	}

	public double minArea() {
		return GeometryUtil.min(areas);
	}

	public double medianArea() {
		return GeometryUtil.median(areas);
	}

	public double maxArea() {
		double max = Double.NaN;
		for (double a : areas) {
			max = Double.isNaN(max) ? a : Math.max(max, a);
		}
		return max;
	}
}
