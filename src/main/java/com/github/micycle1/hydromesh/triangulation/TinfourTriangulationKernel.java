package com.github.micycle1.hydromesh.triangulation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tinfour.common.IConstraint;
import org.tinfour.common.LinearConstraint;
import org.tinfour.common.SimpleTriangle;
import org.tinfour.common.Vertex;
import org.tinfour.standard.IncrementalTin;

import com.github.micycle1.hydromesh.HydroConstants;
import com.github.micycle1.hydromesh.TopologyException;
import com.github.micycle1.hydromesh.util.CanonicalSegment;
import com.github.micycle1.hydromesh.util.GeometryUtil;

/**
 * Constrained triangulation backed by a TinFour {@link IncrementalTin}.
 * <p>
 * Each refinement pass builds a constrained TIN from the working vertices and
 * segments, keeps the triangles whose centroid lies inside the domain (which
 * drops the convex-hull fill and holes) and bisects the longest edge of every
 * kept triangle that the predicate or the minimum angle flags. A bisected
 * constraint segment is replaced by its two halves. Passes repeat until no
 * triangle is flagged or the pass limit is hit.
 */
public class TinfourTriangulationKernel implements ConstrainedTriangulationKernel {

	private static final Logger LOGGER = LoggerFactory.getLogger(TinfourTriangulationKernel.class);

	private final int maxPasses;

	public TinfourTriangulationKernel() {
		this(HydroConstants.DEFAULT_MAX_REFINEMENT_PASSES);
	}

	public TinfourTriangulationKernel(int maxPasses) {
		Validate.isTrue(maxPasses >= 0, "Pass limit must be non-negative: %d", maxPasses);
		this.maxPasses = maxPasses;
	}

	@Override
	public Mesh triangulate(Pslg pslg, RefinementPredicate predicate, Double minAngle, boolean enforceDelaunay) {
		List<Coordinate> points = new ArrayList<>();
		Map<Coordinate, Integer> index = new HashMap<>();
		for (Coordinate c : pslg.getVertices()) {
			index.put(c, points.size());
			points.add(c);
		}
		Set<CanonicalSegment> segments = new LinkedHashSet<>(pslg.getSegments());
		IndexedPointInAreaLocator locator = new IndexedPointInAreaLocator(pslg.getDomain());
		double spacing = nominalSpacing(pslg.getDomain().getArea(), points.size());

		int pass = 0;
		while (true) {
			List<int[]> triangles = new ArrayList<>();
			IncrementalTin tin = buildTin(points, segments, spacing, false);
			List<Coordinate> extra = collectTriangles(tin, index, points.size(), locator, triangles);
			tin.dispose();
			if (!extra.isEmpty()) {
				throw new TopologyException("Triangulation introduced " + extra.size() + " unexpected vertices, first at " + extra.get(0));
			}

			List<Coordinate[]> flagged = new ArrayList<>();
			for (int[] t : triangles) {
				Coordinate[] tri = { points.get(t[0]), points.get(t[1]), points.get(t[2]) };
				double area = GeometryUtil.triangleArea(tri);
				if (predicate.needsRefinement(tri, area) || (minAngle != null && GeometryUtil.minAngleDegrees(tri) < minAngle)) {
					flagged.add(tri);
				}
			}
			LOGGER.debug("  pass {}: {} triangles, {} flagged", pass, triangles.size(), flagged.size());
			if (flagged.isEmpty()) {
				break;
			}
			if (pass == maxPasses) {
				LOGGER.warn("Refinement did not converge after {} passes; {} triangles still flagged", maxPasses, flagged.size());
				break;
			}
			if (bisect(flagged, points, index, segments) == 0) {
				LOGGER.warn("Refinement stalled; {} flagged triangles cannot be split further", flagged.size());
				break;
			}
			spacing = nominalSpacing(pslg.getDomain().getArea(), points.size());
			pass++;
		}

		List<int[]> triangles = new ArrayList<>();
		IncrementalTin tin = buildTin(points, segments, spacing, enforceDelaunay);
		List<Coordinate> extra = collectTriangles(tin, index, points.size(), locator, triangles);
		tin.dispose();
		points.addAll(extra);
		LOGGER.info("  triangulated {} vertices into {} triangles after {} refinement passes", points.size(), triangles.size(), pass);
		return toMesh(points, triangles);
	}

	/*
	 * Adds the midpoint of the longest edge of each flagged triangle. Returns the
	 * number of vertices added.
	 */
	private static int bisect(List<Coordinate[]> flagged, List<Coordinate> points, Map<Coordinate, Integer> index,
			Set<CanonicalSegment> segments) {
		int added = 0;
		for (Coordinate[] tri : flagged) {
			int e = GeometryUtil.longestEdge(tri);
			Coordinate a = tri[e];
			Coordinate b = tri[(e + 1) % 3];
			Coordinate mid = new Coordinate((a.x + b.x) / 2, (a.y + b.y) / 2);
			if (index.containsKey(mid) || mid.equals2D(a) || mid.equals2D(b)) {
				continue;
			}
			int m = points.size();
			index.put(mid, m);
			points.add(mid);
			added++;

			CanonicalSegment edge = new CanonicalSegment(index.get(a), index.get(b));
			if (segments.remove(edge)) {
				segments.add(new CanonicalSegment(edge.getV0(), m));
				segments.add(new CanonicalSegment(m, edge.getV1()));
			}
		}
		return added;
	}

	private static IncrementalTin buildTin(List<Coordinate> points, Set<CanonicalSegment> segments, double spacing,
			boolean restoreConformity) {
		final IncrementalTin tin = new IncrementalTin(spacing);
		final List<Vertex> vertices = new ArrayList<>(points.size());
		for (int i = 0; i < points.size(); i++) {
			Coordinate c = points.get(i);
			vertices.add(new Vertex(c.x, c.y, Double.NaN, i));
		}
		if (!tin.add(vertices, null)) {
			throw new TopologyException("Cannot triangulate " + points.size() + " vertices: too few or all collinear");
		}

		List<IConstraint> constraints = new ArrayList<>(segments.size());
		for (CanonicalSegment s : segments) {
			LinearConstraint constraint = new LinearConstraint();
			constraint.add(vertices.get(s.getV0()));
			constraint.add(vertices.get(s.getV1()));
			constraint.complete();
			constraints.add(constraint);
		}
		if (!constraints.isEmpty()) {
			tin.addConstraints(constraints, restoreConformity);
		}
		return tin;
	}

	/*
	 * Appends every triangle inside the domain, counter-clockwise, to the output
	 * list. Returns tin vertices that are not among the known points; they are
	 * numbered from firstExtra on.
	 */
	private static List<Coordinate> collectTriangles(IncrementalTin tin, Map<Coordinate, Integer> index, int firstExtra,
			IndexedPointInAreaLocator locator, List<int[]> out) {
		Map<Coordinate, Integer> extraIndex = new HashMap<>();
		List<Coordinate> extra = new ArrayList<>();
		for (SimpleTriangle t : tin.triangles()) {
			Vertex[] tv = { t.getVertexA(), t.getVertexB(), t.getVertexC() };
			if (tv[0] == null || tv[1] == null || tv[2] == null) {
				continue;
			}
			Coordinate[] tri = new Coordinate[3];
			for (int i = 0; i < 3; i++) {
				tri[i] = new Coordinate(tv[i].getX(), tv[i].getY());
			}
			if (GeometryUtil.triangleArea(tri) <= HydroConstants.ZERO_AREA
					|| locator.locate(GeometryUtil.centroid(tri)) != Location.INTERIOR) {
				continue;
			}
			int[] ids = new int[3];
			for (int i = 0; i < 3; i++) {
				Integer id = index.get(tri[i]);
				if (id == null) {
					id = extraIndex.get(tri[i]);
					if (id == null) {
						id = firstExtra + extra.size();
						extraIndex.put(tri[i], id);
						extra.add(tri[i]);
					}
				}
				ids[i] = id;
			}
			if (GeometryUtil.signedArea2(tri[0], tri[1], tri[2]) < 0) {
				int tmp = ids[1];
				ids[1] = ids[2];
				ids[2] = tmp;
			}
			out.add(ids);
		}
		return extra;
	}

	private static Mesh toMesh(List<Coordinate> points, List<int[]> triangles) {
		double[][] vertices = new double[points.size()][];
		for (int i = 0; i < points.size(); i++) {
			vertices[i] = new double[] { points.get(i).x, points.get(i).y };
		}
		return new Mesh(vertices, triangles.toArray(new int[0][]));
	}

	private static double nominalSpacing(double area, int vertexCount) {
		double spacing = Math.sqrt(area / Math.max(vertexCount, 1));
		return spacing > 0 ? spacing : 1;
	}
}
