package com.github.micycle1.hydromesh.clean;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.Pair;
import org.locationtech.jts.algorithm.LineIntersector;
import org.locationtech.jts.algorithm.RobustLineIntersector;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateList;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.river.RiverNode;
import com.github.micycle1.hydromesh.split.SplitBoundary;

/**
 * Welds river endpoints onto boundary vertices and, optionally, cuts boundary
 * segments where rivers cross them, so that the triangulation sees shared
 * vertices instead of crossing constraints.
 */
public class RiverSnapper {

	private static final Logger LOGGER = LoggerFactory.getLogger(RiverSnapper.class);

	private RiverSnapper() {
	}

	/**
	 * Snaps the forest onto the boundary, both modified in place.
	 * <p>
	 * Every distinct river endpoint within {@code snapRadius} of a boundary vertex
	 * is moved exactly onto the nearest such vertex. Of equidistant vertices the
	 * first in {@link SplitBoundary#segments()} order wins. Endpoints shared by
	 * several reaches (junctions) move together. Endpoints with no vertex in
	 * range are left where they are.
	 *
	 * @param tolerance         crossings this close to a boundary vertex are
	 *                          routed through that vertex
	 * @param snapRadius        search radius around each endpoint
	 * @param cutIntersections  make rivers and boundary share a vertex wherever
	 *                          they meet: a crossing is inserted into both lines
	 *                          (or, within {@code tolerance} of a boundary vertex,
	 *                          that vertex into the river), and a vertex of one
	 *                          line lying inside a segment of the other is
	 *                          inserted into the other
	 * @return number of endpoints moved
	 */
	public static int snap(SplitBoundary boundary, RiverForest forest, double tolerance, double snapRadius, boolean cutIntersections) {
		Validate.isTrue(snapRadius >= 0, "Snap radius must be non-negative: %f", snapRadius);
		if (forest.isEmpty()) {
			return 0;
		}
		int moved = snapEndpoints(boundary, forest, snapRadius);
		int cuts = cutIntersections ? cutCrossings(boundary, forest, tolerance) : 0;
		LOGGER.info("  snapped {} river endpoints, cut {} boundary crossings", moved, cuts);
		return moved;
	}

	private static int snapEndpoints(SplitBoundary boundary, RiverForest forest, double snapRadius) {
		STRtree index = new STRtree();
		int order = 0;
		for (LineString piece : boundary.segments()) {
			for (Coordinate c : piece.getCoordinates()) {
				index.insert(new Envelope(c), new BoundaryVertex(order++, c));
			}
		}

		// endpoint -> (node id, is inlet)
		Map<Coordinate, List<Pair<Integer, Boolean>>> ends = new LinkedHashMap<>();
		for (RiverNode node : forest.dfs()) {
			ends.computeIfAbsent(node.inlet().copy(), k -> new ArrayList<>()).add(Pair.of(node.getId(), true));
			ends.computeIfAbsent(node.outlet().copy(), k -> new ArrayList<>()).add(Pair.of(node.getId(), false));
		}

		int moved = 0;
		for (Map.Entry<Coordinate, List<Pair<Integer, Boolean>>> e : ends.entrySet()) {
			Coordinate end = e.getKey();
			Envelope search = new Envelope(end);
			search.expandBy(snapRadius);
			BoundaryVertex best = null;
			double bestDistance = Double.POSITIVE_INFINITY;
			for (Object o : index.query(search)) {
				BoundaryVertex v = (BoundaryVertex) o;
				double d = v.coordinate.distance(end);
				if (d > snapRadius) {
					continue;
				}
				if (d < bestDistance || (d == bestDistance && v.order < best.order)) {
					best = v;
					bestDistance = d;
				}
			}
			if (best == null) {
				LOGGER.debug("    endpoint {} has no boundary vertex within {}", end, snapRadius);
				continue;
			}
			if (best.coordinate.equals2D(end)) {
				continue;
			}
			for (Pair<Integer, Boolean> ref : e.getValue()) {
				RiverNode node = forest.node(ref.getLeft());
				Coordinate[] coords = node.getReach().getCoordinates().clone();
				coords[ref.getRight() ? 0 : coords.length - 1] = best.coordinate.copy();
				node.setReach(node.getReach().getFactory().createLineString(coords));
			}
			moved++;
		}
		return moved;
	}

	private static int cutCrossings(SplitBoundary boundary, RiverForest forest, double tolerance) {
		STRtree riverSegments = new STRtree();
		for (RiverNode node : forest.nodes()) {
			Coordinate[] coords = node.getReach().getCoordinates();
			for (int r = 0; r < coords.length - 1; r++) {
				riverSegments.insert(new Envelope(coords[r], coords[r + 1]), new int[] { node.getId(), r });
			}
		}

		LineIntersector li = new RobustLineIntersector();
		// (line id, segment index) -> crossing points
		Map<Integer, Map<Integer, List<Coordinate>>> pieceCuts = new TreeMap<>();
		Map<Integer, Map<Integer, List<Coordinate>>> reachCuts = new TreeMap<>();
		int cuts = 0;
		for (int id = 0; id < boundary.getPieceCount(); id++) {
			Coordinate[] coords = boundary.piece(id).getCoordinates();
			for (int k = 0; k < coords.length - 1; k++) {
				Coordinate p0 = coords[k];
				Coordinate p1 = coords[k + 1];
				for (Object o : riverSegments.query(new Envelope(p0, p1))) {
					int[] ref = (int[]) o;
					Coordinate[] reach = forest.node(ref[0]).getReach().getCoordinates();
					Coordinate q0 = reach[ref[1]];
					Coordinate q1 = reach[ref[1] + 1];
					li.computeIntersection(p0, p1, q0, q1);
					for (int n = 0; n < li.getIntersectionNum(); n++) {
						Coordinate x = li.getIntersection(n);
						boolean onBoundaryVertex = x.equals2D(p0) || x.equals2D(p1);
						boolean onRiverVertex = x.equals2D(q0) || x.equals2D(q1);
						if (onBoundaryVertex && onRiverVertex) {
							continue;
						}
						if (onRiverVertex) {
							// river vertex inside the boundary segment
							addCut(pieceCuts, id, k, x);
						} else if (onBoundaryVertex) {
							// boundary vertex inside the river segment
							addCut(reachCuts, ref[0], ref[1], x);
						} else if (x.distance(p0) <= tolerance || x.distance(p1) <= tolerance) {
							// crossing next to a boundary vertex: route the river through that vertex
							addCut(reachCuts, ref[0], ref[1], x.distance(p0) <= x.distance(p1) ? p0 : p1);
						} else {
							addCut(pieceCuts, id, k, x);
							addCut(reachCuts, ref[0], ref[1], x);
						}
						cuts++;
					}
				}
			}
		}

		for (Map.Entry<Integer, Map<Integer, List<Coordinate>>> e : pieceCuts.entrySet()) {
			LineString piece = boundary.piece(e.getKey());
			boundary.replacePiece(e.getKey(), piece.getFactory().createLineString(insertPoints(piece.getCoordinates(), e.getValue())));
		}
		for (Map.Entry<Integer, Map<Integer, List<Coordinate>>> e : reachCuts.entrySet()) {
			RiverNode node = forest.node(e.getKey());
			LineString reach = node.getReach();
			node.setReach(reach.getFactory().createLineString(insertPoints(reach.getCoordinates(), e.getValue())));
		}
		return cuts;
	}

	private static void addCut(Map<Integer, Map<Integer, List<Coordinate>>> cuts, int line, int segment, Coordinate point) {
		cuts.computeIfAbsent(line, i -> new TreeMap<>()).computeIfAbsent(segment, i -> new ArrayList<>()).add(point.copy());
	}

	/*
	 * Inserts points after the start vertex of the given segments, ordered along
	 * each segment.
	 */
	private static Coordinate[] insertPoints(Coordinate[] coords, Map<Integer, List<Coordinate>> bySegment) {
		CoordinateList out = new CoordinateList();
		for (int k = 0; k < coords.length; k++) {
			out.add(coords[k].copy(), true);
			List<Coordinate> points = bySegment.get(k);
			if (points != null && k < coords.length - 1) {
				Coordinate start = coords[k];
				points.sort(Comparator.comparingDouble(start::distance));
				for (Coordinate p : points) {
					out.add(p, false);
				}
			}
		}
		return out.toCoordinateArray();
	}

	private static final class BoundaryVertex {

		final int order;
		final Coordinate coordinate;

		BoundaryVertex(int order, Coordinate coordinate) {
			this.order = order;
			this.coordinate = coordinate;
		}
	}
}
