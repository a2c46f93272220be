package com.github.micycle1.hydromesh.split;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.CoordinateList;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.linemerge.LineMerger;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.HydroConstants;
import com.github.micycle1.hydromesh.TopologyException;

/**
 * A collection of polygons stored in split form: every stretch of boundary is
 * held exactly once, either as a <i>unique</i> piece (owned by one polygon) or
 * as a <i>shared</i> piece (owned by the two polygons on either side of it).
 * Each polygon keeps an ordered list of piece ids which, chained end to end,
 * reconstructs its rings.
 * <p>
 * Because a shared wall is a single object, editing it (simplifying, inserting
 * crossing vertices) changes both neighbours identically and cannot open a
 * crack between them.
 */
public class SplitBoundary {

	private static final Logger LOGGER = LoggerFactory.getLogger(SplitBoundary.class);

	private final GeometryFactory gf;
	private final int polygonCount;

	private final List<LineString> pieces = new ArrayList<>();
	private final List<int[]> owners = new ArrayList<>();
	private final List<List<Integer>> uniques = new ArrayList<>();
	private final Map<PieceKey, List<Integer>> shared = new LinkedHashMap<>();
	// ordered piece ids per polygon, in ring-chaining order
	private final List<List<Integer>> polygonPieces = new ArrayList<>();

	/**
	 * Splits the polygons into unique and shared boundary pieces
	 * (intersect-and-split).
	 *
	 * @param polygons polygons that meet along shared boundaries but do not overlap
	 * @throws TopologyException if some stretch of boundary belongs to more than
	 *                           two polygons, or a polygon's pieces do not close
	 */
	public SplitBoundary(List<Polygon> polygons) {
		Validate.notEmpty(polygons, "At least one polygon is required");
		this.gf = polygons.get(0).getFactory();
		this.polygonCount = polygons.size();

		List<Geometry> boundaries = new ArrayList<>(polygonCount);
		List<List<LineString>> sharedLines = new ArrayList<>(polygonCount);
		for (Polygon p : polygons) {
			boundaries.add(p.getBoundary());
			sharedLines.add(new ArrayList<>());
			uniques.add(new ArrayList<>());
			polygonPieces.add(new ArrayList<>());
		}

		for (int i = 0; i < polygonCount; i++) {
			for (int j = i + 1; j < polygonCount; j++) {
				Geometry bi = boundaries.get(i);
				Geometry bj = boundaries.get(j);
				if (!bi.getEnvelopeInternal().intersects(bj.getEnvelopeInternal())) {
					continue;
				}
				List<LineString> lines = mergeLinear(OverlayNGRobust.overlay(bi, bj, OverlayNG.INTERSECTION));
				if (lines.isEmpty()) {
					continue;
				}
				PieceKey key = PieceKey.of(i, j);
				for (LineString line : lines) {
					int id = addPiece(line, new int[] { i, j });
					shared.computeIfAbsent(key, k -> new ArrayList<>()).add(id);
					sharedLines.get(i).add(line);
					sharedLines.get(j).add(line);
				}
			}
		}

		for (int i = 0; i < polygonCount; i++) {
			checkSharedPiecesDisjoint(i);
			Geometry rest = boundaries.get(i);
			if (!sharedLines.get(i).isEmpty()) {
				Geometry sharedUnion = gf.buildGeometry(sharedLines.get(i));
				rest = OverlayNGRobust.overlay(rest, sharedUnion, OverlayNG.DIFFERENCE);
			}
			for (LineString line : mergeLinear(rest)) {
				uniques.get(i).add(addPiece(line, new int[] { i }));
			}
		}

		for (int i = 0; i < polygonCount; i++) {
			List<Integer> ids = new ArrayList<>(uniques.get(i));
			for (Map.Entry<PieceKey, List<Integer>> e : shared.entrySet()) {
				if (e.getKey().contains(i)) {
					ids.addAll(e.getValue());
				}
			}
			List<Integer> ordered = new ArrayList<>();
			chainRings(i, ids, ordered);
			polygonPieces.get(i).addAll(ordered);
		}
		LOGGER.debug("Split {} polygons into {} pieces ({} shared walls)", polygonCount, pieces.size(), shared.size());
	}

	private int addPiece(LineString line, int[] pieceOwners) {
		pieces.add(line);
		owners.add(pieceOwners);
		return pieces.size() - 1;
	}

	/*
	 * Two shared pieces of one polygon overlapping along a line means that stretch
	 * of boundary is claimed by three or more polygons.
	 */
	private void checkSharedPiecesDisjoint(int polygon) {
		List<Integer> ids = new ArrayList<>();
		List<PieceKey> keys = new ArrayList<>();
		for (Map.Entry<PieceKey, List<Integer>> e : shared.entrySet()) {
			if (e.getKey().contains(polygon)) {
				for (int id : e.getValue()) {
					ids.add(id);
					keys.add(e.getKey());
				}
			}
		}
		for (int a = 0; a < ids.size(); a++) {
			for (int b = a + 1; b < ids.size(); b++) {
				if (keys.get(a).equals(keys.get(b))) {
					continue;
				}
				LineString la = pieces.get(ids.get(a));
				LineString lb = pieces.get(ids.get(b));
				if (!la.getEnvelopeInternal().intersects(lb.getEnvelopeInternal())) {
					continue;
				}
				Geometry overlap = OverlayNGRobust.overlay(la, lb, OverlayNG.INTERSECTION);
				if (overlap.getLength() > HydroConstants.ZERO_LENGTH) {
					throw new TopologyException(String.format("Boundary of polygon %d near %s is shared by more than two polygons (%d and %d)",
							polygon, overlap.getCoordinate(), keys.get(a).other(polygon), keys.get(b).other(polygon)));
				}
			}
		}
	}

	private static List<LineString> mergeLinear(Geometry g) {
		LineMerger merger = new LineMerger();
		merger.add(g);
		List<LineString> lines = new ArrayList<>();
		for (Object o : merger.getMergedLineStrings()) {
			LineString line = (LineString) o;
			if (line.getLength() > HydroConstants.ZERO_LENGTH) {
				lines.add(line);
			}
		}
		return lines;
	}

	/**
	 * Chains the given pieces into closed rings. The order in which pieces are
	 * consumed is written to {@code orderOut}.
	 */
	private List<Coordinate[]> chainRings(int polygon, Collection<Integer> ids, List<Integer> orderOut) {
		List<Integer> remaining = new ArrayList<>(ids);
		List<Coordinate[]> rings = new ArrayList<>();
		while (!remaining.isEmpty()) {
			int start = remaining.remove(0);
			orderOut.add(start);
			CoordinateList ring = new CoordinateList(CoordinateArrays.copyDeep(pieces.get(start).getCoordinates()), true);
			while (!isClosed(ring)) {
				Coordinate end = ring.getCoordinate(ring.size() - 1);
				int next = -1;
				boolean reversed = false;
				for (int k = 0; k < remaining.size(); k++) {
					LineString candidate = pieces.get(remaining.get(k));
					if (candidate.getCoordinateN(0).equals2D(end)) {
						next = k;
						break;
					}
					if (candidate.getCoordinateN(candidate.getNumPoints() - 1).equals2D(end)) {
						next = k;
						reversed = true;
						break;
					}
				}
				if (next < 0) {
					throw new TopologyException("Boundary of polygon " + polygon + " does not close: no piece continues from " + end);
				}
				int id = remaining.remove(next);
				orderOut.add(id);
				Coordinate[] coords = pieces.get(id).getCoordinates();
				if (reversed) {
					coords = coords.clone();
					CoordinateArrays.reverse(coords);
				}
				for (int c = 1; c < coords.length; c++) {
					ring.add(coords[c].copy(), true);
				}
			}
			rings.add(ring.toCoordinateArray());
		}
		if (rings.isEmpty()) {
			throw new TopologyException("Polygon " + polygon + " has no boundary pieces");
		}
		return rings;
	}

	private static boolean isClosed(CoordinateList ring) {
		return ring.size() >= 4 && ring.getCoordinate(0).equals2D(ring.getCoordinate(ring.size() - 1));
	}

	public int getPolygonCount() {
		return polygonCount;
	}

	public int getPieceCount() {
		return pieces.size();
	}

	public LineString piece(int id) {
		return pieces.get(id);
	}

	/**
	 * Indices of the one or two polygons that reference the piece.
	 */
	public int[] owners(int id) {
		return owners.get(id).clone();
	}

	public boolean isShared(int id) {
		return owners.get(id).length == 2;
	}

	/**
	 * Ordered piece ids of the polygon.
	 */
	public List<Integer> pieceIds(int polygon) {
		return Collections.unmodifiableList(polygonPieces.get(polygon));
	}

	public List<LineString> uniquePieces(int polygon) {
		List<LineString> out = new ArrayList<>();
		for (int id : uniques.get(polygon)) {
			out.add(pieces.get(id));
		}
		return out;
	}

	public List<LineString> sharedPieces(int i, int j) {
		List<LineString> out = new ArrayList<>();
		for (int id : shared.getOrDefault(PieceKey.of(i, j), Collections.emptyList())) {
			out.add(pieces.get(id));
		}
		return out;
	}

	public Map<PieceKey, List<Integer>> sharedPieceIds() {
		return Collections.unmodifiableMap(shared);
	}

	/**
	 * All pieces, unique and shared, each exactly once.
	 */
	public List<LineString> segments() {
		return Collections.unmodifiableList(pieces);
	}

	/**
	 * The rings of the polygon, reconstructed by chaining its pieces in order.
	 */
	public List<Coordinate[]> boundaryRings(int polygon) {
		return chainRings(polygon, polygonPieces.get(polygon), new ArrayList<>());
	}

	public Polygon polygon(int polygon) {
		List<Coordinate[]> rings = boundaryRings(polygon);
		int shellIndex = 0;
		double maxArea = -1;
		for (int r = 0; r < rings.size(); r++) {
			double a = Area.ofRing(rings.get(r));
			if (a > maxArea) {
				maxArea = a;
				shellIndex = r;
			}
		}
		LinearRing shell = gf.createLinearRing(rings.get(shellIndex));
		List<LinearRing> holes = new ArrayList<>();
		for (int r = 0; r < rings.size(); r++) {
			if (r != shellIndex) {
				holes.add(gf.createLinearRing(rings.get(r)));
			}
		}
		return gf.createPolygon(shell, holes.toArray(new LinearRing[0]));
	}

	public List<Polygon> polygons() {
		List<Polygon> out = new ArrayList<>(polygonCount);
		for (int i = 0; i < polygonCount; i++) {
			out.add(polygon(i));
		}
		return out;
	}

	/**
	 * Polygonal union of all polygons: the outer boundary of the collection, with
	 * any holes it encloses.
	 */
	public Geometry exterior() {
		return UnaryUnionOp.union(new ArrayList<Geometry>(polygons()));
	}

	/**
	 * The pieces owned by exactly one polygon, merged where they join.
	 */
	public MultiLineString exteriorBoundary() {
		LineMerger merger = new LineMerger();
		for (int i = 0; i < pieces.size(); i++) {
			if (!isShared(i)) {
				merger.add(pieces.get(i));
			}
		}
		List<LineString> lines = new ArrayList<>();
		for (Object o : merger.getMergedLineStrings()) {
			lines.add((LineString) o);
		}
		return gf.createMultiLineString(lines.toArray(new LineString[0]));
	}

	/**
	 * Simplifies every stored piece once. Pieces are simplified together so
	 * that they do not cross one another, and piece endpoints (where walls meet)
	 * never move, so all polygons stay closed and neighbours stay identical.
	 *
	 * @param tolerance maximum distance a vertex may move
	 */
	public void simplify(double tolerance) {
		Validate.isTrue(tolerance >= 0, "Tolerance must be non-negative: %f", tolerance);
		if (tolerance == 0 || pieces.isEmpty()) {
			return;
		}
		MultiLineString all = gf.createMultiLineString(pieces.toArray(new LineString[0]));
		Geometry simplified = TopologyPreservingSimplifier.simplify(all, tolerance);
		if (simplified.getNumGeometries() != pieces.size()) {
			throw new IllegalStateException("Simplification changed the number of boundary pieces from " + pieces.size() + " to "
					+ simplified.getNumGeometries());
		}
		int before = 0;
		int after = 0;
		for (int i = 0; i < pieces.size(); i++) {
			before += pieces.get(i).getNumPoints();
			LineString s = (LineString) simplified.getGeometryN(i);
			after += s.getNumPoints();
			pieces.set(i, s);
		}
		LOGGER.debug("Simplified boundary pieces from {} to {} vertices", before, after);
	}

	/**
	 * Replaces the geometry of one piece. The endpoints must stay where they are,
	 * since they are the junctions with neighbouring pieces.
	 */
	public void replacePiece(int id, LineString line) {
		LineString old = pieces.get(id);
		Validate.isTrue(old.getCoordinateN(0).equals2D(line.getCoordinateN(0))
				&& old.getCoordinateN(old.getNumPoints() - 1).equals2D(line.getCoordinateN(line.getNumPoints() - 1)),
				"Replacement for piece %d moves its endpoints", id);
		pieces.set(id, line);
	}

	public GeometryFactory getFactory() {
		return gf;
	}
}
