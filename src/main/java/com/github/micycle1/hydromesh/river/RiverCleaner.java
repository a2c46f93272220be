package com.github.micycle1.hydromesh.river;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateList;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.util.GeometryUtil;

/**
 * Cleans up the reaches of a {@link RiverForest} in place: collapses repeated
 * vertices, drops short headwater stubs, merges short non-branching reaches
 * into their parent, simplifies the geometry and finally welds every
 * tributary's outlet exactly onto its parent's inlet.
 * <p>
 * Junction coordinates are fixed points of the simplification, so touching
 * reaches cannot drift apart.
 */
public class RiverCleaner {

	private static final Logger LOGGER = LoggerFactory.getLogger(RiverCleaner.class);

	private RiverCleaner() {
	}

	/**
	 * @param forest      forest to clean, modified in place
	 * @param simplifyTol simplification tolerance
	 * @param pruneTol    leaf reaches shorter than this are removed
	 * @param mergeTol    reaches shorter than this with no siblings are merged into
	 *                    their parent
	 */
	public static void cleanup(RiverForest forest, double simplifyTol, double pruneTol, double mergeTol) {
		Validate.isTrue(simplifyTol >= 0 && pruneTol >= 0 && mergeTol >= 0, "Tolerances must be non-negative");
		if (forest.isEmpty()) {
			return;
		}
		for (RiverNode node : forest.nodes()) {
			node.setReach(GeometryUtil.removeRepeatedPoints(node.getReach()));
		}

		int pruned = pruneShortLeaves(forest, pruneTol);
		int merged = mergeShortReaches(forest, mergeTol);
		if (pruned + merged > 0) {
			forest.compact();
		}
		LOGGER.debug("Pruned {} short headwater reaches and merged {} short reaches", pruned, merged);

		simplify(forest, simplifyTol);
		weldJunctions(forest);
	}

	private static int pruneShortLeaves(RiverForest forest, double pruneTol) {
		int count = 0;
		for (RiverNode node : forest.nodes()) {
			if (node.isRoot() || !node.isLeaf() || node.getReach().getLength() >= pruneTol) {
				continue;
			}
			forest.node(node.parentId()).children().remove(Integer.valueOf(node.getId()));
			node.removed = true;
			count++;
		}
		return count;
	}

	private static int mergeShortReaches(RiverForest forest, double mergeTol) {
		int count = 0;
		for (RiverNode node : forest.nodes()) {
			if (node.removed || node.isRoot() || node.getReach().getLength() >= mergeTol) {
				continue;
			}
			RiverNode parent = forest.node(node.parentId());
			if (parent.children().size() != 1) {
				continue;
			}
			// node's outlet is replaced by the parent's inlet
			Coordinate[] upstream = node.getReach().getCoordinates();
			CoordinateList joined = new CoordinateList();
			for (int i = 0; i < upstream.length - 1; i++) {
				joined.add(upstream[i].copy(), false);
			}
			joined.add(parent.getReach().getCoordinates(), false);
			parent.setReach(parent.getReach().getFactory().createLineString(joined.toCoordinateArray()));

			parent.children().clear();
			for (int child : node.children()) {
				parent.children().add(child);
				forest.node(child).setParent(parent.getId());
			}
			node.children().clear();
			node.removed = true;
			count++;
		}
		return count;
	}

	private static void simplify(RiverForest forest, double tolerance) {
		if (tolerance == 0) {
			return;
		}
		List<RiverNode> nodes = forest.nodes();
		List<LineString> reaches = new ArrayList<>(nodes.size());
		for (RiverNode node : nodes) {
			reaches.add(node.getReach());
		}
		// simplified together so reaches do not cross one another
		Geometry simplified = TopologyPreservingSimplifier
				.simplify(forest.getFactory().createMultiLineString(reaches.toArray(new LineString[0])), tolerance);
		if (simplified.getNumGeometries() != nodes.size()) {
			throw new IllegalStateException("Simplification changed the number of reaches from " + nodes.size() + " to "
					+ simplified.getNumGeometries());
		}
		for (int i = 0; i < nodes.size(); i++) {
			nodes.get(i).setReach((LineString) simplified.getGeometryN(i));
		}
	}

	/**
	 * Moves each tributary outlet exactly onto its parent's inlet.
	 */
	static void weldJunctions(RiverForest forest) {
		for (RiverNode node : forest.nodes()) {
			if (node.isRoot()) {
				continue;
			}
			Coordinate inlet = forest.node(node.parentId()).inlet();
			if (node.outlet().equals2D(inlet)) {
				continue;
			}
			Coordinate[] coords = node.getReach().getCoordinates().clone();
			coords[coords.length - 1] = inlet.copy();
			node.setReach(node.getReach().getFactory().createLineString(coords));
		}
	}
}
