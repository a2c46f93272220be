package com.github.micycle1.hydromesh.river;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.HydroConstants;
import com.github.micycle1.hydromesh.TopologyException;

/**
 * A set of disjoint river trees, one per independent network. Each tree is
 * rooted at its outlet reach; children are upstream tributaries.
 * <p>
 * Nodes are held in an index-addressed arena; ids are compacted whenever nodes
 * are removed, so ids are only stable between mutations.
 */
public class RiverForest {

	private static final Logger LOGGER = LoggerFactory.getLogger(RiverForest.class);

	private final GeometryFactory gf;
	private List<RiverNode> nodes = new ArrayList<>();
	private List<Integer> roots = new ArrayList<>();

	private RiverForest(GeometryFactory gf) {
		this.gf = gf;
	}

	public static RiverForest empty(GeometryFactory gf) {
		return new RiverForest(gf);
	}

	/**
	 * Connects reaches into trees (make_global_tree). Reach A becomes a tributary
	 * of reach B when A's outlet lies within {@code tolerance} of B's inlet; the
	 * nearest such B wins, ties going to the lowest reach index. Reaches with no
	 * downstream match become roots.
	 *
	 * @param reaches   reaches, each ordered upstream to downstream
	 * @param tolerance snap tolerance between an outlet and an inlet
	 * @throws TopologyException on a zero-length or self-crossing reach, or if the
	 *                           reaches form a cycle
	 */
	public static RiverForest build(List<LineString> reaches, double tolerance) {
		Validate.isTrue(tolerance >= 0, "Tolerance must be non-negative: %f", tolerance);
		GeometryFactory gf = reaches.isEmpty() ? new GeometryFactory() : reaches.get(0).getFactory();
		RiverForest forest = new RiverForest(gf);

		STRtree inlets = new STRtree();
		for (int i = 0; i < reaches.size(); i++) {
			LineString reach = reaches.get(i);
			if (reach.getNumPoints() < 2 || reach.getLength() <= HydroConstants.ZERO_LENGTH) {
				throw new TopologyException("Reach " + i + " has zero length: " + reach);
			}
			if (!reach.isSimple()) {
				throw new TopologyException("Reach " + i + " crosses itself: " + reach);
			}
			RiverNode node = new RiverNode(i, reach);
			forest.nodes.add(node);
			inlets.insert(new Envelope(node.inlet()), i);
		}

		for (RiverNode node : forest.nodes) {
			Coordinate outlet = node.outlet();
			Envelope search = new Envelope(outlet);
			search.expandBy(tolerance);
			int best = RiverNode.NO_PARENT;
			double bestDistance = Double.POSITIVE_INFINITY;
			for (Object o : inlets.query(search)) {
				int candidate = (Integer) o;
				if (candidate == node.getId()) {
					continue;
				}
				double d = forest.nodes.get(candidate).inlet().distance(outlet);
				if (d > tolerance) {
					continue;
				}
				if (d < bestDistance || (d == bestDistance && candidate < best)) {
					bestDistance = d;
					best = candidate;
				}
			}
			node.setParent(best);
		}
		for (RiverNode node : forest.nodes) {
			if (node.isRoot()) {
				forest.roots.add(node.getId());
			} else {
				forest.nodes.get(node.parentId()).children().add(node.getId());
			}
		}
		forest.checkAcyclic();
		LOGGER.debug("Built {} river trees from {} reaches", forest.roots.size(), reaches.size());
		return forest;
	}

	private void checkAcyclic() {
		// 0 = unvisited, 1 = on current path, 2 = reaches a root
		int[] state = new int[nodes.size()];
		for (int start = 0; start < nodes.size(); start++) {
			List<Integer> path = new ArrayList<>();
			int current = start;
			while (current != RiverNode.NO_PARENT && state[current] == 0) {
				state[current] = 1;
				path.add(current);
				current = nodes.get(current).parentId();
			}
			if (current != RiverNode.NO_PARENT && state[current] == 1) {
				throw new TopologyException("River reaches form a cycle through reach " + current);
			}
			for (int id : path) {
				state[id] = 2;
			}
		}
	}

	/**
	 * Number of trees.
	 */
	public int size() {
		return roots.size();
	}

	public boolean isEmpty() {
		return roots.isEmpty();
	}

	public int nodeCount() {
		return nodes.size();
	}

	public List<Integer> roots() {
		return Collections.unmodifiableList(roots);
	}

	public RiverNode node(int id) {
		return nodes.get(id);
	}

	public List<RiverNode> nodes() {
		return Collections.unmodifiableList(nodes);
	}

	/**
	 * Number of reaches in the tree rooted at {@code root}.
	 */
	public int treeSize(int root) {
		int count = 0;
		for (Iterator<RiverNode> it = dfs(root).iterator(); it.hasNext(); it.next()) {
			count++;
		}
		return count;
	}

	/**
	 * Pre-order traversal of one tree, from the outlet to the headwaters. Each call
	 * to {@code iterator()} starts a fresh traversal.
	 */
	public Iterable<RiverNode> dfs(int root) {
		return () -> new DfsIterator(Collections.singletonList(root));
	}

	/**
	 * Pre-order traversal of every tree, trees in root order.
	 */
	public Iterable<RiverNode> dfs() {
		return () -> new DfsIterator(roots);
	}

	/**
	 * All reach geometries, in traversal order.
	 */
	public List<LineString> reaches() {
		List<LineString> out = new ArrayList<>(nodes.size());
		for (RiverNode node : dfs()) {
			out.add(node.getReach());
		}
		return out;
	}

	/**
	 * Flattens all trees into one multi-line (forest_to_list).
	 */
	public MultiLineString forestToList() {
		return gf.createMultiLineString(reaches().toArray(new LineString[0]));
	}

	/**
	 * Discards every tree with fewer than {@code minReaches} reaches. Trees are
	 * kept or dropped whole.
	 *
	 * @return number of trees removed
	 */
	public int pruneTrees(int minReaches) {
		int removed = 0;
		for (int root : roots) {
			int n = treeSize(root);
			if (n < minReaches) {
				for (RiverNode node : dfs(root)) {
					node.removed = true;
				}
				removed++;
				LOGGER.info("  ...removing river with {} reaches", n);
			} else {
				LOGGER.info("  ...keeping river with {} reaches", n);
			}
		}
		if (removed > 0) {
			compact();
		}
		return removed;
	}

	public GeometryFactory getFactory() {
		return gf;
	}

	/**
	 * Drops nodes flagged as removed and renumbers the survivors. A surviving node
	 * must not reference a removed child.
	 */
	void compact() {
		int[] remap = new int[nodes.size()];
		List<RiverNode> kept = new ArrayList<>();
		for (RiverNode node : nodes) {
			if (node.removed) {
				remap[node.getId()] = RiverNode.NO_PARENT;
			} else {
				remap[node.getId()] = kept.size();
				kept.add(node);
			}
		}
		for (RiverNode node : kept) {
			node.setId(remap[node.getId()]);
			if (!node.isRoot()) {
				int parent = remap[node.parentId()];
				if (parent == RiverNode.NO_PARENT) {
					throw new IllegalStateException("Reach " + node.getId() + " survived removal of its parent");
				}
				node.setParent(parent);
			}
			List<Integer> children = node.children();
			for (int c = 0; c < children.size(); c++) {
				int child = remap[children.get(c)];
				if (child == RiverNode.NO_PARENT) {
					throw new IllegalStateException("Reach " + node.getId() + " still references a removed tributary");
				}
				children.set(c, child);
			}
		}
		List<Integer> newRoots = new ArrayList<>();
		for (int root : roots) {
			if (remap[root] != RiverNode.NO_PARENT) {
				newRoots.add(remap[root]);
			}
		}
		nodes = kept;
		roots = newRoots;
	}

	private class DfsIterator implements Iterator<RiverNode> {

		private final Deque<Integer> stack = new ArrayDeque<>();

		DfsIterator(List<Integer> starts) {
			for (int i = starts.size() - 1; i >= 0; i--) {
				stack.push(starts.get(i));
			}
		}

		@Override
		public boolean hasNext() {
			return !stack.isEmpty();
		}

		@Override
		public RiverNode next() {
			if (stack.isEmpty()) {
				throw new NoSuchElementException();
			}
			RiverNode node = nodes.get(stack.pop());
			List<Integer> children = node.children();
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
			return node;
		}
	}
}
