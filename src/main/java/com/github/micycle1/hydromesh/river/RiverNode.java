package com.github.micycle1.hydromesh.river;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

/**
 * One reach of a river network. Coordinates run upstream to downstream, so the
 * first coordinate is the inlet and the last is the outlet.
 * <p>
 * Nodes live in the arena of a {@link RiverForest} and refer to each other by
 * id: the children (upstream tributaries) are owned by this node, the parent
 * is a plain back-reference.
 */
public class RiverNode {

	static final int NO_PARENT = -1;

	private int id;
	private LineString reach;
	private final List<Integer> children = new ArrayList<>();
	private int parent = NO_PARENT;
	boolean removed = false;

	RiverNode(int id, LineString reach) {
		this.id = id;
		this.reach = Objects.requireNonNull(reach);
	}

	public int getId() {
		return id;
	}

	void setId(int id) {
		this.id = id;
	}

	public LineString getReach() {
		return reach;
	}

	public void setReach(LineString reach) {
		this.reach = Objects.requireNonNull(reach);
	}

	public Coordinate inlet() {
		return reach.getCoordinateN(0);
	}

	public Coordinate outlet() {
		return reach.getCoordinateN(reach.getNumPoints() - 1);
	}

	/**
	 * Ids of upstream tributaries, in insertion order.
	 */
	public List<Integer> getChildren() {
		return Collections.unmodifiableList(children);
	}

	List<Integer> children() {
		return children;
	}

	public OptionalInt getParent() {
		return parent == NO_PARENT ? OptionalInt.empty() : OptionalInt.of(parent);
	}

	void setParent(int parent) {
		this.parent = parent;
	}

	int parentId() {
		return parent;
	}

	public boolean isRoot() {
		return parent == NO_PARENT;
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	@Override
	public String toString() {
		return "RiverNode{id=" + id + ", parent=" + (parent == NO_PARENT ? "-" : parent) + ", children=" + children + ", points="
				+ reach.getNumPoints() + '}';
	}
}
