package com.github.micycle1.hydromesh.triangulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.split.SplitBoundary;
import com.github.micycle1.hydromesh.util.CanonicalSegment;

/**
 * Planar straight-line graph handed to a triangulation kernel: deduplicated
 * vertices, constraint segments between vertex indices, one marker point inside
 * every hole, and the polygonal domain to be meshed.
 */
public class Pslg {

	private final List<Coordinate> vertices;
	private final List<CanonicalSegment> segments;
	private final List<Coordinate> holes;
	private final Geometry domain;

	Pslg(List<Coordinate> vertices, List<CanonicalSegment> segments, List<Coordinate> holes, Geometry domain) {
		this.vertices = Collections.unmodifiableList(vertices);
		this.segments = Collections.unmodifiableList(segments);
		this.holes = Collections.unmodifiableList(holes);
		this.domain = domain;
	}

	/**
	 * Builds the graph from boundary pieces (the domain edges) and river reaches
	 * (internal constraints). Coincident coordinates become a single vertex.
	 */
	public static Pslg from(SplitBoundary boundary, RiverForest forest) {
		Map<Coordinate, Integer> index = new LinkedHashMap<>();
		Set<CanonicalSegment> segments = new LinkedHashSet<>();
		for (LineString piece : boundary.segments()) {
			addLine(piece, index, segments);
		}
		for (LineString reach : forest.reaches()) {
			addLine(reach, index, segments);
		}

		Geometry domain = boundary.exterior();
		List<Coordinate> holes = new ArrayList<>();
		for (int i = 0; i < domain.getNumGeometries(); i++) {
			Polygon polygon = (Polygon) domain.getGeometryN(i);
			for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
				LinearRing ring = polygon.getInteriorRingN(h);
				holes.add(domain.getFactory().createPolygon(ring).getInteriorPoint().getCoordinate());
			}
		}
		return new Pslg(new ArrayList<>(index.keySet()), new ArrayList<>(segments), holes, domain);
	}

	private static void addLine(LineString line, Map<Coordinate, Integer> index, Set<CanonicalSegment> segments) {
		Coordinate[] coords = line.getCoordinates();
		int prev = -1;
		for (Coordinate c : coords) {
			Integer id = index.get(c);
			if (id == null) {
				id = index.size();
				index.put(c.copy(), id);
			}
			if (prev >= 0 && prev != id) {
				segments.add(new CanonicalSegment(prev, id));
			}
			prev = id;
		}
	}

	public List<Coordinate> getVertices() {
		return vertices;
	}

	public List<CanonicalSegment> getSegments() {
		return segments;
	}

	/**
	 * One point strictly inside each hole of the domain, for kernels that clear
	 * holes by flood fill from a seed. {@link TinfourTriangulationKernel} does not
	 * read them; it drops every triangle whose centroid is outside
	 * {@link #getDomain()}, which clears holes and concavities alike.
	 */
	public List<Coordinate> getHoles() {
		return holes;
	}

	public Geometry getDomain() {
		return domain;
	}

	@Override
	public String toString() {
		return "Pslg{vertices=" + vertices.size() + ", segments=" + segments.size() + ", holes=" + holes.size() + "}";
	}
}
