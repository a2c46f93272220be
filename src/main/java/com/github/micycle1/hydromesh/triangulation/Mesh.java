package com.github.micycle1.hydromesh.triangulation;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.hydromesh.util.GeometryUtil;

/**
 * Triangle mesh as plain arrays: vertices with 2 (x, y) or 3 (x, y, z)
 * components and counter-clockwise triangles of vertex indices.
 */
public class Mesh {

	private final double[][] vertices;
	private final int[][] triangles;

	public Mesh(double[][] vertices, int[][] triangles) {
		Validate.notNull(vertices);
		Validate.notNull(triangles);
		for (double[] v : vertices) {
			Validate.isTrue(v.length == 2 || v.length == 3, "Vertices need 2 or 3 components, got %d", v.length);
		}
		for (int t = 0; t < triangles.length; t++) {
			Validate.isTrue(triangles[t].length == 3, "Triangle %d does not have 3 vertices", t);
			for (int i : triangles[t]) {
				Validate.validIndex(vertices, i, "Triangle %d references vertex %d of %d", t, i, vertices.length);
			}
		}
		this.vertices = vertices;
		this.triangles = triangles;
	}

	public double[][] getVertices() {
		return vertices;
	}

	public int[][] getTriangles() {
		return triangles;
	}

	public int getVertexCount() {
		return vertices.length;
	}

	public int getTriangleCount() {
		return triangles.length;
	}

	public boolean is3D() {
		return vertices.length > 0 && vertices[0].length == 3;
	}

	public Coordinate vertex(int i) {
		double[] v = vertices[i];
		return v.length == 3 ? new Coordinate(v[0], v[1], v[2]) : new Coordinate(v[0], v[1]);
	}

	public Coordinate[] triangle(int t) {
		int[] tri = triangles[t];
		return new Coordinate[] { vertex(tri[0]), vertex(tri[1]), vertex(tri[2]) };
	}

	public double triangleArea(int t) {
		return GeometryUtil.triangleArea(triangle(t));
	}

	public double totalArea() {
		double sum = 0;
		for (int t = 0; t < triangles.length; t++) {
			sum += triangleArea(t);
		}
		return sum;
	}

	/**
	 * Returns a 3D copy of this mesh with the given z per vertex. Triangles are
	 * shared with this mesh.
	 */
	public Mesh withElevation(double[] z) {
		Validate.isTrue(z.length == vertices.length, "Need %d elevations, got %d", vertices.length, z.length);
		double[][] out = new double[vertices.length][];
		for (int i = 0; i < vertices.length; i++) {
			out[i] = new double[] { vertices[i][0], vertices[i][1], z[i] };
		}
		return new Mesh(out, triangles);
	}

	@Override
	public String toString() {
		return "Mesh{vertices=" + vertices.length + ", triangles=" + triangles.length + "}";
	}
}
