package com.github.micycle1.hydromesh.triangulation;

/**
 * A constrained Delaunay mesher with adaptive refinement.
 */
public interface ConstrainedTriangulationKernel {

	/**
	 * Meshes the domain of the graph. Every graph vertex must appear unchanged in
	 * the result; new vertices may be added wherever refinement needs them.
	 *
	 * @param pslg            vertices, constraint segments and domain
	 * @param predicate       triangles for which this returns true are refined
	 * @param minAngle        minimum interior angle in degrees, or null for none
	 * @param enforceDelaunay split constraint segments until every triangle is
	 *                        Delaunay, not only constrained Delaunay
	 */
	Mesh triangulate(Pslg pslg, RefinementPredicate predicate, Double minAngle, boolean enforceDelaunay);
}
