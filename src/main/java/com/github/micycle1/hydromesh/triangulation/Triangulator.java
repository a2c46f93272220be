package com.github.micycle1.hydromesh.triangulation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.HydroConstants;
import com.github.micycle1.hydromesh.TopologyException;
import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.split.SplitBoundary;

/**
 * Meshes a cleaned boundary and river forest. Boundary pieces bound the domain,
 * river reaches become internal constraints, and the active refinement criteria
 * are OR-ed into a single predicate for the kernel.
 */
public class Triangulator {

	private static final Logger LOGGER = LoggerFactory.getLogger(Triangulator.class);

	private final ConstrainedTriangulationKernel kernel;

	public Triangulator() {
		this(new TinfourTriangulationKernel());
	}

	public Triangulator(ConstrainedTriangulationKernel kernel) {
		this.kernel = Objects.requireNonNull(kernel);
	}

	public Mesh triangulate(SplitBoundary boundary, RiverForest forest, TriangulationOptions options) {
		LOGGER.info("");
		LOGGER.info("Meshing");
		LOGGER.info("------------------------------");
		Pslg pslg = Pslg.from(boundary, forest);
		LOGGER.info("Triangulating {}", pslg);

		RefinementPredicate predicate = predicate(forest, options);
		Mesh mesh = kernel.triangulate(pslg, predicate, options.getMinAngle(), options.isEnforceDelaunay());
		checkVertices(pslg, mesh);

		double domainArea = pslg.getDomain().getArea();
		double meshArea = mesh.totalArea();
		LOGGER.info("  mesh area {} vs domain area {}", meshArea, domainArea);
		if (Math.abs(meshArea - domainArea) > HydroConstants.AREA_REL_TOL * domainArea) {
			LOGGER.warn("Mesh area {} differs from domain area {} by more than {} relative", meshArea, domainArea,
					HydroConstants.AREA_REL_TOL);
		}

		if (options.isDiagnostics()) {
			TriangulationDiagnostics d = TriangulationDiagnostics.of(mesh, forest, predicate);
			LOGGER.info("  triangle area min/median/max: {} / {} / {}", d.minArea(), d.medianArea(), d.maxArea());
			LOGGER.info("  triangles still flagged for refinement: {}", d.flaggedCount());
		}
		return mesh;
	}

	/**
	 * Combines the criteria set in the options; never refines when none are.
	 */
	public static RefinementPredicate predicate(RiverForest forest, TriangulationOptions options) {
		List<RefinementPredicate> predicates = new ArrayList<>();
		if (options.getMaxArea() != null) {
			predicates.add(RefinementPredicates.maxArea(options.getMaxArea()));
		}
		double[] rd = options.getRiverDistance();
		if (rd != null) {
			predicates.add(RefinementPredicates.riverDistance(rd[0], rd[1], rd[2], rd[3], forest));
		}
		if (options.getMaxEdgeLength() != null) {
			predicates.add(RefinementPredicates.maxEdgeLength(options.getMaxEdgeLength()));
		}
		return predicates.isEmpty() ? RefinementPredicate.never() : RefinementPredicates.anyOf(predicates);
	}

	private static void checkVertices(Pslg pslg, Mesh mesh) {
		Set<Coordinate> out = new HashSet<>();
		for (int i = 0; i < mesh.getVertexCount(); i++) {
			double[] v = mesh.getVertices()[i];
			out.add(new Coordinate(v[0], v[1]));
		}
		for (Coordinate c : pslg.getVertices()) {
			if (!out.contains(c)) {
				throw new TopologyException("Triangulation lost input vertex " + c);
			}
		}
	}
}
