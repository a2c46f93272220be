package com.github.micycle1.hydromesh.clean;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.HydroConstants;
import com.github.micycle1.hydromesh.river.RiverCleaner;
import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.split.SplitBoundary;

/**
 * The simplify-and-prune pipeline. Runs, in order: filter reaches to the
 * boundary, build the river forest, prune small trees, clean the rivers,
 * simplify the boundary, snap rivers onto the boundary. The result is a
 * boundary and a forest that agree on every shared coordinate.
 */
public class TopologyCleaner {

	private static final Logger LOGGER = LoggerFactory.getLogger(TopologyCleaner.class);

	private final double snapRadiusFactor;

	public TopologyCleaner() {
		this(HydroConstants.DEFAULT_SNAP_RADIUS_FACTOR);
	}

	/**
	 * @param snapRadiusFactor snap radius as a multiple of the simplification
	 *                         tolerance
	 */
	public TopologyCleaner(double snapRadiusFactor) {
		Validate.isTrue(snapRadiusFactor >= 0, "Snap radius factor must be non-negative: %f", snapRadiusFactor);
		this.snapRadiusFactor = snapRadiusFactor;
	}

	/**
	 * Cleans up the boundary and reaches. The boundary is modified in place.
	 *
	 * @param boundary         split-form boundary, same CRS as the reaches
	 * @param reaches          raw reaches, ordered upstream to downstream
	 * @param tolerance        how far shapes may move while simplifying
	 * @param pruneReachSize   rivers with fewer reaches than this are dropped
	 * @param cutIntersections cut boundary segments where rivers cross them
	 */
	public CleanedTopology simplifyAndPrune(SplitBoundary boundary, List<LineString> reaches, double tolerance, int pruneReachSize,
			boolean cutIntersections) {
		Validate.isTrue(tolerance >= 0, "Tolerance must be non-negative: %f", tolerance);
		LOGGER.info("");
		LOGGER.info("Simplifying and pruning");
		LOGGER.info("------------------------------");

		LOGGER.info("Filtering rivers outside of the HUC space");
		List<LineString> kept = filterRiversToShape(boundary.exterior(), reaches, tolerance);
		LOGGER.info("  kept {} of {} reaches", kept.size(), reaches.size());

		RiverForest forest;
		if (kept.isEmpty()) {
			forest = RiverForest.empty(boundary.getFactory());
		} else {
			LOGGER.info("Generate the river tree");
			forest = RiverForest.build(kept, tolerance);

			LOGGER.info("Removing rivers with fewer than {} reaches.", pruneReachSize);
			forest.pruneTrees(pruneReachSize);
		}

		if (!forest.isEmpty()) {
			LOGGER.info("simplifying rivers");
			RiverCleaner.cleanup(forest, tolerance, tolerance, tolerance);
		}

		LOGGER.info("simplifying HUCs");
		boundary.simplify(tolerance);

		if (!forest.isEmpty()) {
			LOGGER.info("snapping rivers and HUCs");
			RiverSnapper.snap(boundary, forest, tolerance, snapRadiusFactor * tolerance, cutIntersections);
		}

		SegmentLengthStats riverStats = SegmentLengthStats.of(forest.reaches());
		SegmentLengthStats boundaryStats = SegmentLengthStats.of(boundary.segments());
		LOGGER.info("");
		LOGGER.info("Simplification Diagnostics");
		LOGGER.info("------------------------------");
		if (!forest.isEmpty()) {
			LOGGER.info("  river min seg length: {}", riverStats.getMin());
			LOGGER.info("  river median seg length: {}", riverStats.getMedian());
		}
		LOGGER.info("  HUC min seg length: {}", boundaryStats.getMin());
		LOGGER.info("  HUC median seg length: {}", boundaryStats.getMedian());
		return new CleanedTopology(boundary, forest, riverStats, boundaryStats);
	}

	/**
	 * Keeps the reaches that touch the shape buffered outward by
	 * {@code tolerance}; reaches wholly outside are discarded.
	 */
	public static List<LineString> filterRiversToShape(Geometry shape, List<LineString> reaches, double tolerance) {
		PreparedGeometry region = PreparedGeometryFactory.prepare(tolerance > 0 ? shape.buffer(tolerance) : shape);
		List<LineString> out = new ArrayList<>();
		for (LineString reach : reaches) {
			if (region.intersects(reach)) {
				out.add(reach);
			}
		}
		return out;
	}
}
