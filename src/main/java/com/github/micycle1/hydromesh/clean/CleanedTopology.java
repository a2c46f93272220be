package com.github.micycle1.hydromesh.clean;

import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.split.SplitBoundary;

/**
 * Mutually consistent boundary and river forest produced by
 * {@link TopologyCleaner}, with the segment-length diagnostics of both.
 */
public final class CleanedTopology {

	private final SplitBoundary boundary;
	private final RiverForest rivers;
	private final SegmentLengthStats riverStats;
	private final SegmentLengthStats boundaryStats;

	CleanedTopology(SplitBoundary boundary, RiverForest rivers, SegmentLengthStats riverStats, SegmentLengthStats boundaryStats) {
		this.boundary = boundary;
		this.rivers = rivers;
		this.riverStats = riverStats;
		this.boundaryStats = boundaryStats;
	}

	public SplitBoundary getBoundary() {
		return boundary;
	}

	/**
	 * The cleaned rivers; empty when no reach survived filtering or pruning.
	 */
	public RiverForest getRivers() {
		return rivers;
	}

	public SegmentLengthStats getRiverStats() {
		return riverStats;
	}

	public SegmentLengthStats getBoundaryStats() {
		return boundaryStats;
	}
}
