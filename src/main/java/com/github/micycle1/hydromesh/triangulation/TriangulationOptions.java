package com.github.micycle1.hydromesh.triangulation;

import org.apache.commons.lang3.Validate;

/**
 * Refinement settings for {@link Triangulator}. Every criterion is optional;
 * with none set the domain is triangulated without refinement.
 */
public final class TriangulationOptions {

	private final Double maxArea;
	private final double[] riverDistance;
	private final Double maxEdgeLength;
	private final Double minAngle;
	private final boolean enforceDelaunay;
	private final boolean diagnostics;

	private TriangulationOptions(Builder b) {
		this.maxArea = b.maxArea;
		this.riverDistance = b.riverDistance;
		this.maxEdgeLength = b.maxEdgeLength;
		this.minAngle = b.minAngle;
		this.enforceDelaunay = b.enforceDelaunay;
		this.diagnostics = b.diagnostics;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static TriangulationOptions defaults() {
		return builder().build();
	}

	public Double getMaxArea() {
		return maxArea;
	}

	/**
	 * {nearDistance, nearArea, farDistance, farArea}, or null.
	 */
	public double[] getRiverDistance() {
		return riverDistance == null ? null : riverDistance.clone();
	}

	public Double getMaxEdgeLength() {
		return maxEdgeLength;
	}

	public Double getMinAngle() {
		return minAngle;
	}

	public boolean isEnforceDelaunay() {
		return enforceDelaunay;
	}

	public boolean isDiagnostics() {
		return diagnostics;
	}

	public static final class Builder {

		private Double maxArea;
		private double[] riverDistance;
		private Double maxEdgeLength;
		private Double minAngle;
		private boolean enforceDelaunay;
		private boolean diagnostics;

		private Builder() {
		}

		public Builder maxArea(double maxArea) {
			Validate.isTrue(maxArea > 0, "Max area must be positive: %f", maxArea);
			this.maxArea = maxArea;
			return this;
		}

		public Builder riverDistance(double nearDistance, double nearArea, double farDistance, double farArea) {
			Validate.isTrue(nearDistance >= 0 && farDistance > nearDistance, "Need 0 <= nearDistance < farDistance");
			Validate.isTrue(nearArea > 0 && farArea > 0, "Area ceilings must be positive");
			this.riverDistance = new double[] { nearDistance, nearArea, farDistance, farArea };
			return this;
		}

		public Builder maxEdgeLength(double maxEdgeLength) {
			Validate.isTrue(maxEdgeLength > 0, "Max edge length must be positive: %f", maxEdgeLength);
			this.maxEdgeLength = maxEdgeLength;
			return this;
		}

		/**
		 * Minimum interior angle in degrees. Angles above about 30 may not be
		 * reachable.
		 */
		public Builder minAngle(double minAngle) {
			Validate.inclusiveBetween(0.0, 60.0, minAngle, "Min angle must be in [0, 60] degrees");
			this.minAngle = minAngle;
			return this;
		}

		public Builder enforceDelaunay(boolean enforceDelaunay) {
			this.enforceDelaunay = enforceDelaunay;
			return this;
		}

		public Builder diagnostics(boolean diagnostics) {
			this.diagnostics = diagnostics;
			return this;
		}

		public TriangulationOptions build() {
			return new TriangulationOptions(this);
		}
	}
}
