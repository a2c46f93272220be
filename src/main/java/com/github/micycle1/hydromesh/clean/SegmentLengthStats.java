package com.github.micycle1.hydromesh.clean;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;
import org.locationtech.jts.geom.LineString;

import com.github.micycle1.hydromesh.util.GeometryUtil;

/**
 * Minimum and median of the shortest segment of each line in a collection.
 * Purely informational.
 */
public final class SegmentLengthStats {

	private final int lineCount;
	private final double min;
	private final double median;

	private SegmentLengthStats(int lineCount, double min, double median) {
		this.lineCount = lineCount;
		this.min = min;
		this.median = median;
	}

	public static SegmentLengthStats of(Iterable<LineString> lines) {
		List<Double> mins = new ArrayList<>();
		for (LineString line : lines) {
			double[] lengths = GeometryUtil.segmentLengths(line);
			if (lengths.length > 0) {
				mins.add(GeometryUtil.min(lengths));
			}
		}
		double[] values = ArrayUtils.toPrimitive(mins.toArray(new Double[0]));
		return new SegmentLengthStats(values.length, GeometryUtil.min(values), GeometryUtil.median(values));
	}

	public int getLineCount() {
		return lineCount;
	}

	/**
	 * Shortest segment over all lines; NaN when there are no lines.
	 */
	public double getMin() {
		return min;
	}

	public double getMedian() {
		return median;
	}

	@Override
	public String toString() {
		return String.format("SegmentLengthStats{lines=%d, min=%g, median=%g}", lineCount, min, median);
	}
}
