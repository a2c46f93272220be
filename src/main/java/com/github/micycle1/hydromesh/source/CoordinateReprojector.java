package com.github.micycle1.hydromesh.source;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;

/**
 * Transforms coordinates between reference systems.
 */
public interface CoordinateReprojector {

	/**
	 * @return new coordinates, one per input point, in {@code dst}
	 */
	Coordinate[] reproject(Coordinate[] points, Crs src, Crs dst);

	/**
	 * Returns a reprojected copy of the geometry, of the same type as the input.
	 */
	default Geometry reproject(Geometry geometry, Crs src, Crs dst) {
		Geometry copy = geometry.copy();
		if (src.equals(dst)) {
			return copy;
		}
		Coordinate[] moved = reproject(geometry.getCoordinates(), src, dst);
		copy.apply(new CoordinateSequenceFilter() {
			private int next = 0;

			@Override
			public void filter(CoordinateSequence seq, int i) {
				Coordinate c = moved[next++];
				seq.setOrdinate(i, CoordinateSequence.X, c.x);
				seq.setOrdinate(i, CoordinateSequence.Y, c.y);
			}

			@Override
			public boolean isDone() {
				return false;
			}

			@Override
			public boolean isGeometryChanged() {
				return true;
			}
		});
		copy.geometryChanged();
		return copy;
	}

	/**
	 * A reprojector that only handles identical systems and rejects everything
	 * else. Real transforms are supplied by the caller.
	 */
	static CoordinateReprojector identity() {
		return (points, src, dst) -> {
			if (!src.equals(dst)) {
				throw new UnsupportedOperationException("No transform available from " + src + " to " + dst);
			}
			Coordinate[] out = new Coordinate[points.length];
			for (int i = 0; i < points.length; i++) {
				out[i] = points[i].copy();
			}
			return out;
		};
	}
}
