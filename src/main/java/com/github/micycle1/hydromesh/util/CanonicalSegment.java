package com.github.micycle1.hydromesh.util;

/**
 * An undirected segment between two vertex indices, with the smaller index
 * first, suitable for use as a Map key or in a Set.
 */
public final class CanonicalSegment {

	private final int v0;
	private final int v1;

	public CanonicalSegment(int a, int b) {
		if (a <= b) {
			this.v0 = a;
			this.v1 = b;
		} else {
			this.v0 = b;
			this.v1 = a;
		}
	}

	public int getV0() {
		return v0;
	}

	public int getV1() {
		return v1;
	}

	public boolean isDegenerate() {
		return v0 == v1;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CanonicalSegment)) {
			return false;
		}
		CanonicalSegment that = (CanonicalSegment) o;
		return v0 == that.v0 && v1 == that.v1;
	}

	@Override
	public int hashCode() {
		return 31 * v0 + v1;
	}

	@Override
	public String toString() {
		return "CanonicalSegment{" + v0 + " -> " + v1 + '}';
	}
}
