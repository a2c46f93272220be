package com.github.micycle1.hydromesh.split;

/**
 * Unordered pair of polygon indices identifying the owners of a shared boundary
 * piece.
 */
public final class PieceKey implements Comparable<PieceKey> {

	private final int first;
	private final int second;

	private PieceKey(int first, int second) {
		this.first = first;
		this.second = second;
	}

	public static PieceKey of(int i, int j) {
		if (i == j) {
			throw new IllegalArgumentException("A shared piece needs two distinct polygons, got " + i + " twice");
		}
		return i < j ? new PieceKey(i, j) : new PieceKey(j, i);
	}

	public int getFirst() {
		return first;
	}

	public int getSecond() {
		return second;
	}

	public boolean contains(int polygon) {
		return first == polygon || second == polygon;
	}

	/**
	 * The owner that is not the given polygon.
	 */
	public int other(int polygon) {
		if (polygon == first) {
			return second;
		}
		if (polygon == second) {
			return first;
		}
		throw new IllegalArgumentException("Polygon " + polygon + " does not own " + this);
	}

	@Override
	public int compareTo(PieceKey o) {
		int c = Integer.compare(first, o.first);
		return c != 0 ? c : Integer.compare(second, o.second);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PieceKey)) {
			return false;
		}
		PieceKey that = (PieceKey) o;
		return first == that.first && second == that.second;
	}

	@Override
	public int hashCode() {
		return 31 * first + second;
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}
}
