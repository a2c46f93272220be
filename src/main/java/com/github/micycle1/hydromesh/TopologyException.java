package com.github.micycle1.hydromesh;

/**
 * Signals a violated topological invariant in the input or in an intermediate
 * pipeline product: a boundary piece claimed by more than two polygons, a piece
 * list that does not close, a degenerate or self-crossing reach, a cycle in a
 * river network or a triangulation that dropped an input vertex.
 * <p>
 * These are not recoverable; the message identifies the offending entity.
 */
public class TopologyException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public TopologyException(String message) {
		super(message);
	}

}
