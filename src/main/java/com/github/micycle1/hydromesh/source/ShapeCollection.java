package com.github.micycle1.hydromesh.source;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Items returned by a {@link ShapeSource}, together with the CRS their
 * geometry is expressed in.
 */
public final class ShapeCollection<T> {

	private final Crs crs;
	private final List<T> items;

	public ShapeCollection(Crs crs, List<T> items) {
		this.crs = Objects.requireNonNull(crs);
		this.items = Collections.unmodifiableList(items);
	}

	public Crs getCrs() {
		return crs;
	}

	public List<T> getItems() {
		return items;
	}

	public int size() {
		return items.size();
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}
}
