/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.model;

import java.util.Objects;

/**
 * A blank node, identified by a label that is only meaningful within one decoding session.
 * <p>
 * {@link #DEFAULT_GRAPH} is a reserved blank node used as the context of quads that name no graph. It carries an
 * internal tag rather than a special label, so no blank node created through {@link #of(String)} is ever equal to it,
 * whatever its label.
 */
public final class BlankNode extends Resource {

	/**
	 * The context of statements that belong to the default graph.
	 */
	public static final BlankNode DEFAULT_GRAPH = new BlankNode("defaultGraph", true);

	private final String id;

	private final boolean defaultGraph;

	private BlankNode(String id, boolean defaultGraph) {
		this.id = id;
		this.defaultGraph = defaultGraph;
	}

	/**
	 * Creates a blank node with the supplied identifier.
	 *
	 * @param id the blank node identifier, without the {@code _:} prefix
	 * @throws IllegalArgumentException if the identifier is empty
	 */
	public static BlankNode of(String id) {
		Objects.requireNonNull(id, "Blank node id must not be null");
		if (id.isEmpty()) {
			throw new IllegalArgumentException("Blank node id must not be empty");
		}
		return new BlankNode(id, false);
	}

	public String getId() {
		return id;
	}

	/**
	 * Returns {@code true} if this is the reserved {@link #DEFAULT_GRAPH} node.
	 */
	public boolean isDefaultGraph() {
		return defaultGraph;
	}

	@Override
	public String stringValue() {
		return id;
	}

	@Override
	public boolean isBlankNode() {
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BlankNode)) {
			return false;
		}
		BlankNode other = (BlankNode) o;
		return defaultGraph == other.defaultGraph && id.equals(other.id);
	}

	@Override
	public int hashCode() {
		return defaultGraph ? ~id.hashCode() : id.hashCode();
	}

	@Override
	public String toString() {
		return defaultGraph ? "(default graph)" : "_:" + id;
	}
}
