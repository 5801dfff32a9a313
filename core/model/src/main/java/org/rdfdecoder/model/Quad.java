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
 * A {@link Triple} together with the graph it belongs to. Statements that name no graph have
 * {@link BlankNode#DEFAULT_GRAPH} as their context.
 */
public final class Quad {

	private final Triple triple;

	private final Resource context;

	public Quad(Triple triple, Resource context) {
		this.triple = Objects.requireNonNull(triple, "triple must not be null");
		this.context = Objects.requireNonNull(context, "context must not be null");
	}

	public static Quad of(Resource subject, Iri predicate, Term object, Resource context) {
		return new Quad(new Triple(subject, predicate, object), context);
	}

	/**
	 * Creates a quad in the default graph.
	 */
	public static Quad of(Resource subject, Iri predicate, Term object) {
		return of(subject, predicate, object, BlankNode.DEFAULT_GRAPH);
	}

	public Triple getTriple() {
		return triple;
	}

	public Resource getSubject() {
		return triple.getSubject();
	}

	public Iri getPredicate() {
		return triple.getPredicate();
	}

	public Term getObject() {
		return triple.getObject();
	}

	public Resource getContext() {
		return context;
	}

	public boolean isInDefaultGraph() {
		return BlankNode.DEFAULT_GRAPH.equals(context);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Quad)) {
			return false;
		}
		Quad other = (Quad) o;
		return triple.equals(other.triple) && context.equals(other.context);
	}

	@Override
	public int hashCode() {
		return Objects.hash(triple, context);
	}

	@Override
	public String toString() {
		if (isInDefaultGraph()) {
			return triple.toString();
		}
		return getSubject() + " " + getPredicate() + " " + getObject() + " " + context + " .";
	}
}
