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
 * An RDF statement: subject, predicate and object. The types of the parts guarantee that a literal never appears as
 * subject and that the predicate is always an IRI.
 */
public final class Triple {

	private final Resource subject;

	private final Iri predicate;

	private final Term object;

	public Triple(Resource subject, Iri predicate, Term object) {
		this.subject = Objects.requireNonNull(subject, "subject must not be null");
		this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
		this.object = Objects.requireNonNull(object, "object must not be null");
	}

	public Resource getSubject() {
		return subject;
	}

	public Iri getPredicate() {
		return predicate;
	}

	public Term getObject() {
		return object;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Triple)) {
			return false;
		}
		Triple other = (Triple) o;
		return subject.equals(other.subject) && predicate.equals(other.predicate) && object.equals(other.object);
	}

	@Override
	public int hashCode() {
		return Objects.hash(subject, predicate, object);
	}

	@Override
	public String toString() {
		return subject + " " + predicate + " " + object + " .";
	}
}
