/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.model;

/**
 * An RDF term: an {@link Iri}, a {@link BlankNode} or a {@link Literal}.
 * <p>
 * The set of term types is closed. Constructors in this hierarchy are package-private, so the three final classes of
 * this package are the only possible implementations.
 */
public abstract class Term {

	Term() {
	}

	/**
	 * Returns the string value of this term: the IRI string, the blank node identifier or the literal's lexical form.
	 */
	public abstract String stringValue();

	public boolean isIri() {
		return false;
	}

	public boolean isBlankNode() {
		return false;
	}

	public boolean isLiteral() {
		return false;
	}

	/**
	 * Returns {@code true} for terms that may appear in subject or graph position.
	 */
	public boolean isResource() {
		return false;
	}
}
