/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.model;

/**
 * Supertype of the terms allowed in subject and context position: {@link Iri} and {@link BlankNode}.
 */
public abstract class Resource extends Term {

	Resource() {
	}

	@Override
	public boolean isResource() {
		return true;
	}
}
