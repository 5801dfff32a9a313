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
 * An Internationalized Resource Identifier.
 */
public final class Iri extends Resource {

	private final String value;

	private Iri(String value) {
		this.value = value;
	}

	/**
	 * Creates an IRI term for the supplied IRI string. The string is used as is, it is neither resolved nor
	 * normalized.
	 *
	 * @param value the IRI string, must not be {@code null}
	 */
	public static Iri of(String value) {
		return new Iri(Objects.requireNonNull(value, "IRI must not be null"));
	}

	@Override
	public String stringValue() {
		return value;
	}

	@Override
	public boolean isIri() {
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof Iri && value.equals(((Iri) o).value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return "<" + value + ">";
	}
}
