/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.model;

import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XSD;

/**
 * IRIs the decoders need to construct statements on their own: the RDF list and reification vocabulary and the XML
 * Schema datatypes of Turtle's shorthand literals.
 */
public final class Vocabulary {

	public static final String RDF_NAMESPACE = RDF.NAMESPACE;

	public static final Iri RDF_TYPE = of(RDF.TYPE);

	public static final Iri RDF_FIRST = of(RDF.FIRST);

	public static final Iri RDF_REST = of(RDF.REST);

	public static final Iri RDF_NIL = of(RDF.NIL);

	public static final Iri RDF_STATEMENT = of(RDF.STATEMENT);

	public static final Iri RDF_SUBJECT = of(RDF.SUBJECT);

	public static final Iri RDF_PREDICATE = of(RDF.PREDICATE);

	public static final Iri RDF_OBJECT = of(RDF.OBJECT);

	public static final Iri RDF_XMLLITERAL = of(RDF.XMLLITERAL);

	public static final Iri XSD_INTEGER = of(XSD.INTEGER);

	public static final Iri XSD_DECIMAL = of(XSD.DECIMAL);

	public static final Iri XSD_DOUBLE = of(XSD.DOUBLE);

	public static final Iri XSD_BOOLEAN = of(XSD.BOOLEAN);

	private Vocabulary() {
	}

	/**
	 * Returns {@code rdf:_n}, the membership property for the n-th container member.
	 */
	public static Iri rdfMember(int n) {
		if (n < 1) {
			throw new IllegalArgumentException("Container membership index must be positive: " + n);
		}
		return Iri.of(RDF.NAMESPACE + "_" + n);
	}

	private static Iri of(org.eclipse.rdf4j.model.IRI iri) {
		return Iri.of(iri.stringValue());
	}
}
