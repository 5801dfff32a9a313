/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.model;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

/**
 * Converts decoded terms and statements into rdf4j model objects, so decoder output can be added to an rdf4j
 * {@link org.eclipse.rdf4j.model.Model} or repository.
 * <p>
 * Quads in the default graph become statements without a context.
 */
public class TermConverter {

	private final ValueFactory valueFactory;

	/**
	 * Creates a new TermConverter that will use a {@link SimpleValueFactory} to create rdf4j model objects.
	 */
	public TermConverter() {
		this(SimpleValueFactory.getInstance());
	}

	/**
	 * Creates a new TermConverter that will use the supplied ValueFactory to create rdf4j model objects.
	 *
	 * @param valueFactory A ValueFactory.
	 */
	public TermConverter(ValueFactory valueFactory) {
		this.valueFactory = valueFactory;
	}

	public Value toValue(Term term) {
		if (term instanceof Iri) {
			return toIRI((Iri) term);
		} else if (term instanceof BlankNode) {
			return toResource((BlankNode) term);
		} else {
			Literal literal = (Literal) term;
			if (literal.getLanguage().isPresent()) {
				return valueFactory.createLiteral(literal.getLabel(), literal.getLanguage().get());
			} else if (literal.getDatatype().isPresent()) {
				return valueFactory.createLiteral(literal.getLabel(), toIRI(literal.getDatatype().get()));
			}
			return valueFactory.createLiteral(literal.getLabel());
		}
	}

	public IRI toIRI(Iri iri) {
		return valueFactory.createIRI(iri.stringValue());
	}

	public org.eclipse.rdf4j.model.Resource toResource(Resource resource) {
		if (resource instanceof Iri) {
			return toIRI((Iri) resource);
		}
		BlankNode node = (BlankNode) resource;
		if (node.isDefaultGraph()) {
			throw new IllegalArgumentException("The default graph has no rdf4j value");
		}
		return valueFactory.createBNode(node.getId());
	}

	public Statement toStatement(Triple triple) {
		return valueFactory.createStatement(toResource(triple.getSubject()), toIRI(triple.getPredicate()),
				toValue(triple.getObject()));
	}

	public Statement toStatement(Quad quad) {
		if (quad.isInDefaultGraph()) {
			return toStatement(quad.getTriple());
		}
		return valueFactory.createStatement(toResource(quad.getSubject()), toIRI(quad.getPredicate()),
				toValue(quad.getObject()), toResource(quad.getContext()));
	}
}
