/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.nquads;

import java.io.IOException;
import java.io.Reader;

import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.rdfdecoder.model.Iri;
import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Resource;
import org.rdfdecoder.model.Term;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.Token;
import org.rdfdecoder.rio.TokenType;
import org.rdfdecoder.rio.helpers.AbstractTokenDecoder;

/**
 * Decoder for N-Triples documents. Every statement occupies one line; IRIs must be absolute.
 */
public class NTriplesDecoder extends AbstractTokenDecoder {

	public NTriplesDecoder(Reader reader) {
		this(reader, new ParserConfig());
	}

	public NTriplesDecoder(Reader reader, ParserConfig config) {
		super(reader, new NQuadsLexer(reader), config);
	}

	@Override
	public Format getFormat() {
		return Format.NTRIPLES;
	}

	/**
	 * Ignored: N-Triples and N-Quads do not allow relative IRIs.
	 */
	@Override
	public void setBase(Iri base) {
	}

	@Override
	protected Quad parseQuad() throws IOException, RDFParseException {
		while (tokens.peek().getType() == TokenType.EOL) {
			tokens.next();
		}
		if (tokens.peek().getType() == TokenType.EOF) {
			return null;
		}

		Resource subject = parseSubject();
		Iri predicate = parsePredicate();
		Term object = parseObject();
		Resource context = parseGraphLabel();

		expect("dot", TokenType.DOT);
		expectOneOf("end of line", TokenType.EOL, TokenType.EOF);

		return Quad.of(subject, predicate, object, context);
	}

	protected Resource parseSubject() throws IOException, RDFParseException {
		Token t = expectOneOf("subject", TokenType.IRIREF, TokenType.BLANK_NODE_LABEL);
		if (t.getType() == TokenType.IRIREF) {
			return resolveIri(t.getText(), t.getLine(), t.getColumn());
		}
		return createNode(t.getText());
	}

	protected Iri parsePredicate() throws IOException, RDFParseException {
		Token t = expect("predicate", TokenType.IRIREF);
		return resolveIri(t.getText(), t.getLine(), t.getColumn());
	}

	protected Term parseObject() throws IOException, RDFParseException {
		Token t = expectOneOf("object", TokenType.IRIREF, TokenType.BLANK_NODE_LABEL, TokenType.STRING_LITERAL);
		switch (t.getType()) {
		case IRIREF:
			return resolveIri(t.getText(), t.getLine(), t.getColumn());
		case BLANK_NODE_LABEL:
			return createNode(t.getText());
		default:
			return parseLiteral(t);
		}
	}

	private Term parseLiteral(Token label) throws IOException, RDFParseException {
		Token next = tokens.peek();
		if (next.getType() == TokenType.LANGTAG) {
			tokens.next();
			return createLiteral(label.getText(), next.getText(), null, next.getLine(), next.getColumn());
		}
		if (next.getType() == TokenType.DATATYPE_MARKER) {
			tokens.next();
			Token dt = expect("datatype", TokenType.IRIREF);
			Iri datatype = resolveIri(dt.getText(), dt.getLine(), dt.getColumn());
			return createLiteral(label.getText(), null, datatype, label.getLine(), label.getColumn());
		}
		return createLiteral(label.getText(), null, null, label.getLine(), label.getColumn());
	}

	/**
	 * Parses the graph label of a statement. N-Triples has none, so every statement goes to the default graph.
	 */
	protected Resource parseGraphLabel() throws IOException, RDFParseException {
		return getDefaultGraph();
	}
}
