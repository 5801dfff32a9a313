/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.turtle;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.rdf4j.model.Namespace;
import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.RioSetting;
import org.eclipse.rdf4j.rio.helpers.BasicParserSettings;
import org.eclipse.rdf4j.rio.turtle.TurtleParserSettings;
import org.rdfdecoder.model.Iri;
import org.rdfdecoder.model.Literal;
import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Resource;
import org.rdfdecoder.model.Term;
import org.rdfdecoder.model.Vocabulary;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.SyntaxException;
import org.rdfdecoder.rio.Token;
import org.rdfdecoder.rio.TokenType;
import org.rdfdecoder.rio.helpers.AbstractTokenDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoder for Turtle documents.
 * <p>
 * A Turtle statement can describe any number of triples. They are collected while the statement is parsed and handed
 * out one per {@link #decode()} call, in document order, once the statement's closing dot has been read. A fault
 * anywhere in a statement discards all of its triples.
 * <p>
 * All triples go to the default graph.
 *
 * @see TurtleParserSettings#CASE_INSENSITIVE_DIRECTIVES
 * @see BasicParserSettings#NAMESPACES
 */
public class TurtleDecoder extends AbstractTokenDecoder {

	private static final Logger logger = LoggerFactory.getLogger(TurtleDecoder.class);

	private static final String SENSITIVE_PREFIX = "prefix";

	private static final String SENSITIVE_BASE = "base";

	/*-----------*
	 * Variables *
	 *-----------*/

	private final Map<String, String> namespaceTable = new HashMap<>();

	private final Deque<Quad> pending = new ArrayDeque<>();

	private final List<Quad> statementTriples = new ArrayList<>();

	protected Resource subject;

	protected Iri predicate;

	protected Term object;

	/*--------------*
	 * Constructors *
	 *--------------*/

	public TurtleDecoder(Reader reader) {
		this(reader, new ParserConfig());
	}

	public TurtleDecoder(Reader reader, ParserConfig config) {
		super(reader, new TurtleLexer(reader), config);
		for (Namespace ns : getParserConfig().get(BasicParserSettings.NAMESPACES)) {
			namespaceTable.put(ns.getPrefix(), ns.getName());
		}
	}

	/*---------*
	 * Methods *
	 *---------*/

	@Override
	public Format getFormat() {
		return Format.TURTLE;
	}

	@Override
	public Collection<RioSetting<?>> getSupportedSettings() {
		Collection<RioSetting<?>> result = super.getSupportedSettings();
		result.add(BasicParserSettings.NAMESPACES);
		result.add(TurtleParserSettings.CASE_INSENSITIVE_DIRECTIVES);
		return result;
	}

	/**
	 * Returns the namespace declared for a prefix, or {@code null} if the prefix is undefined.
	 */
	public String getNamespace(String prefix) {
		return namespaceTable.get(prefix);
	}

	@Override
	protected Quad parseQuad() throws IOException, RDFParseException {
		while (pending.isEmpty()) {
			if (tokens.peek().getType() == TokenType.EOF) {
				return null;
			}
			parseStatement();
		}
		return pending.poll();
	}

	protected void parseStatement() throws IOException, RDFParseException {
		statementTriples.clear();
		subject = null;
		predicate = null;
		object = null;

		if (!tryProcessDirective()) {
			parseTriples();
			expect("dot", TokenType.DOT);
			pending.addAll(statementTriples);
		}
	}

	private boolean tryProcessDirective() throws IOException, RDFParseException {
		Token t = tokens.peek();
		switch (t.getType()) {
		case LANGTAG:
			tokens.next();
			parseCaseSensitiveDirective(t);
			return true;
		case SPARQL_PREFIX:
			tokens.next();
			parsePrefixID(false);
			return true;
		case SPARQL_BASE:
			tokens.next();
			parseBase(false);
			return true;
		default:
			return false;
		}
	}

	private void parseCaseSensitiveDirective(Token directive) throws IOException, RDFParseException {
		String name = directive.getText();
		if (name.equals(SENSITIVE_PREFIX)) {
			parsePrefixID(true);
		} else if (name.equals(SENSITIVE_BASE)) {
			parseBase(true);
		} else if (name.equalsIgnoreCase(SENSITIVE_PREFIX)) {
			checkCaseInsensitiveDirective(directive);
			parsePrefixID(true);
		} else if (name.equalsIgnoreCase(SENSITIVE_BASE)) {
			checkCaseInsensitiveDirective(directive);
			parseBase(true);
		} else {
			throw new SyntaxException("unknown directive '@" + name + "'", "directive", directive.getLine(),
					directive.getColumn());
		}
	}

	private void checkCaseInsensitiveDirective(Token directive) throws RDFParseException {
		if (!getParserConfig().get(TurtleParserSettings.CASE_INSENSITIVE_DIRECTIVES)) {
			throw new SyntaxException("Cannot strictly support case-insensitive @" + directive.getText()
					+ " directive in compliance mode.", "directive", directive.getLine(), directive.getColumn());
		}
	}

	protected void parsePrefixID(boolean isSensitive) throws IOException, RDFParseException {
		Token prefix = expect("prefix name", TokenType.PNAME_NS);
		Token namespace = expect("namespace IRI", TokenType.IRIREF);
		String prefixStr = prefix.getText().substring(0, prefix.getText().length() - 1);
		String namespaceStr = resolveIri(namespace.getText(), namespace.getLine(), namespace.getColumn())
				.stringValue();

		namespaceTable.put(prefixStr, namespaceStr);
		logger.debug("Prefix '{}' bound to <{}>", prefixStr, namespaceStr);

		if (isSensitive) {
			expect("dot", TokenType.DOT);
		}
	}

	protected void parseBase(boolean isSensitive) throws IOException, RDFParseException {
		Token base = expect("base IRI", TokenType.IRIREF);
		setBase(resolveIri(base.getText(), base.getLine(), base.getColumn()));

		if (isSensitive) {
			expect("dot", TokenType.DOT);
		}
	}

	protected void parseTriples() throws IOException, RDFParseException {
		if (tokens.peek().getType() == TokenType.OPEN_BRACKET) {
			// a blank node property list may stand alone as a statement
			subject = parseImplicitBlank();
			if (tokens.peek().getType() != TokenType.DOT) {
				parsePredicateObjectList();
			}
		} else {
			parseSubject();
			parsePredicateObjectList();
		}

		subject = null;
		predicate = null;
		object = null;
	}

	protected void parsePredicateObjectList() throws IOException, RDFParseException {
		parsePredicate();
		parseObjectList();

		while (tokens.peek().getType() == TokenType.SEMICOLON) {
			tokens.next();
			TokenType next = tokens.peek().getType();
			if (next == TokenType.DOT || next == TokenType.CLOSE_BRACKET) {
				break;
			} else if (next == TokenType.SEMICOLON) {
				// empty predicateObjectList, skip to next
				continue;
			}
			parsePredicate();
			parseObjectList();
		}
	}

	protected void parseObjectList() throws IOException, RDFParseException {
		parseObject();
		while (tokens.peek().getType() == TokenType.COMMA) {
			tokens.next();
			parseObject();
		}
	}

	protected void parseSubject() throws IOException, RDFParseException {
		if (tokens.peek().getType() == TokenType.OPEN_PAREN) {
			subject = parseCollection();
			return;
		}
		Token t = tokens.next();
		switch (t.getType()) {
		case IRIREF:
		case PNAME_NS:
		case PNAME_LN:
			subject = parseIri(t);
			break;
		case BLANK_NODE_LABEL:
			subject = createNode(t.getText());
			break;
		case ANON:
			subject = createNode();
			break;
		default:
			throw unexpected(t, "subject");
		}
	}

	protected void parsePredicate() throws IOException, RDFParseException {
		Token t = tokens.next();
		switch (t.getType()) {
		case A:
			predicate = Vocabulary.RDF_TYPE;
			break;
		case IRIREF:
		case PNAME_NS:
		case PNAME_LN:
			predicate = parseIri(t);
			break;
		default:
			throw unexpected(t, "predicate");
		}
	}

	protected void parseObject() throws IOException, RDFParseException {
		switch (tokens.peek().getType()) {
		case OPEN_PAREN:
			object = parseCollection();
			break;
		case OPEN_BRACKET:
			object = parseImplicitBlank();
			break;
		default:
			object = parseValue();
			reportStatement(subject, predicate, object);
			break;
		}
	}

	/**
	 * Parses a collection, e.g. <tt>( item1 item2 item3 )</tt>.
	 */
	protected Resource parseCollection() throws IOException, RDFParseException {
		expect("collection", TokenType.OPEN_PAREN);
		if (tokens.peek().getType() == TokenType.CLOSE_PAREN) {
			// Empty list
			tokens.next();
			if (subject != null) {
				reportStatement(subject, predicate, Vocabulary.RDF_NIL);
			}
			return Vocabulary.RDF_NIL;
		}

		Resource listRoot = createNode();
		if (subject != null) {
			reportStatement(subject, predicate, listRoot);
		}
		// Remember current subject and predicate
		Resource oldSubject = subject;
		Iri oldPredicate = predicate;

		// generated bNode becomes subject, predicate becomes rdf:first
		subject = listRoot;
		predicate = Vocabulary.RDF_FIRST;

		parseObject();

		Resource bNode = listRoot;
		while (tokens.peek().getType() != TokenType.CLOSE_PAREN) {
			// Create another list node and link it to the previous
			Resource newNode = createNode();
			reportStatement(bNode, Vocabulary.RDF_REST, newNode);

			// New node becomes the current
			subject = bNode = newNode;

			parseObject();
		}
		tokens.next();

		// Close the list
		reportStatement(bNode, Vocabulary.RDF_REST, Vocabulary.RDF_NIL);

		// Restore previous subject and predicate
		subject = oldSubject;
		predicate = oldPredicate;

		return listRoot;
	}

	/**
	 * Parses a blank node property list, e.g. <tt>[ :p :o ; :q :r ]</tt>. The empty form <tt>[]</tt> is a single
	 * {@link TokenType#ANON} token and handled as a plain value.
	 */
	protected Resource parseImplicitBlank() throws IOException, RDFParseException {
		expect("blank node property list", TokenType.OPEN_BRACKET);
		Resource bNode = createNode();
		if (subject != null) {
			reportStatement(subject, predicate, bNode);
		}

		// Remember current subject and predicate
		Resource oldSubject = subject;
		Iri oldPredicate = predicate;

		// generated bNode becomes subject
		subject = bNode;

		parsePredicateObjectList();
		expect("']'", TokenType.CLOSE_BRACKET);

		// Restore previous subject and predicate
		subject = oldSubject;
		predicate = oldPredicate;

		return bNode;
	}

	protected Term parseValue() throws IOException, RDFParseException {
		Token t = tokens.next();
		switch (t.getType()) {
		case IRIREF:
		case PNAME_NS:
		case PNAME_LN:
			return parseIri(t);
		case BLANK_NODE_LABEL:
			return createNode(t.getText());
		case ANON:
			return createNode();
		case STRING_LITERAL:
			return parseQuotedLiteral(t);
		case INTEGER:
			return Literal.typed(t.getText(), Vocabulary.XSD_INTEGER);
		case DECIMAL:
			return Literal.typed(t.getText(), Vocabulary.XSD_DECIMAL);
		case DOUBLE:
			return Literal.typed(t.getText(), Vocabulary.XSD_DOUBLE);
		case BOOLEAN:
			return Literal.typed(t.getText(), Vocabulary.XSD_BOOLEAN);
		default:
			throw unexpected(t, "object");
		}
	}

	/**
	 * Parses the optional language tag or datatype following a quoted string.
	 */
	protected Literal parseQuotedLiteral(Token label) throws IOException, RDFParseException {
		Token next = tokens.peek();
		if (next.getType() == TokenType.LANGTAG) {
			tokens.next();
			return createLiteral(label.getText(), next.getText(), null, next.getLine(), next.getColumn());
		}
		if (next.getType() == TokenType.DATATYPE_MARKER) {
			tokens.next();
			Token dt = expectOneOf("datatype", TokenType.IRIREF, TokenType.PNAME_NS, TokenType.PNAME_LN);
			return createLiteral(label.getText(), null, parseIri(dt), label.getLine(), label.getColumn());
		}
		return createLiteral(label.getText(), null, null, label.getLine(), label.getColumn());
	}

	/**
	 * Resolves an IRI reference against the base IRI, or a prefixed name against the declared namespaces.
	 */
	protected Iri parseIri(Token t) throws RDFParseException {
		if (t.getType() == TokenType.IRIREF) {
			return resolveIri(t.getText(), t.getLine(), t.getColumn());
		}
		String qname = t.getText();
		int colon = qname.indexOf(':');
		String prefix = qname.substring(0, colon);
		String namespace = namespaceTable.get(prefix);
		if (namespace == null) {
			String msg = prefix.isEmpty() ? "Default namespace used but not defined"
					: "Namespace prefix '" + prefix + "' used but not defined";
			throw new SyntaxException(msg, "declared prefix", t.getLine(), t.getColumn());
		}
		return resolveIri(namespace + qname.substring(colon + 1), t.getLine(), t.getColumn());
	}

	protected void reportStatement(Resource subj, Iri pred, Term obj) {
		statementTriples.add(Quad.of(subj, pred, obj, getDefaultGraph()));
	}
}
