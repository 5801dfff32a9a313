/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.helpers;

import java.io.IOException;
import java.io.Reader;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.eclipse.rdf4j.common.net.ParsedIRI;
import org.eclipse.rdf4j.model.util.Literals;
import org.eclipse.rdf4j.rio.ParseErrorListener;
import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.RioSetting;
import org.eclipse.rdf4j.rio.helpers.BasicParserSettings;
import org.rdfdecoder.model.BlankNode;
import org.rdfdecoder.model.Iri;
import org.rdfdecoder.model.Literal;
import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Resource;
import org.rdfdecoder.rio.LexicalException;
import org.rdfdecoder.rio.QuadDecoder;
import org.rdfdecoder.rio.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for quad decoders. Holds the session state shared by all grammars: parser configuration, error listener,
 * base IRI and blank node scope.
 * <p>
 * Subclasses implement {@link #parseQuad()}. Grammar violations are thrown from there as {@link RDFParseException}s
 * and pass through {@link #decode()}, which reports them to the {@link ParseErrorListener} before rethrowing. Any
 * other runtime exception is a bug in the decoder and is left alone.
 */
public abstract class AbstractQuadDecoder implements QuadDecoder {

	private static final Logger logger = LoggerFactory.getLogger(AbstractQuadDecoder.class);

	/*-----------*
	 * Variables *
	 *-----------*/

	private final Reader reader;

	private ParserConfig parserConfig;

	private ParseErrorListener errListener;

	private ParsedIRI baseIRI;

	/**
	 * Prefix of the blank node ids of this session, unique per decoder instance.
	 */
	private final String bnodePrefix = "genid" + UUID.randomUUID().toString().replace("-", "");

	private long nextBNodeId;

	private boolean started;

	private boolean endOfStream;

	/*--------------*
	 * Constructors *
	 *--------------*/

	protected AbstractQuadDecoder(Reader reader, ParserConfig config) {
		if (reader == null) {
			throw new IllegalArgumentException("Reader must not be 'null'");
		}
		this.reader = reader;
		setParserConfig(config);
	}

	/*---------*
	 * Methods *
	 *---------*/

	@Override
	public final Quad decode() throws IOException, RDFParseException {
		if (endOfStream) {
			return null;
		}
		if (!started) {
			started = true;
			logger.debug("Decoding {} document, session {}", getFormat(), bnodePrefix);
		}
		try {
			Quad quad = parseQuad();
			if (quad == null) {
				endOfStream = true;
			}
			return quad;
		} catch (RDFParseException e) {
			if (errListener != null) {
				errListener.fatalError(e.getMessage(), e.getLineNumber(), e.getColumnNumber());
			}
			throw e;
		}
	}

	@Override
	public List<Quad> decodeAll() throws IOException, RDFParseException {
		List<Quad> quads = new ArrayList<>();
		for (Quad quad = decode(); quad != null; quad = decode()) {
			quads.add(quad);
		}
		logger.debug("Decoded {} statements from {} document", quads.size(), getFormat());
		return quads;
	}

	/**
	 * Parses the next quad from the input.
	 *
	 * @return the quad, or {@code null} at the end of the input
	 */
	protected abstract Quad parseQuad() throws IOException, RDFParseException;

	@Override
	public Resource getDefaultGraph() {
		return BlankNode.DEFAULT_GRAPH;
	}

	@Override
	public void setBase(Iri base) {
		if (base == null) {
			baseIRI = null;
		} else {
			baseIRI = ParsedIRI.create(base.stringValue());
		}
	}

	/**
	 * Returns the current base IRI, or {@code null} if none has been set.
	 */
	protected Iri getBase() {
		return baseIRI == null ? null : Iri.of(baseIRI.toString());
	}

	@Override
	public ParserConfig getParserConfig() {
		return parserConfig;
	}

	@Override
	public void setParserConfig(ParserConfig config) {
		this.parserConfig = config == null ? new ParserConfig() : config;
	}

	@Override
	public void setParseErrorListener(ParseErrorListener listener) {
		this.errListener = listener;
	}

	@Override
	public Collection<RioSetting<?>> getSupportedSettings() {
		Set<RioSetting<?>> result = new HashSet<>();
		result.add(BasicParserSettings.PRESERVE_BNODE_IDS);
		result.add(BasicParserSettings.VERIFY_LANGUAGE_TAGS);
		return result;
	}

	@Override
	public void close() throws IOException {
		reader.close();
	}

	/**
	 * Resolves an IRI reference against the base IRI. Absolute IRIs are returned as they are.
	 *
	 * @throws SyntaxException  if the reference is relative and no base IRI is set
	 * @throws LexicalException if the reference is not a syntactically valid IRI
	 */
	protected Iri resolveIri(String iriSpec, long lineNo, long columnNo) throws RDFParseException {
		return resolveAgainst(iriSpec, baseIRI, lineNo, columnNo);
	}

	/**
	 * Resolves an IRI reference against the supplied base IRI instead of the decoder's own, for formats where the base
	 * is scoped to a part of the document.
	 *
	 * @param base the base IRI, may be {@code null}
	 */
	protected Iri resolveIri(String iriSpec, Iri base, long lineNo, long columnNo) throws RDFParseException {
		return resolveAgainst(iriSpec, base == null ? null : ParsedIRI.create(base.stringValue()), lineNo, columnNo);
	}

	private Iri resolveAgainst(String iriSpec, ParsedIRI base, long lineNo, long columnNo) throws RDFParseException {
		ParsedIRI iri;
		try {
			iri = new ParsedIRI(iriSpec);
		} catch (URISyntaxException e) {
			throw new LexicalException("invalid IRI <" + iriSpec + ">: " + e.getMessage(), e, lineNo, columnNo);
		}
		if (iri.isAbsolute()) {
			return Iri.of(iriSpec);
		}
		if (base == null) {
			throw new SyntaxException("relative IRI <" + iriSpec + "> with no base IRI set", "absolute IRI", lineNo,
					columnNo);
		}
		return Iri.of(base.resolve(iriSpec));
	}

	/**
	 * Creates a fresh blank node, distinct from every other node of this session.
	 */
	protected BlankNode createNode() {
		return BlankNode.of(bnodePrefix + "_" + (++nextBNodeId));
	}

	/**
	 * Creates the blank node for a label found in the document. Within one session the same label always yields equal
	 * nodes. Unless {@link BasicParserSettings#PRESERVE_BNODE_IDS} is set, the label is qualified with a prefix unique
	 * to this session.
	 */
	protected BlankNode createNode(String label) {
		if (parserConfig.get(BasicParserSettings.PRESERVE_BNODE_IDS)) {
			return BlankNode.of(label);
		}
		return BlankNode.of(bnodePrefix + "-" + label);
	}

	/**
	 * Creates a literal, checking the language tag when {@link BasicParserSettings#VERIFY_LANGUAGE_TAGS} is set.
	 */
	protected Literal createLiteral(String label, String lang, Iri datatype, long lineNo, long columnNo)
			throws RDFParseException {
		if (lang != null) {
			if (parserConfig.get(BasicParserSettings.VERIFY_LANGUAGE_TAGS) && !Literals.isValidLanguageTag(lang)) {
				throw new LexicalException("invalid language tag '" + lang + "'", lineNo, columnNo);
			}
			return Literal.tagged(label, lang);
		}
		if (datatype != null) {
			return Literal.typed(label, datatype);
		}
		return Literal.plain(label);
	}

	protected void reportWarning(String msg, long lineNo, long columnNo) {
		logger.debug("{} [line {}, column {}]", msg, lineNo, columnNo);
		if (errListener != null) {
			errListener.warning(msg, lineNo, columnNo);
		}
	}
}
