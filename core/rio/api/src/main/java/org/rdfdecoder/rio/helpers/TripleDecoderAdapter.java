/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.helpers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.eclipse.rdf4j.rio.ParseErrorListener;
import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.RioSetting;
import org.rdfdecoder.model.Iri;
import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Triple;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.QuadDecoder;
import org.rdfdecoder.rio.TripleDecoder;

/**
 * Presents a {@link QuadDecoder} for a format without named graphs as a {@link TripleDecoder}.
 */
public class TripleDecoderAdapter implements TripleDecoder {

	private final QuadDecoder delegate;

	public TripleDecoderAdapter(QuadDecoder delegate) {
		this.delegate = delegate;
	}

	@Override
	public Format getFormat() {
		return delegate.getFormat();
	}

	@Override
	public Triple decode() throws IOException, RDFParseException {
		return toTriple(delegate.decode());
	}

	@Override
	public List<Triple> decodeAll() throws IOException, RDFParseException {
		List<Quad> quads = delegate.decodeAll();
		List<Triple> triples = new ArrayList<>(quads.size());
		for (Quad quad : quads) {
			triples.add(toTriple(quad));
		}
		return triples;
	}

	private Triple toTriple(Quad quad) {
		if (quad == null) {
			return null;
		}
		if (!delegate.getDefaultGraph().equals(quad.getContext())) {
			throw new IllegalStateException("Triple decoder produced a statement in graph " + quad.getContext());
		}
		return quad.getTriple();
	}

	@Override
	public void setBase(Iri base) {
		delegate.setBase(base);
	}

	@Override
	public ParserConfig getParserConfig() {
		return delegate.getParserConfig();
	}

	@Override
	public void setParserConfig(ParserConfig config) {
		delegate.setParserConfig(config);
	}

	@Override
	public void setParseErrorListener(ParseErrorListener listener) {
		delegate.setParseErrorListener(listener);
	}

	@Override
	public Collection<RioSetting<?>> getSupportedSettings() {
		return delegate.getSupportedSettings();
	}

	@Override
	public void close() throws IOException {
		delegate.close();
	}
}
