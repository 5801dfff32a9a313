/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.helpers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.eclipse.rdf4j.rio.ParserConfig;
import org.junit.jupiter.api.Test;
import org.rdfdecoder.model.Iri;
import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Triple;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.ScriptedLexer;
import org.rdfdecoder.rio.TokenType;

public class TripleDecoderAdapterTest {

	@Test
	public void testTriplesAreUnwrapped() throws IOException {
		TripleDecoderAdapter decoder = new TripleDecoderAdapter(new TestTripleDecoder(new StringReader(""),
				new ScriptedLexer(TokenType.IRIREF, TokenType.IRIREF, TokenType.IRIREF, TokenType.DOT),
				new ParserConfig(), Format.TURTLE));

		List<Triple> triples = decoder.decodeAll();
		assertEquals(1, triples.size());
		assertEquals(Iri.of("http://x/5"), triples.get(0).getObject());
		assertNull(decoder.decode());
	}

	@Test
	public void testNamedGraphInTripleDecoderIsAnEngineFault() {
		AbstractQuadDecoder quads = new AbstractQuadDecoder(new StringReader(""), new ParserConfig()) {

			@Override
			public Format getFormat() {
				return Format.TURTLE;
			}

			@Override
			protected Quad parseQuad() {
				return Quad.of(Iri.of("http://a"), Iri.of("http://b"), Iri.of("http://c"), Iri.of("http://g"));
			}
		};

		assertThrows(IllegalStateException.class, () -> new TripleDecoderAdapter(quads).decode());
	}
}
