/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.input.BOMInputStream;
import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.UnsupportedRDFormatException;
import org.rdfdecoder.rio.helpers.TripleDecoderAdapter;

/**
 * Static factory methods for decoders. The decoder for a format is looked up in the {@link DecoderRegistry}; asking
 * for a format without a registered decoder fails here, before anything is read.
 */
public final class Decoders {

	private Decoders() {
	}

	public static QuadDecoder newQuadDecoder(InputStream in, Format format) {
		return newQuadDecoder(in, format, new ParserConfig());
	}

	/**
	 * Creates a quad decoder reading UTF-8 text from the supplied stream. A leading byte order mark is skipped.
	 *
	 * @throws UnsupportedRDFormatException if no decoder is registered for the format
	 */
	public static QuadDecoder newQuadDecoder(InputStream in, Format format, ParserConfig config) {
		return newQuadDecoder(toReader(in), format, config);
	}

	public static QuadDecoder newQuadDecoder(Reader reader, Format format) {
		return newQuadDecoder(reader, format, new ParserConfig());
	}

	/**
	 * Creates a quad decoder for the supplied reader.
	 *
	 * @throws UnsupportedRDFormatException if no decoder is registered for the format
	 */
	public static QuadDecoder newQuadDecoder(Reader reader, Format format, ParserConfig config) {
		if (reader == null) {
			throw new IllegalArgumentException("Reader must not be 'null'");
		}
		DecoderFactory factory = DecoderRegistry.getInstance()
				.get(format)
				.orElseThrow(() -> new UnsupportedRDFormatException("No decoder available for format " + format));
		return factory.getDecoder(reader, config);
	}

	public static TripleDecoder newTripleDecoder(InputStream in, Format format) {
		return newTripleDecoder(in, format, new ParserConfig());
	}

	public static TripleDecoder newTripleDecoder(InputStream in, Format format, ParserConfig config) {
		return newTripleDecoder(toReader(in), format, config);
	}

	public static TripleDecoder newTripleDecoder(Reader reader, Format format) {
		return newTripleDecoder(reader, format, new ParserConfig());
	}

	/**
	 * Creates a triple decoder for the supplied reader.
	 *
	 * @throws UnsupportedRDFormatException if the format can name graphs, or if no decoder is registered for it
	 */
	public static TripleDecoder newTripleDecoder(Reader reader, Format format, ParserConfig config) {
		if (format.supportsContexts()) {
			throw new UnsupportedRDFormatException(
					"Format " + format + " can name graphs and is only available as a quad decoder");
		}
		return new TripleDecoderAdapter(newQuadDecoder(reader, format, config));
	}

	private static Reader toReader(InputStream in) {
		if (in == null) {
			throw new IllegalArgumentException("Input stream must not be 'null'");
		}
		return new BufferedReader(new InputStreamReader(new BOMInputStream(in, false), StandardCharsets.UTF_8));
	}
}
