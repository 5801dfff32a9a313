/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.nquads;

import java.io.Reader;

import org.eclipse.rdf4j.rio.ParserConfig;
import org.rdfdecoder.rio.DecoderFactory;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.QuadDecoder;

/**
 * A {@link DecoderFactory} for N-Triples decoders.
 */
public class NTriplesDecoderFactory implements DecoderFactory {

	/**
	 * Returns {@link Format#NTRIPLES}.
	 */
	@Override
	public Format getFormat() {
		return Format.NTRIPLES;
	}

	/**
	 * Returns a new instance of {@link NTriplesDecoder}.
	 */
	@Override
	public QuadDecoder getDecoder(Reader reader, ParserConfig config) {
		return new NTriplesDecoder(reader, config);
	}
}
