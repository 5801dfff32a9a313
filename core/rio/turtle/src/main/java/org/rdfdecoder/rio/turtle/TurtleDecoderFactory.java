/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.turtle;

import java.io.Reader;

import org.eclipse.rdf4j.rio.ParserConfig;
import org.rdfdecoder.rio.DecoderFactory;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.QuadDecoder;

/**
 * A {@link DecoderFactory} for Turtle decoders.
 */
public class TurtleDecoderFactory implements DecoderFactory {

	/**
	 * Returns {@link Format#TURTLE}.
	 */
	@Override
	public Format getFormat() {
		return Format.TURTLE;
	}

	/**
	 * Returns a new instance of {@link TurtleDecoder}.
	 */
	@Override
	public QuadDecoder getDecoder(Reader reader, ParserConfig config) {
		return new TurtleDecoder(reader, config);
	}
}
