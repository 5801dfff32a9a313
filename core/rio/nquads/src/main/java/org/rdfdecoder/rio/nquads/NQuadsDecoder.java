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
import org.rdfdecoder.model.Resource;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.Token;

/**
 * Decoder for N-Quads documents: N-Triples with an optional graph label before the closing dot.
 */
public class NQuadsDecoder extends NTriplesDecoder {

	public NQuadsDecoder(Reader reader) {
		this(reader, new ParserConfig());
	}

	public NQuadsDecoder(Reader reader, ParserConfig config) {
		super(reader, config);
	}

	@Override
	public Format getFormat() {
		return Format.NQUADS;
	}

	@Override
	protected Resource parseGraphLabel() throws IOException, RDFParseException {
		Token t = tokens.peek();
		switch (t.getType()) {
		case IRIREF:
			tokens.next();
			return resolveIri(t.getText(), t.getLine(), t.getColumn());
		case BLANK_NODE_LABEL:
			tokens.next();
			return createNode(t.getText());
		default:
			return getDefaultGraph();
		}
	}
}
