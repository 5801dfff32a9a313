/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.io.Reader;

import org.eclipse.rdf4j.rio.ParserConfig;

/**
 * Creates decoders for one {@link Format}. Implementations are discovered through {@link java.util.ServiceLoader}
 * and registered in the {@link DecoderRegistry}.
 */
public interface DecoderFactory {

	Format getFormat();

	QuadDecoder getDecoder(Reader reader, ParserConfig config);
}
