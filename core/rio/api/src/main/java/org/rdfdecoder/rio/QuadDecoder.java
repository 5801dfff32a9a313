/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Resource;

/**
 * Decodes quads. Statements that name no graph get {@link #getDefaultGraph()} as their context.
 */
public interface QuadDecoder extends StatementDecoder<Quad> {

	Resource getDefaultGraph();
}
