/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import org.eclipse.rdf4j.rio.RDFParseException;

/**
 * Signals a lexeme that can not be classified under any rule of the grammar, such as an unterminated string literal or
 * an IRI containing a space. Line and column point at the first character of the lexeme.
 */
public class LexicalException extends RDFParseException {

	private static final long serialVersionUID = 4215387063425790912L;

	public LexicalException(String msg, long lineNo, long columnNo) {
		super(msg, lineNo, columnNo);
	}

	public LexicalException(String msg, Throwable t, long lineNo, long columnNo) {
		super(msg, t, lineNo, columnNo);
	}
}
