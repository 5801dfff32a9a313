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
 * Signals a well-formed token of a kind the grammar does not allow at the current position, or a construct that is
 * structurally invalid.
 */
public class SyntaxException extends RDFParseException {

	private static final long serialVersionUID = -3022370871457316484L;

	private final TokenType found;

	private final String expected;

	/**
	 * Creates an exception for an unexpected token.
	 *
	 * @param found    the type of the offending token
	 * @param expected what the grammar expected at this position, e.g. {@code object}
	 */
	public SyntaxException(TokenType found, String expected, long lineNo, long columnNo) {
		super("unexpected " + found + " while expecting " + expected, lineNo, columnNo);
		this.found = found;
		this.expected = expected;
	}

	/**
	 * Creates an exception with a custom message, for faults that are not about a single token.
	 */
	public SyntaxException(String msg, String expected, long lineNo, long columnNo) {
		super(msg, lineNo, columnNo);
		this.found = null;
		this.expected = expected;
	}

	/**
	 * Returns the type of the offending token, or {@code null} if the fault is not about a single token.
	 */
	public TokenType getFound() {
		return found;
	}

	public String getExpected() {
		return expected;
	}
}
