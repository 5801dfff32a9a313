/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.io.IOException;

/**
 * Source of tokens for a {@link TokenBuffer}.
 * <p>
 * A lexer advances monotonically and never rewinds. It reports a malformed lexeme as a {@link TokenType#ERROR} token
 * carrying the diagnostic, and signals exhaustion of its input with a {@link TokenType#EOF} token.
 */
public interface Lexer {

	Token nextToken() throws IOException;
}
