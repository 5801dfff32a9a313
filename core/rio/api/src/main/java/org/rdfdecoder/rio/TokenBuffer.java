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
 * Lookahead buffer between a {@link Lexer} and a recursive-descent parser. Holds up to {@link #MAX_LOOKAHEAD} tokens
 * that have been read from the lexer but not consumed yet.
 * <p>
 * Once the lexer has produced {@link TokenType#EOF} it is never called again; the buffer keeps returning that token.
 */
public class TokenBuffer {

	public static final int MAX_LOOKAHEAD = 3;

	private final Lexer lexer;

	private final Token[] tokens = new Token[MAX_LOOKAHEAD];

	private int head;

	private int count;

	private Token eof;

	public TokenBuffer(Lexer lexer) {
		if (lexer == null) {
			throw new IllegalArgumentException("Lexer must not be 'null'");
		}
		this.lexer = lexer;
	}

	/**
	 * Consumes and returns the next token.
	 */
	public Token next() throws IOException {
		if (count == 0) {
			return pull();
		}
		Token t = tokens[head];
		tokens[head] = null;
		head = (head + 1) % MAX_LOOKAHEAD;
		count--;
		return t;
	}

	/**
	 * Returns the next token without consuming it.
	 */
	public Token peek() throws IOException {
		return peek(1);
	}

	/**
	 * Returns the n-th unconsumed token without consuming anything; {@code peek(1)} is the token {@link #next()} will
	 * return.
	 *
	 * @param n position of the token, between 1 and {@link #MAX_LOOKAHEAD}
	 */
	public Token peek(int n) throws IOException {
		if (n < 1 || n > MAX_LOOKAHEAD) {
			throw new IllegalArgumentException("Lookahead must be between 1 and " + MAX_LOOKAHEAD + ": " + n);
		}
		while (count < n) {
			tokens[(head + count) % MAX_LOOKAHEAD] = pull();
			count++;
		}
		return tokens[(head + n - 1) % MAX_LOOKAHEAD];
	}

	private Token pull() throws IOException {
		if (eof != null) {
			return eof;
		}
		Token t = lexer.nextToken();
		if (t == null) {
			throw new IllegalStateException("Lexer returned no token");
		}
		if (t.getType() == TokenType.EOF) {
			eof = t;
		}
		return t;
	}
}
