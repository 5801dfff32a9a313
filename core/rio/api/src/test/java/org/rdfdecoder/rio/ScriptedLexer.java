/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Lexer replaying a fixed list of tokens, followed by {@link TokenType#EOF}. Counts how often it is called.
 */
public class ScriptedLexer implements Lexer {

	private final Deque<Token> script = new ArrayDeque<>();

	private int calls;

	public ScriptedLexer(TokenType... types) {
		int column = 1;
		for (TokenType type : types) {
			script.add(new Token(type, type == TokenType.IRIREF ? "http://x/" + column : type.name(), 1, column));
			column += 2;
		}
	}

	public ScriptedLexer(Token... tokens) {
		for (Token t : tokens) {
			script.add(t);
		}
	}

	@Override
	public Token nextToken() {
		calls++;
		if (script.isEmpty()) {
			return new Token(TokenType.EOF, "", 1, 99);
		}
		return script.poll();
	}

	public int getCalls() {
		return calls;
	}
}
