/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;

import org.junit.jupiter.api.Test;

public class TokenBufferTest {

	@Test
	public void testPeekDoesNotConsume() throws IOException {
		ScriptedLexer lexer = new ScriptedLexer(TokenType.IRIREF, TokenType.DOT);
		TokenBuffer buffer = new TokenBuffer(lexer);

		Token peeked = buffer.peek();
		assertSame(peeked, buffer.peek());
		assertEquals(1, lexer.getCalls());
		assertSame(peeked, buffer.next());
		assertEquals(TokenType.DOT, buffer.next().getType());
	}

	@Test
	public void testNextPullsOnlyWhenEmpty() throws IOException {
		ScriptedLexer lexer = new ScriptedLexer(TokenType.IRIREF, TokenType.DOT);
		TokenBuffer buffer = new TokenBuffer(lexer);

		assertEquals(TokenType.IRIREF, buffer.next().getType());
		assertEquals(1, lexer.getCalls());
		assertEquals(TokenType.DOT, buffer.next().getType());
		assertEquals(2, lexer.getCalls());
	}

	@Test
	public void testLookaheadOfThree() throws IOException {
		TokenBuffer buffer = new TokenBuffer(
				new ScriptedLexer(TokenType.IRIREF, TokenType.SEMICOLON, TokenType.COMMA, TokenType.DOT));

		assertEquals(TokenType.COMMA, buffer.peek(3).getType());
		assertEquals(TokenType.SEMICOLON, buffer.peek(2).getType());
		assertEquals(TokenType.IRIREF, buffer.next().getType());
		assertEquals(TokenType.DOT, buffer.peek(3).getType());
		assertEquals(TokenType.SEMICOLON, buffer.next().getType());
		assertEquals(TokenType.COMMA, buffer.next().getType());
		assertEquals(TokenType.DOT, buffer.next().getType());
	}

	@Test
	public void testLookaheadOutOfRange() {
		TokenBuffer buffer = new TokenBuffer(new ScriptedLexer(TokenType.DOT));

		assertThrows(IllegalArgumentException.class, () -> buffer.peek(0));
		assertThrows(IllegalArgumentException.class, () -> buffer.peek(TokenBuffer.MAX_LOOKAHEAD + 1));
	}

	@Test
	public void testLexerIsNotCalledAfterEndOfInput() throws IOException {
		ScriptedLexer lexer = new ScriptedLexer(TokenType.DOT);
		TokenBuffer buffer = new TokenBuffer(lexer);

		buffer.next();
		Token eof = buffer.next();
		assertEquals(TokenType.EOF, eof.getType());
		assertSame(eof, buffer.peek(3));
		assertSame(eof, buffer.next());
		assertSame(eof, buffer.next());
		assertEquals(2, lexer.getCalls());
	}

	@Test
	public void testMissingTokenIsAnEngineFault() {
		TokenBuffer buffer = new TokenBuffer(() -> null);

		assertThrows(IllegalStateException.class, buffer::next);
	}
}
