/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.nquads;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.rdfdecoder.rio.Token;
import org.rdfdecoder.rio.TokenType;

public class NQuadsLexerTest {

	private static List<Token> lex(String input) throws IOException {
		NQuadsLexer lexer = new NQuadsLexer(new StringReader(input));
		List<Token> result = new ArrayList<>();
		Token t;
		do {
			t = lexer.nextToken();
			result.add(t);
		} while (t.getType() != TokenType.EOF);
		return result;
	}

	private static void assertToken(Token t, TokenType type, String text, long line, long column) {
		assertEquals(type, t.getType(), "type of " + t.getText());
		assertEquals(text, t.getText());
		assertEquals(line, t.getLine(), "line of " + t.getText());
		assertEquals(column, t.getColumn(), "column of " + t.getText());
	}

	@Test
	public void testTokenPositions() throws IOException {
		List<Token> tokens = lex("<http://a> _:b1 \"x\"@en-GB ^^ .");

		assertEquals(7, tokens.size());
		assertToken(tokens.get(0), TokenType.IRIREF, "http://a", 1, 1);
		assertToken(tokens.get(1), TokenType.BLANK_NODE_LABEL, "b1", 1, 12);
		assertToken(tokens.get(2), TokenType.STRING_LITERAL, "x", 1, 17);
		assertToken(tokens.get(3), TokenType.LANGTAG, "en-GB", 1, 20);
		assertToken(tokens.get(4), TokenType.DATATYPE_MARKER, "^^", 1, 27);
		assertToken(tokens.get(5), TokenType.DOT, ".", 1, 30);
		assertEquals(TokenType.EOF, tokens.get(6).getType());
	}

	@Test
	public void testCommentsAndLineEnds() throws IOException {
		List<Token> tokens = lex("# comment\r\n<http://a> .\r\n\n");

		assertToken(tokens.get(0), TokenType.EOL, "", 1, 10);
		assertToken(tokens.get(1), TokenType.IRIREF, "http://a", 2, 1);
		assertToken(tokens.get(2), TokenType.DOT, ".", 2, 12);
		assertToken(tokens.get(3), TokenType.EOL, "", 2, 13);
		assertToken(tokens.get(4), TokenType.EOL, "", 3, 1);
		assertToken(tokens.get(5), TokenType.EOF, "", 4, 1);
	}

	@Test
	public void testLoneCarriageReturnEndsLine() throws IOException {
		List<Token> tokens = lex(".\r.");

		assertToken(tokens.get(1), TokenType.EOL, "", 1, 2);
		assertToken(tokens.get(2), TokenType.DOT, ".", 2, 1);
	}

	@Test
	public void testEscapes() throws IOException {
		List<Token> tokens = lex("<http://a/\\u00E9> \"a\\tb\\u00E9\\\"\\\\\" \"\\U0001F600\"");

		assertEquals("http://a/\u00E9", tokens.get(0).getText());
		assertEquals("a\tb\u00E9\"\\", tokens.get(1).getText());
		assertEquals("\uD83D\uDE00", tokens.get(2).getText());
	}

	@Test
	public void testBlankNodeLabelDots() throws IOException {
		List<Token> tokens = lex("_:a.b _:c.");

		assertToken(tokens.get(0), TokenType.BLANK_NODE_LABEL, "a.b", 1, 1);
		assertToken(tokens.get(1), TokenType.BLANK_NODE_LABEL, "c", 1, 7);
		assertToken(tokens.get(2), TokenType.DOT, ".", 1, 10);
	}

	@ParameterizedTest
	@ValueSource(strings = { "<http://a b>", "<http://a", "<http://a\\n>", "\"abc", "\"abc\ndef\"", "\"a\\q\"", "^x",
			"_x", "_:.", "@", "@en-", "{", "\"\\uD800\"", "\"\\U0000DFFF\"", "<http://a/\\uDC00>" })
	public void testMalformedLexemes(String input) throws IOException {
		Token t = lex(input).get(0);

		assertEquals(TokenType.ERROR, t.getType(), t.getText());
		assertEquals(1, t.getLine());
		assertEquals(1, t.getColumn());
	}

	@Test
	public void testErrorTextNamesTheProblem() throws IOException {
		assertTrue(lex("<http://a b>").get(0).getText().startsWith("illegal character ' ' in IRI"));
		assertTrue(lex("\"abc").get(0).getText().startsWith("unterminated string literal"));
		assertTrue(lex("<http://a").get(0).getText().startsWith("unterminated IRI"));
	}
}
