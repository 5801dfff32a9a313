/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.turtle;

import java.io.IOException;
import java.io.Reader;

import org.eclipse.rdf4j.common.text.ASCIIUtil;
import org.eclipse.rdf4j.rio.turtle.TurtleUtil;
import org.rdfdecoder.rio.Token;
import org.rdfdecoder.rio.TokenType;
import org.rdfdecoder.rio.helpers.AbstractLexer;

/**
 * Lexer for Turtle documents. Line ends are insignificant and never emitted.
 * <p>
 * Prefixed names are returned with their prefix, the colon and the local name, with local escapes removed. The
 * directives {@code @prefix} and {@code @base} are returned as {@link TokenType#LANGTAG} tokens; the decoder tells them
 * apart from language tags by their position.
 */
public class TurtleLexer extends AbstractLexer {

	public TurtleLexer(Reader reader) {
		super(reader);
	}

	@Override
	public Token nextToken() throws IOException {
		skipWhitespaceAndComments();

		markTokenStart();
		int c = peek();
		if (c == EOF) {
			return token(TokenType.EOF, "");
		}
		if (ASCIIUtil.isNumber(c) || c == '+' || c == '-' || c == '.' && ASCIIUtil.isNumber(peek(2))) {
			return lexNumber();
		}
		if (c == ':' || TurtleUtil.isPrefixStartChar(c)) {
			return lexName();
		}

		read();
		switch (c) {
		case '<':
			return lexIriRef();
		case '"':
		case '\'':
			return lexQuotedString(c);
		case '_':
			if (peek() != ':') {
				return error("expected ':' after '_', found '" + printable(peek()) + "'");
			}
			read();
			return lexBlankNodeLabel();
		case '@':
			return lexLanguageTag();
		case '^':
			if (peek() != '^') {
				return error("expected '^^', found '^" + printable(peek()) + "'");
			}
			read();
			return token(TokenType.DATATYPE_MARKER, "^^");
		case '[':
			skipWhitespaceAndComments();
			if (peek() == ']') {
				read();
				return token(TokenType.ANON, "[]");
			}
			return token(TokenType.OPEN_BRACKET, "[");
		case ']':
			return token(TokenType.CLOSE_BRACKET, "]");
		case '(':
			return token(TokenType.OPEN_PAREN, "(");
		case ')':
			return token(TokenType.CLOSE_PAREN, ")");
		case '.':
			return token(TokenType.DOT, ".");
		case ';':
			return token(TokenType.SEMICOLON, ";");
		case ',':
			return token(TokenType.COMMA, ",");
		default:
			return error("unexpected character '" + printable(c) + "'");
		}
	}

	private void skipWhitespaceAndComments() throws IOException {
		int c = peek();
		while (isWhitespace(c) || c == '#') {
			if (c == '#') {
				skipComment();
			} else {
				read();
			}
			c = peek();
		}
	}

	/**
	 * Lexes a string in any of the four quoting styles. The first quote must already have been read.
	 */
	private Token lexQuotedString(int quote) throws IOException {
		if (peek() != quote) {
			return lexString(quote, false);
		}
		if (peek(2) == quote) {
			read();
			read();
			return lexString(quote, true);
		}
		read();
		return token(TokenType.STRING_LITERAL, "");
	}

	private Token lexNumber() throws IOException {
		StringBuilder value = getBuilder();
		TokenType type = TokenType.INTEGER;

		int c = peek();
		if (c == '+' || c == '-') {
			appendCodepoint(value, read());
			c = peek();
			if (!ASCIIUtil.isNumber(c) && !(c == '.' && ASCIIUtil.isNumber(peek(2)))) {
				return error("expected a number after '" + value + "', found '" + printable(c) + "'");
			}
		}
		readDigits(value);

		if (peek() == '.' && ASCIIUtil.isNumber(peek(2))) {
			appendCodepoint(value, read());
			readDigits(value);
			type = TokenType.DECIMAL;
		}

		c = peek();
		if (c == 'e' || c == 'E') {
			appendCodepoint(value, read());
			c = peek();
			if (c == '+' || c == '-') {
				appendCodepoint(value, read());
				c = peek();
			}
			if (!ASCIIUtil.isNumber(c)) {
				return error("exponent value missing in '" + value + "'");
			}
			readDigits(value);
			type = TokenType.DOUBLE;
		}
		return token(type, value.toString());
	}

	private void readDigits(StringBuilder value) throws IOException {
		while (ASCIIUtil.isNumber(peek())) {
			appendCodepoint(value, read());
		}
	}

	/**
	 * Lexes a prefixed name or one of the keywords {@code a}, {@code true}, {@code false}, {@code PREFIX} and
	 * {@code BASE}.
	 */
	private Token lexName() throws IOException {
		StringBuilder name = getBuilder();
		if (peek() != ':') {
			appendCodepoint(name, read());
			while (true) {
				int c = peek();
				if (isPN_CHARS(c)) {
					appendCodepoint(name, read());
				} else if (c == '.' && (isPN_CHARS(peek(2)) || peek(2) == '.')) {
					appendCodepoint(name, read());
				} else {
					break;
				}
			}
			if (name.charAt(name.length() - 1) == '.') {
				return error("prefix must not end with '.': " + name);
			}
		}

		if (peek() != ':') {
			return keyword(name.toString());
		}
		appendCodepoint(name, read());

		int prefixLength = name.length();
		int c = peek();
		if (!TurtleUtil.isNameStartChar(c)) {
			return token(TokenType.PNAME_NS, name.toString());
		}
		while (TurtleUtil.isNameChar(c)) {
			if (c == '.' && !TurtleUtil.isNameChar(peek(2))) {
				break;
			}
			read();
			if (c == '\\') {
				int escaped = read();
				if (!TurtleUtil.isLocalEscapedChar(escaped)) {
					return error("invalid escape sequence '\\" + printable(escaped) + "' in prefixed name: " + name);
				}
				appendCodepoint(name, escaped);
			} else if (c == '%') {
				if (!ASCIIUtil.isHex(peek()) || !ASCIIUtil.isHex(peek(2))) {
					return error("incomplete percent-encoded sequence in prefixed name: " + name + "%");
				}
				appendCodepoint(name, c);
				appendCodepoint(name, read());
				appendCodepoint(name, read());
			} else {
				appendCodepoint(name, c);
			}
			c = peek();
		}
		if (name.length() > prefixLength && name.charAt(name.length() - 1) == '.') {
			return error("prefixed name must not end with '.': " + name);
		}
		return token(TokenType.PNAME_LN, name.toString());
	}

	private Token keyword(String word) {
		if (word.equals("a")) {
			return token(TokenType.A, word);
		}
		if (word.equals("true") || word.equals("false")) {
			return token(TokenType.BOOLEAN, word);
		}
		if (word.equalsIgnoreCase("prefix")) {
			return token(TokenType.SPARQL_PREFIX, word);
		}
		if (word.equalsIgnoreCase("base")) {
			return token(TokenType.SPARQL_BASE, word);
		}
		return error("expected ':' after prefix, found '" + word + "'");
	}
}
