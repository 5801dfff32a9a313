/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.helpers;

import java.io.IOException;
import java.io.Reader;

import org.eclipse.rdf4j.common.text.ASCIIUtil;
import org.rdfdecoder.rio.Lexer;
import org.rdfdecoder.rio.Token;
import org.rdfdecoder.rio.TokenType;

/**
 * Base class for the lexers of the N-Triples family. Reads code points with up to three characters of lookahead,
 * tracks 1-based line and column numbers, and lexes the terminals the grammars share: IRI references, blank node
 * labels, quoted strings and language tags.
 * <p>
 * Malformed lexemes are returned as {@link TokenType#ERROR} tokens positioned at the first character of the lexeme.
 */
public abstract class AbstractLexer implements Lexer {

	protected static final int EOF = -1;

	private static final int LOOKAHEAD = 3;

	private static final int NONE = -2;

	/*-----------*
	 * Variables *
	 *-----------*/

	private final Reader reader;

	private final int[] lookahead = new int[LOOKAHEAD];

	private int lookaheadCount;

	private int pendingChar = NONE;

	private int lineNumber = 1;

	private int columnNumber = 1;

	private boolean afterCarriageReturn;

	private int tokenLine;

	private int tokenColumn;

	private final StringBuilder parsingBuilder = new StringBuilder(64);

	/*--------------*
	 * Constructors *
	 *--------------*/

	protected AbstractLexer(Reader reader) {
		if (reader == null) {
			throw new IllegalArgumentException("Reader must not be 'null'");
		}
		this.reader = reader;
	}

	/*---------*
	 * Methods *
	 *---------*/

	/**
	 * Returns the next code point without consuming it, or {@link #EOF}.
	 */
	protected int peek() throws IOException {
		return peek(1);
	}

	/**
	 * Returns the n-th unread code point, n between 1 and 3.
	 */
	protected int peek(int n) throws IOException {
		while (lookaheadCount < n) {
			lookahead[lookaheadCount++] = readCode();
		}
		return lookahead[n - 1];
	}

	/**
	 * Consumes the next code point and updates the position.
	 *
	 * @return the code point, or {@link #EOF} if the end of the stream has been reached
	 */
	protected int read() throws IOException {
		int c;
		if (lookaheadCount > 0) {
			c = lookahead[0];
			lookaheadCount--;
			System.arraycopy(lookahead, 1, lookahead, 0, lookaheadCount);
		} else {
			c = readCode();
		}
		if (c == '\n') {
			if (!afterCarriageReturn) {
				lineNumber++;
			}
			columnNumber = 1;
		} else if (c == '\r') {
			lineNumber++;
			columnNumber = 1;
		} else if (c != EOF) {
			columnNumber++;
		}
		afterCarriageReturn = c == '\r';
		return c;
	}

	private int readCode() throws IOException {
		int next;
		if (pendingChar != NONE) {
			next = pendingChar;
			pendingChar = NONE;
		} else {
			next = reader.read();
		}
		if (next != EOF && Character.isHighSurrogate((char) next)) {
			int low = reader.read();
			if (low != EOF && Character.isLowSurrogate((char) low)) {
				next = Character.toCodePoint((char) next, (char) low);
			} else {
				pendingChar = low;
			}
		}
		return next;
	}

	/**
	 * Records the current position as the start of the next token.
	 */
	protected void markTokenStart() {
		tokenLine = lineNumber;
		tokenColumn = columnNumber;
	}

	protected Token token(TokenType type, String text) {
		return new Token(type, text, tokenLine, tokenColumn);
	}

	protected Token error(String message) {
		return new Token(TokenType.ERROR, message, tokenLine, tokenColumn);
	}

	protected StringBuilder getBuilder() {
		parsingBuilder.setLength(0);
		return parsingBuilder;
	}

	protected void skipInlineWhitespace() throws IOException {
		int c = peek();
		while (c == ' ' || c == '\t') {
			read();
			c = peek();
		}
	}

	/**
	 * Skips a comment up to, not including, the line end.
	 */
	protected void skipComment() throws IOException {
		int c = peek();
		while (c != EOF && c != '\n' && c != '\r') {
			read();
			c = peek();
		}
	}

	/**
	 * Lexes an IRI reference. The opening {@code <} must already have been read.
	 */
	protected Token lexIriRef() throws IOException {
		StringBuilder iri = getBuilder();
		while (true) {
			int c = read();
			if (c == '>') {
				return token(TokenType.IRIREF, iri.toString());
			}
			if (c == EOF || c == '\n' || c == '\r') {
				return error("unterminated IRI: <" + iri);
			}
			if (c == '\\') {
				int escaped = readUnicodeEscape();
				if (escaped == EOF) {
					return error("invalid escape sequence in IRI: <" + iri + "\\");
				}
				appendCodepoint(iri, escaped);
			} else if (isIriChar(c)) {
				appendCodepoint(iri, c);
			} else {
				return error("illegal character '" + printable(c) + "' in IRI: <" + iri);
			}
		}
	}

	/**
	 * Lexes a blank node label. The leading {@code _:} must already have been read.
	 */
	protected Token lexBlankNodeLabel() throws IOException {
		StringBuilder label = getBuilder();
		int c = peek();
		if (!isPN_CHARS_U(c) && !ASCIIUtil.isNumber(c)) {
			return error("expected a letter, digit or '_' after '_:', found '" + printable(c) + "'");
		}
		appendCodepoint(label, read());
		while (true) {
			c = peek();
			if (isPN_CHARS(c)) {
				appendCodepoint(label, read());
			} else if (c == '.' && (isPN_CHARS(peek(2)) || peek(2) == '.')) {
				appendCodepoint(label, read());
			} else {
				break;
			}
		}
		if (label.charAt(label.length() - 1) == '.') {
			return error("blank node label must not end with '.': _:" + label);
		}
		return token(TokenType.BLANK_NODE_LABEL, label.toString());
	}

	/**
	 * Lexes the content of a quoted string. The opening quote (all three for a long string) must already have been
	 * read.
	 *
	 * @param quote  the quote character, {@code "} or {@code '}
	 * @param isLong whether the string was opened with three quotes and may span lines
	 */
	protected Token lexString(int quote, boolean isLong) throws IOException {
		StringBuilder label = getBuilder();
		String opening = isLong ? new String(new char[] { (char) quote, (char) quote, (char) quote })
				: String.valueOf((char) quote);
		while (true) {
			int c = read();
			if (c == EOF || !isLong && (c == '\n' || c == '\r')) {
				return error("unterminated string literal: " + opening + label);
			}
			if (c == quote) {
				if (!isLong) {
					return token(TokenType.STRING_LITERAL, label.toString());
				}
				if (peek() == quote && peek(2) == quote && peek(3) != quote) {
					read();
					read();
					return token(TokenType.STRING_LITERAL, label.toString());
				}
				appendCodepoint(label, c);
			} else if (c == '\\') {
				int escaped = readStringEscape();
				if (escaped == EOF) {
					return error("invalid escape sequence in string literal: " + opening + label + "\\");
				}
				appendCodepoint(label, escaped);
			} else {
				appendCodepoint(label, c);
			}
		}
	}

	/**
	 * Lexes a language tag. The leading {@code @} must already have been read.
	 */
	protected Token lexLanguageTag() throws IOException {
		StringBuilder lang = getBuilder();
		if (!ASCIIUtil.isLetter(peek())) {
			return error("expected a letter after '@', found '" + printable(peek()) + "'");
		}
		while (ASCIIUtil.isLetter(peek())) {
			appendCodepoint(lang, read());
		}
		while (peek() == '-') {
			if (!isLetterOrNumber(peek(2))) {
				read();
				return error("invalid language tag: @" + lang + "-");
			}
			appendCodepoint(lang, read());
			while (isLetterOrNumber(peek())) {
				appendCodepoint(lang, read());
			}
		}
		return token(TokenType.LANGTAG, lang.toString());
	}

	/**
	 * Reads a {@code \}{@code uXXXX} or {@code \}{@code UXXXXXXXX} escape. The backslash must already have been read.
	 *
	 * @return the code point, or {@link #EOF} if the escape is malformed or denotes a surrogate
	 */
	protected int readUnicodeEscape() throws IOException {
		int c = read();
		int digits;
		if (c == 'u') {
			digits = 4;
		} else if (c == 'U') {
			digits = 8;
		} else {
			return EOF;
		}
		int codePoint = 0;
		for (int i = 0; i < digits; i++) {
			int h = peek();
			if (h == EOF || !ASCIIUtil.isHex(h)) {
				return EOF;
			}
			read();
			codePoint = codePoint * 16 + Character.digit(h, 16);
		}
		if (!Character.isValidCodePoint(codePoint) || Character.getType(codePoint) == Character.SURROGATE) {
			return EOF;
		}
		return codePoint;
	}

	/**
	 * Reads a string escape: a unicode escape or one of {@code \t \b \n \r \f \" \' \\}. The backslash must already
	 * have been read.
	 *
	 * @return the code point, or {@link #EOF} if the escape is malformed
	 */
	protected int readStringEscape() throws IOException {
		int c = peek();
		switch (c) {
		case 'u':
		case 'U':
			return readUnicodeEscape();
		case 't':
			read();
			return '\t';
		case 'b':
			read();
			return '\b';
		case 'n':
			read();
			return '\n';
		case 'r':
			read();
			return '\r';
		case 'f':
			read();
			return '\f';
		case '"':
		case '\'':
		case '\\':
			read();
			return c;
		default:
			return EOF;
		}
	}

	/**
	 * Appends the characters from codepoint into the string builder. This is the same as Character#toChars but prevents
	 * the additional char array garbage for BMP codepoints.
	 *
	 * @param dst       the destination in which to append the characters
	 * @param codePoint the codepoint to be appended
	 */
	protected static void appendCodepoint(StringBuilder dst, int codePoint) {
		if (Character.isBmpCodePoint(codePoint)) {
			dst.append((char) codePoint);
		} else if (Character.isValidCodePoint(codePoint)) {
			dst.append(Character.highSurrogate(codePoint));
			dst.append(Character.lowSurrogate(codePoint));
		} else {
			throw new IllegalArgumentException("Invalid codepoint " + codePoint);
		}
	}

	protected static String printable(int c) {
		if (c == EOF) {
			return "end of input";
		}
		if (c < 0x20 || c == 0x7F) {
			return String.format("\\u%04X", c);
		}
		return new String(Character.toChars(c));
	}

	public static boolean isLetterOrNumber(int c) {
		return ASCIIUtil.isLetter(c) || ASCIIUtil.isNumber(c);
	}

	public static boolean isWhitespace(int c) {
		return c == ' ' || c == '\t' || c == '\r' || c == '\n';
	}

	/**
	 * Characters allowed unescaped in an IRI reference.
	 */
	public static boolean isIriChar(int c) {
		return c > 0x20 && c != '<' && c != '>' && c != '"' && c != '{' && c != '}' && c != '|' && c != '^'
				&& c != '`' && c != '\\';
	}

	public static boolean isPN_CHARS_BASE(int c) {
		return ASCIIUtil.isLetter(c) || c >= 0x00C0 && c <= 0x00D6 || c >= 0x00D8 && c <= 0x00F6
				|| c >= 0x00F8 && c <= 0x02FF || c >= 0x0370 && c <= 0x037D || c >= 0x037F && c <= 0x1FFF
				|| c >= 0x200C && c <= 0x200D || c >= 0x2070 && c <= 0x218F || c >= 0x2C00 && c <= 0x2FEF
				|| c >= 0x3001 && c <= 0xD7FF || c >= 0xF900 && c <= 0xFDCF || c >= 0xFDF0 && c <= 0xFFFD
				|| c >= 0x10000 && c <= 0xEFFFF;
	}

	public static boolean isPN_CHARS_U(int c) {
		return isPN_CHARS_BASE(c) || c == '_';
	}

	public static boolean isPN_CHARS(int c) {
		return isPN_CHARS_U(c) || ASCIIUtil.isNumber(c) || c == '-' || c == 0x00B7 || c >= 0x0300 && c <= 0x036F
				|| c >= 0x203F && c <= 0x2040;
	}
}
