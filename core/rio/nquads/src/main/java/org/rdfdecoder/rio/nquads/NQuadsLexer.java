/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.nquads;

import java.io.IOException;
import java.io.Reader;

import org.rdfdecoder.rio.Token;
import org.rdfdecoder.rio.TokenType;
import org.rdfdecoder.rio.helpers.AbstractLexer;

/**
 * Line oriented lexer shared by N-Triples and N-Quads. Line ends are significant and emitted as
 * {@link TokenType#EOL}; a {@code \r\n} pair yields a single token.
 */
public class NQuadsLexer extends AbstractLexer {

	public NQuadsLexer(Reader reader) {
		super(reader);
	}

	@Override
	public Token nextToken() throws IOException {
		int c = peek();
		while (c == ' ' || c == '\t' || c == '#') {
			if (c == '#') {
				skipComment();
			} else {
				skipInlineWhitespace();
			}
			c = peek();
		}

		markTokenStart();
		c = read();
		switch (c) {
		case EOF:
			return token(TokenType.EOF, "");
		case '\r':
			if (peek() == '\n') {
				read();
			}
			return token(TokenType.EOL, "");
		case '\n':
			return token(TokenType.EOL, "");
		case '<':
			return lexIriRef();
		case '_':
			if (peek() != ':') {
				return error("expected ':' after '_', found '" + printable(peek()) + "'");
			}
			read();
			return lexBlankNodeLabel();
		case '"':
			return lexString('"', false);
		case '@':
			return lexLanguageTag();
		case '^':
			if (peek() != '^') {
				return error("expected '^^', found '^" + printable(peek()) + "'");
			}
			read();
			return token(TokenType.DATATYPE_MARKER, "^^");
		case '.':
			return token(TokenType.DOT, ".");
		default:
			return error("unexpected character '" + printable(c) + "'");
		}
	}
}
