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

import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.rdfdecoder.rio.Lexer;
import org.rdfdecoder.rio.LexicalException;
import org.rdfdecoder.rio.SyntaxException;
import org.rdfdecoder.rio.Token;
import org.rdfdecoder.rio.TokenBuffer;
import org.rdfdecoder.rio.TokenType;

/**
 * Base class for decoders of text formats, which consume tokens from a {@link Lexer} through a {@link TokenBuffer}.
 * Provides the typed expectation checks the recursive-descent grammars are built from.
 */
public abstract class AbstractTokenDecoder extends AbstractQuadDecoder {

	protected final TokenBuffer tokens;

	protected AbstractTokenDecoder(Reader reader, Lexer lexer, ParserConfig config) {
		super(reader, config);
		this.tokens = new TokenBuffer(lexer);
	}

	/**
	 * Consumes the next token and checks that it has the expected type.
	 *
	 * @param context what is being parsed, used in the error message
	 */
	protected Token expect(String context, TokenType expected) throws IOException, RDFParseException {
		Token t = tokens.next();
		if (t.getType() != expected) {
			throw unexpected(t, context);
		}
		return t;
	}

	/**
	 * Consumes the next token and checks that it has one of the expected types.
	 *
	 * @param context what is being parsed, used in the error message
	 */
	protected Token expectOneOf(String context, TokenType... expected) throws IOException, RDFParseException {
		Token t = tokens.next();
		for (TokenType e : expected) {
			if (t.getType() == e) {
				return t;
			}
		}
		throw unexpected(t, context);
	}

	/**
	 * Creates the exception for a token that is not allowed here: a {@link LexicalException} if the lexer flagged the
	 * token as malformed, a {@link SyntaxException} otherwise.
	 */
	protected RDFParseException unexpected(Token t, String context) {
		if (t.getType() == TokenType.ERROR) {
			return new LexicalException(t.getText(), t.getLine(), t.getColumn());
		}
		return new SyntaxException(t.getType(), context, t.getLine(), t.getColumn());
	}
}
