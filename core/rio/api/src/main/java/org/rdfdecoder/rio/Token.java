/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.util.Objects;

/**
 * A lexeme with its type and the 1-based position of its first character.
 * <p>
 * The text has delimiters removed and escape sequences decoded: an IRI without its angle brackets, a blank node label
 * without {@code _:}, string content without quotes, a language tag without {@code @}. For {@link TokenType#ERROR}
 * tokens the text is the diagnostic, which quotes the offending input.
 */
public final class Token {

	private final TokenType type;

	private final String text;

	private final int line;

	private final int column;

	public Token(TokenType type, String text, int line, int column) {
		this.type = Objects.requireNonNull(type);
		this.text = Objects.requireNonNull(text);
		this.line = line;
		this.column = column;
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		return type.name() + "(" + text + ")@" + line + ":" + column;
	}
}
