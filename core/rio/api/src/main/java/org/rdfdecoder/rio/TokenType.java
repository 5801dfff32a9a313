/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

/**
 * Kinds of tokens produced by the lexers of the text based formats. Each lexer emits the subset its grammar needs.
 * Whitespace and comments are consumed by the lexers and never emitted.
 */
public enum TokenType {

	IRIREF("IRI"),

	/**
	 * A prefix declaration name such as {@code ex:}, text is the prefix including the colon.
	 */
	PNAME_NS("prefix"),

	/**
	 * A prefixed name such as {@code ex:thing}, text is {@code prefix:local} with escapes removed from the local part.
	 */
	PNAME_LN("prefixed name"),

	BLANK_NODE_LABEL("blank node"),

	ANON("anonymous blank node"),

	STRING_LITERAL("literal"),

	LANGTAG("language tag"),

	DATATYPE_MARKER("'^^'"),

	INTEGER("integer"),

	DECIMAL("decimal"),

	DOUBLE("double"),

	BOOLEAN("boolean"),

	/**
	 * The keyword {@code a}, shorthand for {@code rdf:type}.
	 */
	A("'a'"),

	SPARQL_PREFIX("PREFIX"),

	SPARQL_BASE("BASE"),

	DOT("'.'"),

	SEMICOLON("';'"),

	COMMA("','"),

	OPEN_BRACKET("'['"),

	CLOSE_BRACKET("']'"),

	OPEN_PAREN("'('"),

	CLOSE_PAREN("')'"),

	EOL("end of line"),

	EOF("end of input"),

	/**
	 * A malformed lexeme. The token text is the lexer's diagnostic.
	 */
	ERROR("lexical error");

	private final String description;

	TokenType(String description) {
		this.description = description;
	}

	@Override
	public String toString() {
		return description;
	}
}
