/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.model;

import java.util.Objects;
import java.util.Optional;

/**
 * An RDF literal: a lexical form with either a datatype, a language tag, or neither. A literal never carries both.
 */
public final class Literal extends Term {

	private final String label;

	private final Iri datatype;

	private final String language;

	private Literal(String label, Iri datatype, String language) {
		this.label = Objects.requireNonNull(label, "Literal label must not be null");
		if (datatype != null && language != null) {
			throw new IllegalArgumentException("A literal can not have both a datatype and a language tag");
		}
		if (language != null && language.isEmpty()) {
			throw new IllegalArgumentException("Language tag must not be empty");
		}
		this.datatype = datatype;
		this.language = language;
	}

	/**
	 * Creates a literal without datatype or language tag.
	 */
	public static Literal plain(String label) {
		return new Literal(label, null, null);
	}

	public static Literal typed(String label, Iri datatype) {
		return new Literal(label, Objects.requireNonNull(datatype, "Datatype must not be null"), null);
	}

	public static Literal tagged(String label, String language) {
		return new Literal(label, null, Objects.requireNonNull(language, "Language tag must not be null"));
	}

	/**
	 * Creates a literal from optional parts.
	 *
	 * @param label    the lexical form
	 * @param datatype the datatype, may be {@code null}
	 * @param language the language tag, may be {@code null}
	 * @throws IllegalArgumentException if both a datatype and a language tag are supplied
	 */
	public static Literal create(String label, Iri datatype, String language) {
		return new Literal(label, datatype, language);
	}

	public String getLabel() {
		return label;
	}

	public Optional<Iri> getDatatype() {
		return Optional.ofNullable(datatype);
	}

	public Optional<String> getLanguage() {
		return Optional.ofNullable(language);
	}

	@Override
	public String stringValue() {
		return label;
	}

	@Override
	public boolean isLiteral() {
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Literal)) {
			return false;
		}
		Literal other = (Literal) o;
		return label.equals(other.label) && Objects.equals(datatype, other.datatype)
				&& Objects.equals(language, other.language);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, datatype, language);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(label.length() + 2);
		sb.append('"');
		for (int i = 0; i < label.length(); i++) {
			char c = label.charAt(i);
			switch (c) {
			case '"':
				sb.append("\\\"");
				break;
			case '\\':
				sb.append("\\\\");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			default:
				sb.append(c);
			}
		}
		sb.append('"');
		if (language != null) {
			sb.append('@').append(language);
		} else if (datatype != null) {
			sb.append("^^").append(datatype);
		}
		return sb.toString();
	}
}
