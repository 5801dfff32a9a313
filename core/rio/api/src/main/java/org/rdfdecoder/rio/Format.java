/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.util.Locale;
import java.util.Optional;

import org.eclipse.rdf4j.rio.RDFFormat;

/**
 * The serialization formats a decoder can be requested for. Each constant is backed by the matching rdf4j
 * {@link RDFFormat}, which supplies its name, MIME types and file extensions.
 */
public enum Format {

	NTRIPLES(RDFFormat.NTRIPLES),

	NQUADS(RDFFormat.NQUADS),

	TURTLE(RDFFormat.TURTLE),

	RDFXML(RDFFormat.RDFXML);

	private final RDFFormat rdfFormat;

	Format(RDFFormat rdfFormat) {
		this.rdfFormat = rdfFormat;
	}

	public RDFFormat getRDFFormat() {
		return rdfFormat;
	}

	public String getName() {
		return rdfFormat.getName();
	}

	public String getDefaultMIMEType() {
		return rdfFormat.getDefaultMIMEType();
	}

	public String getDefaultFileExtension() {
		return rdfFormat.getDefaultFileExtension();
	}

	/**
	 * Returns {@code true} if documents in this format can name graphs, i.e. decode to quads with a context other than
	 * the default graph.
	 */
	public boolean supportsContexts() {
		return rdfFormat.supportsContexts();
	}

	/**
	 * Tries to match a file name to a format by its extension.
	 *
	 * @param fileName a file name such as {@code data.ttl}
	 * @return the matching format, or {@link Optional#empty()} if the extension is unknown
	 */
	public static Optional<Format> forFileName(String fileName) {
		int dot = fileName.lastIndexOf('.');
		if (dot < 0 || dot == fileName.length() - 1) {
			return Optional.empty();
		}
		String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
		for (Format format : values()) {
			if (format.rdfFormat.hasFileExtension(extension)) {
				return Optional.of(format);
			}
		}
		return Optional.empty();
	}

	/**
	 * Tries to match a MIME type to a format. Parameters such as {@code charset} are ignored.
	 *
	 * @param mimeType a MIME type such as {@code text/turtle;charset=UTF-8}
	 * @return the matching format, or {@link Optional#empty()} if the MIME type is unknown
	 */
	public static Optional<Format> forMIMEType(String mimeType) {
		int semicolon = mimeType.indexOf(';');
		String type = (semicolon < 0 ? mimeType : mimeType.substring(0, semicolon)).trim();
		for (Format format : values()) {
			if (format.rdfFormat.hasMIMEType(type)) {
				return Optional.of(format);
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return getName();
	}
}
