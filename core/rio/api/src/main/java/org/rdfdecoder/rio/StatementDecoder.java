/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

import org.eclipse.rdf4j.rio.ParseErrorListener;
import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.RioSetting;
import org.rdfdecoder.model.Iri;

/**
 * Pull-style decoder for an RDF document. Use {@link #decode()} to read one statement at a time, or
 * {@link #decodeAll()} to read the whole document in one go.
 * <p>
 * Decoders are stateful and not thread-safe. Closing a decoder closes the underlying reader.
 *
 * @param <S> the statement type, {@link org.rdfdecoder.model.Triple} or {@link org.rdfdecoder.model.Quad}
 */
public interface StatementDecoder<S> extends Closeable {

	Format getFormat();

	/**
	 * Decodes the next statement.
	 *
	 * @return the next statement, or {@code null} if the end of the document has been reached
	 * @throws LexicalException if the input contains a malformed lexeme
	 * @throws SyntaxException  if a token appears where the grammar does not allow it
	 */
	S decode() throws IOException, RDFParseException;

	/**
	 * Decodes all remaining statements. If any statement is malformed the exception propagates and none of the
	 * statements decoded by this call are returned.
	 *
	 * @return the statements in document order
	 */
	List<S> decodeAll() throws IOException, RDFParseException;

	/**
	 * Sets the base IRI used to resolve relative IRIs parsed from now on. Formats without relative IRIs ignore it.
	 */
	void setBase(Iri base);

	ParserConfig getParserConfig();

	void setParserConfig(ParserConfig config);

	/**
	 * Sets the listener notified of warnings and of the fatal error that ends a {@link #decode()} call.
	 */
	void setParseErrorListener(ParseErrorListener listener);

	/**
	 * Returns the settings of the parser configuration this decoder honours.
	 */
	Collection<RioSetting<?>> getSupportedSettings();
}
