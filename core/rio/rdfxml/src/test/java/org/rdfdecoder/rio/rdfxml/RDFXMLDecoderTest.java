/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.rdfxml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.eclipse.rdf4j.rio.RDFParseException;
import org.eclipse.rdf4j.rio.helpers.ParseErrorCollector;
import org.junit.jupiter.api.Test;
import org.rdfdecoder.model.BlankNode;
import org.rdfdecoder.model.Iri;
import org.rdfdecoder.model.Literal;
import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Resource;
import org.rdfdecoder.model.Vocabulary;
import org.rdfdecoder.rio.LexicalException;
import org.rdfdecoder.rio.SyntaxException;

public class RDFXMLDecoderTest {

	private static final String RDF_OPEN = "<rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\""
			+ " xmlns:ex=\"http://example.org/\">\n";

	private static final String RDF_CLOSE = "</rdf:RDF>\n";

	private static Iri ex(String localName) {
		return Iri.of("http://example.org/" + localName);
	}

	private static RDFXMLDecoder decoder(String document) {
		return new RDFXMLDecoder(new StringReader(document));
	}

	private static List<Quad> decodeAll(String body) throws IOException {
		return decoder("<?xml version=\"1.0\"?>\n" + RDF_OPEN + body + RDF_CLOSE).decodeAll();
	}

	@Test
	public void testDescription() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Description rdf:about=\"http://example.org/s\">\n"
				+ "  <ex:p rdf:resource=\"http://example.org/o\"/>\n"
				+ "  <ex:name xml:lang=\"en\">Alice</ex:name>\n"
				+ "  <ex:age rdf:datatype=\"http://www.w3.org/2001/XMLSchema#integer\">42</ex:age>\n"
				+ "  <ex:note>plain</ex:note>\n"
				+ "</rdf:Description>\n");

		assertEquals(4, quads.size());
		assertEquals(Quad.of(ex("s"), ex("p"), ex("o")), quads.get(0));
		assertEquals(Quad.of(ex("s"), ex("name"), Literal.tagged("Alice", "en")), quads.get(1));
		assertEquals(Quad.of(ex("s"), ex("age"), Literal.typed("42", Vocabulary.XSD_INTEGER)), quads.get(2));
		assertEquals(Quad.of(ex("s"), ex("note"), Literal.plain("plain")), quads.get(3));
	}

	@Test
	public void testOneStatementPerDecodeCall() throws IOException {
		RDFXMLDecoder decoder = decoder(RDF_OPEN + "<rdf:Description rdf:about=\"http://example.org/s\">"
				+ "<ex:p>1</ex:p><ex:p>2</ex:p></rdf:Description>\n"
				+ "<rdf:Description rdf:about=\"http://example.org/t\"><ex:p>3</ex:p></rdf:Description>\n" + RDF_CLOSE);

		assertEquals(Literal.plain("1"), decoder.decode().getObject());
		assertEquals(Literal.plain("2"), decoder.decode().getObject());
		Quad third = decoder.decode();
		assertEquals(ex("t"), third.getSubject());
		assertTrue(third.isInDefaultGraph());
		assertNull(decoder.decode());
		assertNull(decoder.decode());
	}

	@Test
	public void testTypedNodeAndPropertyAttributes() throws IOException {
		List<Quad> quads = decodeAll(
				"<ex:Person rdf:about=\"http://example.org/a\" ex:name=\"A\" rdf:type=\"http://example.org/Agent\"/>\n");

		assertEquals(3, quads.size());
		assertEquals(Quad.of(ex("a"), Vocabulary.RDF_TYPE, ex("Person")), quads.get(0));
		assertTrue(quads.contains(Quad.of(ex("a"), ex("name"), Literal.plain("A"))));
		assertTrue(quads.contains(Quad.of(ex("a"), Vocabulary.RDF_TYPE, ex("Agent"))));
	}

	@Test
	public void testLanguageScoping() throws IOException {
		List<Quad> quads = decoder(RDF_OPEN.replace(">\n", " xml:lang=\"fr\">\n")
				+ "<rdf:Description rdf:about=\"http://example.org/s\">\n" + "  <ex:p>bonjour</ex:p>\n"
				+ "  <ex:p xml:lang=\"\">none</ex:p>\n" + "  <ex:p xml:lang=\"de\">hallo</ex:p>\n"
				+ "</rdf:Description>\n" + RDF_CLOSE).decodeAll();

		assertEquals(Literal.tagged("bonjour", "fr"), quads.get(0).getObject());
		assertEquals(Literal.plain("none"), quads.get(1).getObject());
		assertEquals(Literal.tagged("hallo", "de"), quads.get(2).getObject());
	}

	@Test
	public void testBaseScoping() throws IOException {
		List<Quad> quads = decoder(RDF_OPEN.replace(">\n", " xml:base=\"http://example.org/doc\">\n")
				+ "<rdf:Description rdf:ID=\"x\"><ex:p rdf:resource=\"other\"/></rdf:Description>\n"
				+ "<rdf:Description rdf:about=\"y\" xml:base=\"http://other.org/dir/\">"
				+ "<ex:p rdf:resource=\"#z\"/></rdf:Description>\n" + RDF_CLOSE).decodeAll();

		assertEquals(Quad.of(Iri.of("http://example.org/doc#x"), ex("p"), ex("other")), quads.get(0));
		assertEquals(Quad.of(Iri.of("http://other.org/dir/y"), ex("p"), Iri.of("http://other.org/dir/#z")),
				quads.get(1));
	}

	@Test
	public void testBaseFromCaller() throws IOException {
		RDFXMLDecoder decoder = decoder(RDF_OPEN + "<rdf:Description rdf:about=\"s\"><ex:p>v</ex:p></rdf:Description>\n"
				+ RDF_CLOSE);
		decoder.setBase(ex(""));

		assertEquals(ex("s"), decoder.decode().getSubject());
	}

	@Test
	public void testBaseChangedBetweenDecodeCalls() throws IOException {
		RDFXMLDecoder decoder = decoder(RDF_OPEN.replace(">\n", " xml:base=\"dir/\">\n")
				+ "<rdf:Description rdf:about=\"s1\"><ex:p>v</ex:p></rdf:Description>\n"
				+ "<rdf:Description rdf:about=\"s2\"><ex:p>v</ex:p></rdf:Description>\n" + RDF_CLOSE);

		decoder.setBase(Iri.of("http://a.example/"));
		assertEquals(Iri.of("http://a.example/dir/s1"), decoder.decode().getSubject());

		decoder.setBase(Iri.of("http://b.example/"));
		assertEquals(Iri.of("http://b.example/dir/s2"), decoder.decode().getSubject());
		assertNull(decoder.decode());
	}

	@Test
	public void testRelativeIriWithoutBase() {
		SyntaxException e = assertThrows(SyntaxException.class, () -> decodeAll(
				"<rdf:Description rdf:about=\"s\"><ex:p>v</ex:p></rdf:Description>\n"));
		assertEquals("absolute IRI", e.getExpected());
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testNodeIds() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Description rdf:nodeID=\"n\"><ex:p rdf:nodeID=\"m\"/></rdf:Description>\n"
				+ "<rdf:Description rdf:nodeID=\"m\"><ex:q rdf:nodeID=\"n\"/></rdf:Description>\n");

		assertEquals(quads.get(0).getSubject(), quads.get(1).getObject());
		assertEquals(quads.get(0).getObject(), quads.get(1).getSubject());
		assertNotEquals(quads.get(0).getSubject(), quads.get(0).getObject());
	}

	@Test
	public void testNestedNodeElement() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Description rdf:about=\"http://example.org/a\">\n" + "  <ex:knows>\n"
				+ "    <ex:Person rdf:about=\"http://example.org/b\"><ex:name>B</ex:name></ex:Person>\n"
				+ "  </ex:knows>\n" + "  <ex:knows><rdf:Description/></ex:knows>\n" + "</rdf:Description>\n");

		assertEquals(4, quads.size());
		assertEquals(Quad.of(ex("a"), ex("knows"), ex("b")), quads.get(0));
		assertEquals(Quad.of(ex("b"), Vocabulary.RDF_TYPE, ex("Person")), quads.get(1));
		assertEquals(Quad.of(ex("b"), ex("name"), Literal.plain("B")), quads.get(2));
		assertTrue(quads.get(3).getObject().isBlankNode());
	}

	@Test
	public void testParseTypeResource() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Description rdf:about=\"http://example.org/a\">"
				+ "<ex:address rdf:parseType=\"Resource\"><ex:city>Paris</ex:city></ex:address>"
				+ "</rdf:Description>\n");

		assertEquals(2, quads.size());
		Resource address = (Resource) quads.get(0).getObject();
		assertTrue(address.isBlankNode());
		assertEquals(Quad.of(address, ex("city"), Literal.plain("Paris")), quads.get(1));
	}

	@Test
	public void testParseTypeCollection() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Description rdf:about=\"http://example.org/a\">"
				+ "<ex:list rdf:parseType=\"Collection\">" + "<rdf:Description rdf:about=\"http://example.org/x\"/>"
				+ "<rdf:Description rdf:about=\"http://example.org/y\"/>" + "</ex:list>"
				+ "<ex:empty rdf:parseType=\"Collection\"/>" + "</rdf:Description>\n");

		Resource head = null;
		for (Quad quad : quads) {
			if (quad.getPredicate().equals(ex("list"))) {
				head = (Resource) quad.getObject();
			}
		}
		assertEquals(ex("x"), objectOf(quads, head, Vocabulary.RDF_FIRST));
		Resource second = (Resource) objectOf(quads, head, Vocabulary.RDF_REST);
		assertEquals(ex("y"), objectOf(quads, second, Vocabulary.RDF_FIRST));
		assertEquals(Vocabulary.RDF_NIL, objectOf(quads, second, Vocabulary.RDF_REST));
		assertTrue(quads.contains(Quad.of(ex("a"), ex("empty"), Vocabulary.RDF_NIL)));
		assertEquals(6, quads.size());
	}

	private static Object objectOf(List<Quad> quads, Resource subject, Iri predicate) {
		for (Quad quad : quads) {
			if (quad.getSubject().equals(subject) && quad.getPredicate().equals(predicate)) {
				return quad.getObject();
			}
		}
		return null;
	}

	@Test
	public void testParseTypeLiteral() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Description rdf:about=\"http://example.org/a\">"
				+ "<ex:doc rdf:parseType=\"Literal\"><b>bold</b> text</ex:doc>" + "</rdf:Description>\n");

		Literal literal = (Literal) quads.get(0).getObject();
		assertEquals(Vocabulary.RDF_XMLLITERAL, literal.getDatatype().get());
		assertTrue(literal.getLabel().contains("<b>bold</b>"), literal.getLabel());
		assertTrue(literal.getLabel().endsWith(" text"), literal.getLabel());
	}

	@Test
	public void testUnknownParseTypeIsAWarning() throws IOException {
		ParseErrorCollector collector = new ParseErrorCollector();
		RDFXMLDecoder decoder = decoder(RDF_OPEN + "<rdf:Description rdf:about=\"http://example.org/a\">"
				+ "<ex:doc rdf:parseType=\"Other\">x</ex:doc></rdf:Description>\n" + RDF_CLOSE);
		decoder.setParseErrorListener(collector);

		Literal literal = (Literal) decoder.decode().getObject();
		assertEquals(Literal.typed("x", Vocabulary.RDF_XMLLITERAL), literal);
		assertEquals(1, collector.getWarnings().size());
		assertTrue(collector.getFatalErrors().isEmpty());
	}

	@Test
	public void testListItems() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Bag rdf:about=\"http://example.org/bag\">"
				+ "<rdf:li>one</rdf:li><rdf:li>two</rdf:li></rdf:Bag>\n");

		assertEquals(Quad.of(ex("bag"), Vocabulary.RDF_TYPE, Iri.of(Vocabulary.RDF_NAMESPACE + "Bag")), quads.get(0));
		assertEquals(Quad.of(ex("bag"), Vocabulary.rdfMember(1), Literal.plain("one")), quads.get(1));
		assertEquals(Quad.of(ex("bag"), Vocabulary.rdfMember(2), Literal.plain("two")), quads.get(2));
	}

	@Test
	public void testReification() throws IOException {
		List<Quad> quads = decoder(RDF_OPEN.replace(">\n", " xml:base=\"http://example.org/doc\">\n")
				+ "<rdf:Description rdf:about=\"http://example.org/s\"><ex:p rdf:ID=\"st\">v</ex:p></rdf:Description>\n"
				+ RDF_CLOSE).decodeAll();

		Iri statement = Iri.of("http://example.org/doc#st");
		assertEquals(5, quads.size());
		assertEquals(Quad.of(ex("s"), ex("p"), Literal.plain("v")), quads.get(0));
		assertTrue(quads.contains(Quad.of(statement, Vocabulary.RDF_TYPE, Vocabulary.RDF_STATEMENT)));
		assertTrue(quads.contains(Quad.of(statement, Vocabulary.RDF_SUBJECT, ex("s"))));
		assertTrue(quads.contains(Quad.of(statement, Vocabulary.RDF_PREDICATE, ex("p"))));
		assertTrue(quads.contains(Quad.of(statement, Vocabulary.RDF_OBJECT, Literal.plain("v"))));
	}

	@Test
	public void testEmptyPropertyElementWithAttributes() throws IOException {
		List<Quad> quads = decodeAll("<rdf:Description rdf:about=\"http://example.org/a\">"
				+ "<ex:author ex:name=\"Bob\"/><ex:title/></rdf:Description>\n");

		BlankNode author = (BlankNode) quads.get(0).getObject();
		assertEquals(Quad.of(author, ex("name"), Literal.plain("Bob")), quads.get(1));
		assertEquals(Quad.of(ex("a"), ex("title"), Literal.plain("")), quads.get(2));
	}

	@Test
	public void testNodeElementAsDocumentElement() throws IOException {
		RDFXMLDecoder decoder = decoder("<ex:Thing xmlns:ex=\"http://example.org/\""
				+ " xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\" rdf:about=\"http://example.org/t\"/>");

		assertEquals(Quad.of(ex("t"), Vocabulary.RDF_TYPE, ex("Thing")), decoder.decode());
		assertNull(decoder.decode());
	}

	@Test
	public void testEmptyDocuments() throws IOException {
		assertNull(decoder("").decode());
		assertNull(decoder(" \n").decode());
		assertNull(decoder(RDF_OPEN + RDF_CLOSE).decode());
	}

	@Test
	public void testMalformedXml() {
		assertThrows(LexicalException.class, () -> decodeAll("<rdf:Description></ex:p>\n"));
	}

	@Test
	public void testExternalEntitiesAreNotResolved() {
		String document = "<?xml version=\"1.0\"?>\n<!DOCTYPE rdf:RDF [<!ENTITY secret SYSTEM \"file:///etc/passwd\">]>\n"
				+ RDF_OPEN + "<rdf:Description rdf:about=\"http://example.org/a\"><ex:p>&secret;</ex:p>"
				+ "</rdf:Description>\n" + RDF_CLOSE;

		assertThrows(RDFParseException.class, () -> decoder(document).decodeAll());
	}

	@Test
	public void testConflictingIdentifiers() {
		SyntaxException e = assertThrows(SyntaxException.class, () -> decodeAll(
				"<rdf:Description rdf:about=\"http://example.org/a\" rdf:nodeID=\"n\"/>\n"));
		assertEquals("node element", e.getExpected());
	}

	@Test
	public void testTextBetweenNodeElements() {
		SyntaxException e = assertThrows(SyntaxException.class, () -> decodeAll("stray text\n"));
		assertEquals("element", e.getExpected());
	}

	@Test
	public void testUnqualifiedElement() {
		SyntaxException e = assertThrows(SyntaxException.class,
				() -> decodeAll("<Thing rdf:about=\"http://example.org/a\"/>\n"));
		assertEquals("qualified element", e.getExpected());
	}

	@Test
	public void testForbiddenPropertyElement() {
		SyntaxException e = assertThrows(SyntaxException.class, () -> decodeAll(
				"<rdf:Description rdf:about=\"http://example.org/a\"><rdf:Description/></rdf:Description>\n"));
		assertEquals("property element", e.getExpected());
	}

	@Test
	public void testFaultDiscardsTheWholeNodeElement() {
		RDFXMLDecoder decoder = decoder(RDF_OPEN + "<rdf:Description rdf:about=\"http://example.org/s\">"
				+ "<ex:p>1</ex:p><rdf:Description/></rdf:Description>\n" + RDF_CLOSE);

		SyntaxException e = assertThrows(SyntaxException.class, decoder::decode);
		assertEquals("property element", e.getExpected());

		// the decoder resumes inside the broken element, which is an error of its own
		e = assertThrows(SyntaxException.class, decoder::decode);
		assertEquals("end of document", e.getExpected());
	}

	@Test
	public void testFatalErrorIsReported() {
		ParseErrorCollector collector = new ParseErrorCollector();
		RDFXMLDecoder decoder = decoder(RDF_OPEN + "<Thing/>\n" + RDF_CLOSE);
		decoder.setParseErrorListener(collector);

		assertThrows(SyntaxException.class, decoder::decode);
		assertEquals(1, collector.getFatalErrors().size());
	}
}
