/*******************************************************************************
 * Copyright (c) 2015 Eclipse RDF4J contributors, Aduna, and others.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *******************************************************************************/
package org.rdfdecoder.rio.rdfxml;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.stream.Location;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLEventWriter;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.EntityReference;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;

import org.eclipse.rdf4j.rio.ParserConfig;
import org.eclipse.rdf4j.rio.RDFParseException;
import org.rdfdecoder.model.BlankNode;
import org.rdfdecoder.model.Iri;
import org.rdfdecoder.model.Literal;
import org.rdfdecoder.model.Quad;
import org.rdfdecoder.model.Resource;
import org.rdfdecoder.model.Term;
import org.rdfdecoder.model.Vocabulary;
import org.rdfdecoder.rio.Format;
import org.rdfdecoder.rio.LexicalException;
import org.rdfdecoder.rio.SyntaxException;
import org.rdfdecoder.rio.helpers.AbstractQuadDecoder;

/**
 * Decoder for RDF/XML documents, reading the XML with a StAX {@link XMLEventReader}.
 * <p>
 * The document is decoded one top-level node element at a time: the triples of a node element, including those of
 * nested node elements, are collected before the first of them is handed out. Malformed XML is reported as a
 * {@link LexicalException}, a violation of the RDF/XML grammar as a {@link SyntaxException} at the location of the
 * offending element. DTDs and external entities are not processed.
 */
public class RDFXMLDecoder extends AbstractQuadDecoder {

	private static final String RDF_NS = Vocabulary.RDF_NAMESPACE;

	private static final QName XML_BASE = new QName(XMLConstants.XML_NS_URI, "base");

	private static final QName XML_LANG = new QName(XMLConstants.XML_NS_URI, "lang");

	private static final QName RDF_ABOUT = rdf("about");

	private static final QName RDF_ID = rdf("ID");

	private static final QName RDF_NODEID = rdf("nodeID");

	private static final QName RDF_RESOURCE = rdf("resource");

	private static final QName RDF_DATATYPE = rdf("datatype");

	private static final QName RDF_PARSETYPE = rdf("parseType");

	/**
	 * rdf: attributes that carry syntax rather than a property value.
	 */
	private static final Set<String> SYNTAX_ATTRIBUTES = new HashSet<>(
			Arrays.asList("about", "ID", "nodeID", "resource", "datatype", "parseType"));

	/**
	 * rdf: names that may not be used as property attributes.
	 */
	private static final Set<String> FORBIDDEN_ATTRIBUTES = new HashSet<>(
			Arrays.asList("RDF", "Description", "li", "aboutEach", "aboutEachPrefix", "bagID"));

	private static final Set<String> FORBIDDEN_NODE_ELEMENTS = new HashSet<>(Arrays.asList("RDF", "ID", "about",
			"bagID", "parseType", "resource", "nodeID", "li", "aboutEach", "aboutEachPrefix", "datatype"));

	private static final Set<String> FORBIDDEN_PROPERTY_ELEMENTS = new HashSet<>(Arrays.asList("RDF", "Description",
			"ID", "about", "bagID", "parseType", "resource", "nodeID", "aboutEach", "aboutEachPrefix", "datatype"));

	/*-----------*
	 * Variables *
	 *-----------*/

	private final Reader reader;

	private XMLEventReader events;

	/**
	 * The {@code rdf:RDF} element, whose {@code xml:base} and {@code xml:lang} apply to every top-level node element.
	 */
	private StartElement rootElement;

	private boolean finished;

	private final Deque<Quad> pending = new ArrayDeque<>();

	/**
	 * Triples of the top-level node element being decoded; handed to {@link #pending} once it is complete.
	 */
	private final List<Quad> elementTriples = new ArrayList<>();

	/*--------------*
	 * Constructors *
	 *--------------*/

	public RDFXMLDecoder(Reader reader) {
		this(reader, new ParserConfig());
	}

	public RDFXMLDecoder(Reader reader, ParserConfig config) {
		super(reader, config);
		this.reader = reader;
	}

	/*---------*
	 * Methods *
	 *---------*/

	@Override
	public Format getFormat() {
		return Format.RDFXML;
	}

	@Override
	protected Quad parseQuad() throws IOException, RDFParseException {
		try {
			while (pending.isEmpty()) {
				if (!parseNextNodeElement()) {
					return null;
				}
			}
			return pending.poll();
		} catch (XMLStreamException e) {
			if (e.getNestedException() instanceof IOException) {
				throw (IOException) e.getNestedException();
			}
			Location location = e.getLocation();
			throw new LexicalException(e.getMessage(), e, location == null ? -1 : location.getLineNumber(),
					location == null ? -1 : location.getColumnNumber());
		}
	}

	@Override
	public void close() throws IOException {
		try {
			if (events != null) {
				events.close();
			}
		} catch (XMLStreamException e) {
			throw new IOException(e);
		} finally {
			super.close();
		}
	}

	/**
	 * Decodes the next top-level node element. Its triples are queued only if the whole element is well-formed.
	 *
	 * @return {@code false} once the document has been read completely
	 */
	private boolean parseNextNodeElement() throws IOException, XMLStreamException, RDFParseException {
		if (finished) {
			return false;
		}
		elementTriples.clear();
		if (events == null) {
			if (!openDocument()) {
				finished = true;
				return false;
			}
			StartElement root = nextTag().asStartElement();
			if (!isRdf(root.getName(), "RDF")) {
				// a single node element may stand in for rdf:RDF
				parseNodeElement(root, new Scope(getBase(), null), null);
				expectEndDocument();
				pending.addAll(elementTriples);
				return true;
			}
			enterScope(root, new Scope(getBase(), null));
			rootElement = root;
		}

		XMLEvent event = nextTag();
		if (event.isEndElement()) {
			expectEndDocument();
			return false;
		}
		// the base set by the caller may have changed since the previous node element
		parseNodeElement(event.asStartElement(), enterScope(rootElement, new Scope(getBase(), null)), null);
		pending.addAll(elementTriples);
		return true;
	}

	/**
	 * Creates the event reader, unless the input holds nothing but whitespace.
	 */
	private boolean openDocument() throws IOException, XMLStreamException {
		PushbackReader in = new PushbackReader(reader);
		int c = in.read();
		while (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
			c = in.read();
		}
		if (c == -1) {
			return false;
		}
		in.unread(c);

		XMLInputFactory factory = XMLInputFactory.newFactory();
		factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
		factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
		factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
		factory.setProperty(XMLInputFactory.IS_COALESCING, true);
		events = factory.createXMLEventReader(in);
		return true;
	}

	private void expectEndDocument() throws XMLStreamException, RDFParseException {
		XMLEvent event = nextTag();
		if (!event.isEndDocument()) {
			throw new SyntaxException("unexpected content after the document element", "end of document",
					line(event), column(event));
		}
		finished = true;
	}

	/**
	 * Returns the next start tag, end tag or end of document, skipping whitespace, comments and processing
	 * instructions.
	 */
	private XMLEvent nextTag() throws XMLStreamException, RDFParseException {
		while (true) {
			XMLEvent event = events.nextEvent();
			switch (event.getEventType()) {
			case XMLStreamConstants.START_ELEMENT:
			case XMLStreamConstants.END_ELEMENT:
			case XMLStreamConstants.END_DOCUMENT:
				return event;
			case XMLStreamConstants.ENTITY_REFERENCE:
				throw undeclaredEntity(event);
			case XMLStreamConstants.CHARACTERS:
			case XMLStreamConstants.CDATA:
			case XMLStreamConstants.SPACE:
				if (!isWhitespace(event.asCharacters().getData())) {
					throw new SyntaxException("unexpected text '" + event.asCharacters().getData().trim() + "'",
							"element", line(event), column(event));
				}
				break;
			default:
				break;
			}
		}
	}

	/**
	 * Parses a node element and its property elements.
	 *
	 * @param link the property element containing the node element, or {@code null} for a top-level or collection
	 *             member node element
	 * @return the subject described by the node element
	 */
	private Resource parseNodeElement(StartElement element, Scope parent, Link link)
			throws XMLStreamException, RDFParseException {
		Scope scope = enterScope(element, parent);
		QName name = element.getName();
		if (RDF_NS.equals(name.getNamespaceURI()) && FORBIDDEN_NODE_ELEMENTS.contains(name.getLocalPart())) {
			throw new SyntaxException("rdf:" + name.getLocalPart() + " is not allowed as a node element",
					"node element", line(element), column(element));
		}

		Attribute about = element.getAttributeByName(RDF_ABOUT);
		Attribute id = element.getAttributeByName(RDF_ID);
		Attribute nodeId = element.getAttributeByName(RDF_NODEID);
		if ((about != null ? 1 : 0) + (id != null ? 1 : 0) + (nodeId != null ? 1 : 0) > 1) {
			throw new SyntaxException("at most one of rdf:about, rdf:ID and rdf:nodeID is allowed on a node element",
					"node element", line(element), column(element));
		}

		Resource subject;
		if (about != null) {
			subject = resolve(about.getValue(), scope, element);
		} else if (id != null) {
			subject = resolve("#" + id.getValue(), scope, element);
		} else if (nodeId != null) {
			subject = createNode(nodeId.getValue());
		} else {
			subject = createNode();
		}

		if (link != null) {
			reportStatement(link.subject, link.predicate, subject, link.reification);
		}
		if (!isRdf(name, "Description")) {
			reportStatement(subject, Vocabulary.RDF_TYPE, elementIri(element), null);
		}
		reportPropertyAttributes(subject, propertyAttributes(element), scope, element);

		parsePropertyElements(subject, scope);
		return subject;
	}

	/**
	 * Parses the property elements of a node element up to and including its end tag.
	 */
	private void parsePropertyElements(Resource subject, Scope scope) throws XMLStreamException, RDFParseException {
		int liCounter = 0;
		while (true) {
			XMLEvent event = nextTag();
			if (event.isEndElement()) {
				return;
			}
			StartElement element = event.asStartElement();
			QName name = element.getName();
			Iri predicate;
			if (isRdf(name, "li")) {
				predicate = Vocabulary.rdfMember(++liCounter);
			} else if (RDF_NS.equals(name.getNamespaceURI())
					&& FORBIDDEN_PROPERTY_ELEMENTS.contains(name.getLocalPart())) {
				throw new SyntaxException("rdf:" + name.getLocalPart() + " is not allowed as a property element",
						"property element", line(element), column(element));
			} else {
				predicate = elementIri(element);
			}
			parsePropertyElement(element, subject, predicate, scope);
		}
	}

	private void parsePropertyElement(StartElement element, Resource subject, Iri predicate, Scope parent)
			throws XMLStreamException, RDFParseException {
		Scope scope = enterScope(element, parent);

		Iri reification = null;
		Attribute id = element.getAttributeByName(RDF_ID);
		if (id != null) {
			reification = resolve("#" + id.getValue(), scope, element);
		}

		Attribute parseType = element.getAttributeByName(RDF_PARSETYPE);
		if (parseType != null) {
			parseTypedPropertyElement(parseType.getValue(), element, subject, predicate, reification, scope);
			return;
		}

		Attribute resource = element.getAttributeByName(RDF_RESOURCE);
		Attribute nodeId = element.getAttributeByName(RDF_NODEID);
		Attribute datatype = element.getAttributeByName(RDF_DATATYPE);
		List<Attribute> properties = propertyAttributes(element);

		if (resource != null || nodeId != null) {
			if (resource != null && nodeId != null) {
				throw new SyntaxException("rdf:resource and rdf:nodeID are mutually exclusive", "property element",
						line(element), column(element));
			}
			Resource object = resource != null ? resolve(resource.getValue(), scope, element)
					: createNode(nodeId.getValue());
			XMLEvent end = nextTag();
			if (!end.isEndElement()) {
				throw new SyntaxException("a property element with rdf:resource or rdf:nodeID must be empty",
						"end tag", line(end), column(end));
			}
			reportStatement(subject, predicate, object, reification);
			reportPropertyAttributes(object, properties, scope, element);
			return;
		}

		StringBuilder text = new StringBuilder();
		while (true) {
			XMLEvent event = events.nextEvent();
			if (event.isCharacters()) {
				text.append(event.asCharacters().getData());
			} else if (event.isStartElement()) {
				if (!isWhitespace(text) || !properties.isEmpty() || datatype != null) {
					throw new SyntaxException("a property element containing a node element may not have text, "
							+ "property attributes or rdf:datatype", "property element", line(event), column(event));
				}
				parseNodeElement(event.asStartElement(), scope, new Link(subject, predicate, reification));
				XMLEvent end = nextTag();
				if (!end.isEndElement()) {
					throw new SyntaxException("a property element may contain only one node element", "end tag",
							line(end), column(end));
				}
				return;
			} else if (event.isEndElement()) {
				break;
			} else if (event.isEntityReference()) {
				throw undeclaredEntity(event);
			}
		}

		if (!properties.isEmpty()) {
			if (text.length() > 0 || datatype != null) {
				throw new SyntaxException("property attributes are not allowed on a literal property element",
						"property element", line(element), column(element));
			}
			BlankNode object = createNode();
			reportStatement(subject, predicate, object, reification);
			reportPropertyAttributes(object, properties, scope, element);
			return;
		}

		Literal object;
		if (datatype != null) {
			object = createLiteral(text.toString(), null, resolve(datatype.getValue(), scope, element),
					line(element), column(element));
		} else {
			object = createLiteral(text.toString(), scope.lang, null, line(element), column(element));
		}
		reportStatement(subject, predicate, object, reification);
	}

	private void parseTypedPropertyElement(String parseType, StartElement element, Resource subject, Iri predicate,
			Iri reification, Scope scope) throws XMLStreamException, RDFParseException {
		switch (parseType) {
		case "Resource":
			BlankNode node = createNode();
			reportStatement(subject, predicate, node, reification);
			parsePropertyElements(node, scope);
			break;
		case "Collection":
			List<Resource> members = new ArrayList<>();
			for (XMLEvent event = nextTag(); !event.isEndElement(); event = nextTag()) {
				members.add(parseNodeElement(event.asStartElement(), scope, null));
			}
			reportCollection(subject, predicate, members, reification);
			break;
		default:
			if (!"Literal".equals(parseType)) {
				reportWarning("unknown rdf:parseType '" + parseType + "', treated as Literal", line(element),
						column(element));
			}
			reportStatement(subject, predicate, Literal.typed(readXmlLiteral(), Vocabulary.RDF_XMLLITERAL),
					reification);
			break;
		}
	}

	private void reportCollection(Resource subject, Iri predicate, List<Resource> members, Iri reification) {
		if (members.isEmpty()) {
			reportStatement(subject, predicate, Vocabulary.RDF_NIL, reification);
			return;
		}
		Resource node = createNode();
		reportStatement(subject, predicate, node, reification);
		for (Iterator<Resource> it = members.iterator(); it.hasNext();) {
			reportStatement(node, Vocabulary.RDF_FIRST, it.next(), null);
			Resource rest = it.hasNext() ? createNode() : Vocabulary.RDF_NIL;
			reportStatement(node, Vocabulary.RDF_REST, rest, null);
			node = rest;
		}
	}

	/**
	 * Serializes the content of the current element up to its end tag.
	 */
	private String readXmlLiteral() throws XMLStreamException {
		StringWriter out = new StringWriter();
		XMLEventWriter writer = XMLOutputFactory.newFactory().createXMLEventWriter(out);
		int depth = 0;
		while (true) {
			XMLEvent event = events.nextEvent();
			if (event.isEndElement()) {
				if (depth == 0) {
					break;
				}
				depth--;
			} else if (event.isStartElement()) {
				depth++;
			}
			writer.add(event);
		}
		writer.close();
		return out.toString();
	}

	/**
	 * Returns the attributes of an element that describe properties of its subject or object.
	 */
	private List<Attribute> propertyAttributes(StartElement element) throws RDFParseException {
		List<Attribute> result = new ArrayList<>();
		for (Iterator<Attribute> it = element.getAttributes(); it.hasNext();) {
			Attribute attribute = it.next();
			QName name = attribute.getName();
			String ns = name.getNamespaceURI();
			if (XMLConstants.XML_NS_URI.equals(ns)) {
				continue;
			}
			if (ns.isEmpty()) {
				if (!name.getLocalPart().toLowerCase().startsWith("xml")) {
					reportWarning("unqualified attribute '" + name.getLocalPart() + "' ignored", line(element),
							column(element));
				}
				continue;
			}
			if (RDF_NS.equals(ns)) {
				if (SYNTAX_ATTRIBUTES.contains(name.getLocalPart())) {
					continue;
				}
				if (FORBIDDEN_ATTRIBUTES.contains(name.getLocalPart())) {
					throw new SyntaxException("rdf:" + name.getLocalPart() + " is not allowed as an attribute",
							"property attribute", line(element), column(element));
				}
			}
			result.add(attribute);
		}
		return result;
	}

	private void reportPropertyAttributes(Resource subject, List<Attribute> attributes, Scope scope,
			StartElement element) throws RDFParseException {
		for (Attribute attribute : attributes) {
			Iri predicate = Iri.of(attribute.getName().getNamespaceURI() + attribute.getName().getLocalPart());
			Term object;
			if (predicate.equals(Vocabulary.RDF_TYPE)) {
				object = resolve(attribute.getValue(), scope, element);
			} else {
				object = createLiteral(attribute.getValue(), scope.lang, null, line(element), column(element));
			}
			reportStatement(subject, predicate, object, null);
		}
	}

	private void reportStatement(Resource subject, Iri predicate, Term object, Iri reification) {
		Resource context = getDefaultGraph();
		elementTriples.add(Quad.of(subject, predicate, object, context));
		if (reification != null) {
			elementTriples.add(Quad.of(reification, Vocabulary.RDF_TYPE, Vocabulary.RDF_STATEMENT, context));
			elementTriples.add(Quad.of(reification, Vocabulary.RDF_SUBJECT, subject, context));
			elementTriples.add(Quad.of(reification, Vocabulary.RDF_PREDICATE, predicate, context));
			elementTriples.add(Quad.of(reification, Vocabulary.RDF_OBJECT, object, context));
		}
	}

	private Scope enterScope(StartElement element, Scope parent) throws RDFParseException {
		Iri base = parent.base;
		String lang = parent.lang;
		Attribute xmlBase = element.getAttributeByName(XML_BASE);
		if (xmlBase != null) {
			base = resolveIri(xmlBase.getValue(), parent.base, line(element), column(element));
		}
		Attribute xmlLang = element.getAttributeByName(XML_LANG);
		if (xmlLang != null) {
			lang = xmlLang.getValue().isEmpty() ? null : xmlLang.getValue();
		}
		return new Scope(base, lang);
	}

	private Iri resolve(String iriSpec, Scope scope, XMLEvent at) throws RDFParseException {
		return resolveIri(iriSpec, scope.base, line(at), column(at));
	}

	private Iri elementIri(StartElement element) throws RDFParseException {
		QName name = element.getName();
		if (name.getNamespaceURI().isEmpty()) {
			throw new SyntaxException("element '" + name.getLocalPart() + "' has no namespace", "qualified element",
					line(element), column(element));
		}
		return Iri.of(name.getNamespaceURI() + name.getLocalPart());
	}

	private static LexicalException undeclaredEntity(XMLEvent event) {
		return new LexicalException("entity '" + ((EntityReference) event).getName() + "' is not declared",
				line(event), column(event));
	}

	private static boolean isRdf(QName name, String localName) {
		return RDF_NS.equals(name.getNamespaceURI()) && localName.equals(name.getLocalPart());
	}

	private static QName rdf(String localName) {
		return new QName(RDF_NS, localName);
	}

	private static boolean isWhitespace(CharSequence text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
				return false;
			}
		}
		return true;
	}

	private static long line(XMLEvent event) {
		Location location = event.getLocation();
		return location == null ? -1 : location.getLineNumber();
	}

	private static long column(XMLEvent event) {
		Location location = event.getLocation();
		return location == null ? -1 : location.getColumnNumber();
	}

	/**
	 * Base IRI and language in effect for an element.
	 */
	private static final class Scope {

		final Iri base;

		final String lang;

		Scope(Iri base, String lang) {
			this.base = base;
			this.lang = lang;
		}
	}

	/**
	 * The statement a nested node element is the object of.
	 */
	private static final class Link {

		final Resource subject;

		final Iri predicate;

		final Iri reification;

		Link(Resource subject, Iri predicate, Iri reification) {
			this.subject = subject;
			this.predicate = predicate;
			this.reification = reification;
		}
	}
}
