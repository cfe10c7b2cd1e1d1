package org.example.cryoingest.metadata;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over an acquisition-software XML file.
 * <p>
 * Element names are matched on their local part, so {@code "width"} matches both
 * {@code <a:width>} and {@code <b:width>}: EPU and Tomo reuse the same structures
 * under different namespace prefixes depending on the software release.
 */
public final class XmlDocument {

    private final Element root;

    private XmlDocument(Element root) {
        this.root = root;
    }

    public static XmlDocument parse(Path file) throws MetadataParseException {
        try (InputStream in = Files.newInputStream(file)) {
            return new XmlDocument(builder().parse(in).getDocumentElement());
        } catch (IOException | SAXException e) {
            throw new MetadataParseException("Failed to parse " + file, e);
        }
    }

    public static XmlDocument parse(String xml) throws MetadataParseException {
        try {
            Document doc = builder().parse(new InputSource(new StringReader(xml)));
            return new XmlDocument(doc.getDocumentElement());
        } catch (IOException | SAXException e) {
            throw new MetadataParseException("Failed to parse XML content", e);
        }
    }

    private static DocumentBuilder builder() throws MetadataParseException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new MetadataParseException("XML parser unavailable", e);
        }
    }

    public Element root() {
        return root;
    }

    public String rootName() {
        return localName(root);
    }

    /**
     * Resolves a path of element names starting at the root element itself.
     */
    public Optional<Element> find(String... path) {
        if (path.length == 0 || !localName(root).equals(path[0])) {
            return Optional.empty();
        }
        return descend(root, path, 1);
    }

    public Optional<String> text(String... path) {
        return find(path).map(XmlDocument::textOf);
    }

    public static Optional<Element> child(Element parent, String... path) {
        return descend(parent, path, 0);
    }

    public static Optional<String> childText(Element parent, String... path) {
        return descend(parent, path, 0).map(XmlDocument::textOf);
    }

    private static Optional<Element> descend(Element start, String[] path, int from) {
        Element current = start;
        for (int i = from; i < path.length; i++) {
            Element next = null;
            for (Element c : elements(current)) {
                if (localName(c).equals(path[i])) {
                    next = c;
                    break;
                }
            }
            if (next == null) return Optional.empty();
            current = next;
        }
        return Optional.of(current);
    }

    public static List<Element> children(Element parent, String name) {
        List<Element> out = new ArrayList<>();
        for (Element c : elements(parent)) {
            if (localName(c).equals(name)) out.add(c);
        }
        return out;
    }

    public static List<Element> childrenStartingWith(Element parent, String prefix) {
        List<Element> out = new ArrayList<>();
        for (Element c : elements(parent)) {
            if (localName(c).startsWith(prefix)) out.add(c);
        }
        return out;
    }

    public static List<Element> elements(Element parent) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) out.add((Element) n);
        }
        return out;
    }

    /**
     * Finds the first descendant (depth first) with the given local name.
     */
    public static Optional<Element> firstDescendant(Element parent, String name) {
        for (Element c : elements(parent)) {
            if (localName(c).equals(name)) return Optional.of(c);
            Optional<Element> deeper = firstDescendant(c, name);
            if (deeper.isPresent()) return deeper;
        }
        return Optional.empty();
    }

    public static String textOf(Element e) {
        return e.getTextContent() == null ? "" : e.getTextContent().trim();
    }

    static String localName(Node n) {
        String name = n.getNodeName();
        int idx = name.indexOf(':');
        return idx >= 0 ? name.substring(idx + 1) : name;
    }
}
