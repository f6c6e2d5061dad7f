package com.monitintel.collectors.monit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.monitintel.core.util.JsonUtils;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the Monit XML status document ({@code /_status?format=xml}). Only direct
 * {@code <service>} children of {@code <monit>} are services; {@code <servicegroup>} entries
 * reuse the tag name for plain member names.
 */
public final class MonitStatusParser {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private MonitStatusParser() {
    }

    public static MonitStatusDocument parse(String xml) {
        return parse(new InputSource(new StringReader(xml)));
    }

    /**
     * Parses the raw response body so the XML declaration's {@code encoding} decides the charset.
     * Monit declares {@code ISO-8859-1}.
     */
    public static MonitStatusDocument parse(byte[] body) {
        return parse(new InputSource(new ByteArrayInputStream(body)));
    }

    private static MonitStatusDocument parse(InputSource source) {
        Document document;
        try {
            document = newBuilder().parse(source);
        } catch (Exception e) {
            return MonitStatusDocument.invalid("Unparsable Monit status document: " + e.getMessage());
        }
        Element root = document.getDocumentElement();
        if (root == null || !"monit".equals(root.getTagName())) {
            return MonitStatusDocument.invalid("Unexpected root element: " + (root == null ? "none" : root.getTagName()));
        }

        List<MonitServiceEntry> services = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (!(child instanceof Element element) || !"service".equals(element.getTagName())) {
                continue;
            }
            String name = directChildText(element, "name");
            if (name == null || name.isBlank()) {
                rejected.add("service #" + (services.size() + rejected.size() + 1) + ": missing <name>");
                continue;
            }
            String rawStatus = directChildText(element, "status");
            int status;
            try {
                status = Integer.parseInt(rawStatus == null ? "0" : rawStatus.trim());
            } catch (NumberFormatException e) {
                rejected.add(name + ": non-numeric <status> '" + rawStatus + "'");
                continue;
            }
            services.add(new MonitServiceEntry(name.trim(), status, JsonUtils.toJson(toJson(element))));
        }
        return new MonitStatusDocument(true, services, rejected, null);
    }

    static JsonNode toJson(Element element) {
        ObjectNode node = NODES.objectNode();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            node.put("@" + attribute.getName(), attribute.getValue());
        }

        boolean hasElementChildren = false;
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (!(children.item(i) instanceof Element child)) {
                continue;
            }
            hasElementChildren = true;
            JsonNode value = toJson(child);
            JsonNode existing = node.get(child.getTagName());
            if (existing == null) {
                node.set(child.getTagName(), value);
            } else if (existing instanceof ArrayNode array) {
                array.add(value);
            } else {
                ArrayNode array = NODES.arrayNode();
                array.add(existing);
                array.add(value);
                node.set(child.getTagName(), array);
            }
        }

        if (!hasElementChildren) {
            String text = element.getTextContent() == null ? "" : element.getTextContent().trim();
            if (node.isEmpty()) {
                return TextNode.valueOf(text);
            }
            if (!text.isEmpty()) {
                node.put("#text", text);
            }
        }
        return node;
    }

    private static String directChildText(Element parent, String tagName) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element child && tagName.equals(child.getTagName())) {
                return child.getTextContent();
            }
        }
        return null;
    }

    private static DocumentBuilder newBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
            }

            @Override
            public void error(SAXParseException exception) throws SAXParseException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXParseException {
                throw exception;
            }
        });
        return builder;
    }
}
