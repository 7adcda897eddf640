package org.dxworks.urdf2mjcf.xml;

import org.dxworks.urdf2mjcf.ConversionException;
import org.dxworks.urdf2mjcf.model.Element;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parses markup into {@link Element} trees. Attribute order is kept as written,
 * comments and whitespace-only text are dropped, DOCTYPEs are rejected.
 */
public final class XmlReader {

    private XmlReader() {
        // utility class
    }

    public static Element read(Path file) throws ConversionException {
        if (!Files.isRegularFile(file)) {
            throw new ConversionException("File not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return parse(new InputSource(in), file.toString());
        } catch (IOException e) {
            throw new ConversionException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }

    public static Element parse(String xml) throws ConversionException {
        return parse(new InputSource(new StringReader(xml)), "<string>");
    }

    private static Element parse(InputSource source, String name) throws ConversionException {
        TreeBuilder builder = new TreeBuilder();
        try {
            newParser().parse(source, builder);
        } catch (SAXException e) {
            throw new ConversionException("Malformed XML in " + name + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConversionException("Could not read " + name + ": " + e.getMessage(), e);
        }
        if (builder.root == null) {
            throw new ConversionException("No root element in " + name);
        }
        return builder.root;
    }

    private static SAXParser newParser() throws ConversionException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            return factory.newSAXParser();
        } catch (ParserConfigurationException | SAXException e) {
            throw new ConversionException("Could not configure XML parser", e);
        }
    }

    private static final class TreeBuilder extends DefaultHandler {
        private final Deque<Element> open = new ArrayDeque<>();
        private final Deque<StringBuilder> texts = new ArrayDeque<>();
        private Element root;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            Element element = new Element(qName);
            for (int i = 0; i < attributes.getLength(); i++) {
                element.set(attributes.getQName(i), attributes.getValue(i));
            }
            Element parent = open.peek();
            if (parent == null) {
                root = element;
            } else {
                parent.append(element);
            }
            open.push(element);
            texts.push(new StringBuilder());
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            StringBuilder text = texts.peek();
            Element current = open.peek();
            // only the leading text of an element is kept
            if (text != null && current != null && !current.hasChildren()) {
                text.append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            Element element = open.pop();
            String text = texts.pop().toString();
            if (!text.isBlank()) {
                element.setText(text);
            }
        }
    }
}
