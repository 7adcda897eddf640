package org.dxworks.urdf2mjcf.xml;

import org.dxworks.urdf2mjcf.ConversionException;
import org.dxworks.urdf2mjcf.model.Element;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes {@link Element} trees with one element per line, tab indentation
 * and {@code <tag a="b" />} for elements without content.
 */
public final class XmlWriter {
    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"utf-8\"?>";

    private XmlWriter() {
        // utility class
    }

    public static void write(Element root, Path file) throws ConversionException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toString(root, true), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionException("Failed to save the MJCF file to '" + file + "': " + e.getMessage(), e);
        }
    }

    public static String toString(Element root) {
        return toString(root, false);
    }

    public static String toString(Element root, boolean declaration) {
        StringBuilder sb = new StringBuilder();
        if (declaration) {
            sb.append(DECLARATION).append('\n');
        }
        writeElement(root, 0, sb);
        sb.append('\n');
        return sb.toString();
    }

    private static void writeElement(Element element, int depth, StringBuilder sb) {
        indent(depth, sb);
        sb.append('<').append(element.getTag());
        for (Map.Entry<String, String> attribute : element.getAttributes().entrySet()) {
            sb.append(' ').append(attribute.getKey()).append("=\"").append(escapeAttribute(attribute.getValue())).append('"');
        }
        String text = element.getTrimmedText();
        if (text.isEmpty() && !element.hasChildren()) {
            sb.append(" />");
            return;
        }
        sb.append('>');
        if (!text.isEmpty()) {
            sb.append(escapeText(text));
        }
        if (element.hasChildren()) {
            for (Element child : element.getChildren()) {
                sb.append('\n');
                writeElement(child, depth + 1, sb);
            }
            sb.append('\n');
            indent(depth, sb);
        }
        sb.append("</").append(element.getTag()).append('>');
    }

    private static void indent(int depth, StringBuilder sb) {
        sb.append("\t".repeat(depth));
    }

    static String escapeText(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String escapeAttribute(String value) {
        return escapeText(value)
                .replace("\"", "&quot;")
                .replace("\r", "&#13;")
                .replace("\n", "&#10;")
                .replace("\t", "&#09;");
    }
}
