package org.dxworks.urdf2mjcf.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A markup node: tag, ordered attributes, optional text and ordered children.
 * A tree owns its descendants exclusively; {@link #deepCopy()} is the only way
 * to share structure between trees.
 */
public class Element {
    private final String tag;
    private final LinkedHashMap<String, String> attributes = new LinkedHashMap<>();
    private final List<Element> children = new ArrayList<>();
    private String text;

    public Element(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public Element(String tag, Map<String, String> attributes) {
        this(tag);
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    public String getTag() {
        return tag;
    }

    /** Read-only view in insertion order. */
    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String get(String name) {
        return attributes.get(name);
    }

    public String get(String name, String defaultValue) {
        String value = attributes.get(name);
        return value != null ? value : defaultValue;
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    /** Sets an attribute and returns the previous value, or null. */
    public String set(String name, String value) {
        return attributes.put(name, value);
    }

    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getTrimmedText() {
        return text == null ? "" : text.trim();
    }

    public List<Element> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Element append(Element child) {
        children.add(child);
        return child;
    }

    /** Creates a child with the given tag and attributes and appends it. */
    public Element appendChild(String childTag, Map<String, String> childAttributes) {
        return append(new Element(childTag, childAttributes));
    }

    public Element insert(int index, Element child) {
        children.add(index, child);
        return child;
    }

    public boolean remove(Element child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                children.remove(i);
                return true;
            }
        }
        return false;
    }

    /** Identity-based index of a direct child, or -1. */
    public int indexOf(Element child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /** First direct child with the given tag, or null. */
    public Element find(String childTag) {
        for (Element child : children) {
            if (child.tag.equals(childTag)) {
                return child;
            }
        }
        return null;
    }

    /** All direct children with the given tag. */
    public List<Element> findAll(String childTag) {
        List<Element> result = new ArrayList<>();
        for (Element child : children) {
            if (child.tag.equals(childTag)) {
                result.add(child);
            }
        }
        return result;
    }

    /** All descendants (this element excluded) with the given tag, in document order. */
    public List<Element> findDescendants(String descendantTag) {
        List<Element> result = new ArrayList<>();
        forEachDescendant(e -> {
            if (e.tag.equals(descendantTag)) {
                result.add(e);
            }
        });
        return result;
    }

    /** Visits every descendant in document order, this element excluded. */
    public void forEachDescendant(Consumer<Element> visitor) {
        for (Element child : children) {
            visitor.accept(child);
            child.forEachDescendant(visitor);
        }
    }

    public Element deepCopy() {
        Element copy = new Element(tag, attributes);
        copy.text = text;
        for (Element child : children) {
            copy.children.add(child.deepCopy());
        }
        return copy;
    }

    /**
     * Shallow equivalence used by fragment merging: same tag, same attribute set
     * (order ignored) and same trimmed text. Children are not compared.
     */
    public boolean isEquivalentTo(Element other) {
        return other != null
                && tag.equals(other.tag)
                && attributes.equals(other.attributes)
                && getTrimmedText().equals(other.getTrimmedText());
    }

    /** Compact single-line description used in log messages, e.g. {@code <geom class='visual'>}. */
    public String describe() {
        return describe(tag, attributes);
    }

    public static String describe(String tag, Map<String, String> attributes) {
        StringBuilder sb = new StringBuilder("<").append(tag);
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("='").append(entry.getValue()).append('\'');
        }
        return sb.append('>').toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
