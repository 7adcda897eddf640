package org.dxworks.urdf2mjcf.model;

import java.util.Objects;

/**
 * Handle on the target MJCF tree. Owns the root element and knows where the
 * canonical top-level sections live and where new ones are inserted.
 */
public class MjcfDocument {
    public static final String COMPILER = "compiler";
    public static final String OPTION = "option";
    public static final String ASSET = "asset";
    public static final String WORLDBODY = "worldbody";
    public static final String EXTENSION = "extension";
    public static final String ACTUATOR = "actuator";

    private final Element root;

    public MjcfDocument(Element root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Element getRoot() {
        return root;
    }

    /** Top-level section with the given tag, or null. */
    public Element section(String tag) {
        return root.find(tag);
    }

    public Element compiler() {
        return root.find(COMPILER);
    }

    public Element worldbody() {
        return root.find(WORLDBODY);
    }

    public Element extension() {
        return root.find(EXTENSION);
    }

    public Element actuator() {
        return root.find(ACTUATOR);
    }

    /** Returns the section, creating it before {@code worldbody} (or at the end) when missing. */
    public Element ensureBeforeWorldbody(String tag) {
        Element node = root.find(tag);
        if (node != null) {
            return node;
        }
        return insertBeforeWorldbody(new Element(tag));
    }

    /** Inserts a new top-level element at the canonical position: before {@code worldbody}, else appended. */
    public Element insertBeforeWorldbody(Element node) {
        Element worldbody = worldbody();
        if (worldbody != null) {
            return root.insert(root.indexOf(worldbody), node);
        }
        return root.append(node);
    }

    /** Returns the section, creating it right after {@code afterTag} or first when that is absent. */
    public Element ensureChildAfter(String tag, String afterTag) {
        Element node = root.find(tag);
        if (node != null) {
            return node;
        }
        node = new Element(tag);
        Element after = root.find(afterTag);
        if (after != null) {
            return root.insert(root.indexOf(after) + 1, node);
        }
        return root.insert(0, node);
    }

    /** {@code extension} goes after {@code compiler}, else before {@code worldbody}, else last. */
    public Element ensureExtension() {
        Element extension = extension();
        if (extension != null) {
            return extension;
        }
        Element compiler = compiler();
        if (compiler != null) {
            return root.insert(root.indexOf(compiler) + 1, new Element(EXTENSION));
        }
        return insertBeforeWorldbody(new Element(EXTENSION));
    }

    /** {@code actuator} goes right after {@code worldbody}, else last. */
    public Element ensureActuator() {
        Element actuator = actuator();
        if (actuator != null) {
            return actuator;
        }
        Element worldbody = worldbody();
        if (worldbody != null) {
            return root.insert(root.indexOf(worldbody) + 1, new Element(ACTUATOR));
        }
        return root.append(new Element(ACTUATOR));
    }

    /** {@code compiler} is always the first child of the root. */
    public Element ensureCompiler() {
        Element compiler = compiler();
        if (compiler != null) {
            return compiler;
        }
        return root.insert(0, new Element(COMPILER));
    }
}
