package org.dxworks.urdf2mjcf.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Command interfaces requested per joint (e.g. {@code position}, {@code velocity}),
 * as declared in the source document's {@code ros2_control} blocks.
 */
public class JointInterfaceMap {
    private final Map<String, Set<String>> interfaces = new LinkedHashMap<>();

    public static JointInterfaceMap empty() {
        return new JointInterfaceMap();
    }

    public JointInterfaceMap add(String joint, String... kinds) {
        Set<String> set = interfaces.computeIfAbsent(joint, k -> new LinkedHashSet<>());
        Collections.addAll(set, kinds);
        return this;
    }

    public boolean contains(String joint) {
        return interfaces.containsKey(joint);
    }

    public Set<String> interfacesOf(String joint) {
        Set<String> set = interfaces.get(joint);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    public Set<String> joints() {
        return Collections.unmodifiableSet(interfaces.keySet());
    }

    public boolean isEmpty() {
        return interfaces.isEmpty();
    }
}
