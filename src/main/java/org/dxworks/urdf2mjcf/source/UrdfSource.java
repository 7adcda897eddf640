package org.dxworks.urdf2mjcf.source;

import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.JointInterfaceMap;
import org.dxworks.urdf2mjcf.model.MimicRelation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything the converter takes from the source robot description.
 */
public class UrdfSource {
    /** Annotation fragments: children of the merged {@code <mujoco>} block except compiler and plugins. */
    public final List<Element> fragments;
    public final List<Element> plugins;
    public final Map<String, String> compilerAttributes;
    /** Follower joint name to its relation, in document order. */
    public final Map<String, MimicRelation> mimics;
    public final JointInterfaceMap interfaces;

    public UrdfSource(List<Element> fragments, List<Element> plugins, Map<String, String> compilerAttributes,
                      Map<String, MimicRelation> mimics, JointInterfaceMap interfaces) {
        this.fragments = Collections.unmodifiableList(fragments);
        this.plugins = Collections.unmodifiableList(plugins);
        this.compilerAttributes = Collections.unmodifiableMap(compilerAttributes);
        this.mimics = Collections.unmodifiableMap(mimics);
        this.interfaces = interfaces;
    }
}
