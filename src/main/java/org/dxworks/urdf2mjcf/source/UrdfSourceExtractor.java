package org.dxworks.urdf2mjcf.source;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.JointInterfaceMap;
import org.dxworks.urdf2mjcf.model.MimicRelation;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;
import org.dxworks.urdf2mjcf.transform.FragmentMerger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads a parsed robot description and pulls out the pieces the converter needs:
 * the {@code <mujoco>} annotation blocks, compiler settings, mimic couplings and
 * the command interfaces declared under {@code ros2_control}.
 */
public class UrdfSourceExtractor {
    static final String MUJOCO = "mujoco";
    static final String PLUGIN = "plugin";

    private final ConversionLog log;

    public UrdfSourceExtractor(ConversionLog log) {
        this.log = log;
    }

    public UrdfSource extract(Element urdf, String meshDir, List<String> compilerOptions) {
        List<Element> fragments = new ArrayList<>();
        List<Element> plugins = new ArrayList<>();
        Element compiler = null;

        List<Element> mujocoBlocks = urdf.findAll(MUJOCO);
        if (mujocoBlocks.isEmpty()) {
            log.info("No <mujoco> tag found in URDF.");
        } else {
            log.info("-> Found " + mujocoBlocks.size() + " <mujoco> tags in URDF. Merging them.");
            Element merged = FragmentMerger.merge(mujocoBlocks);
            for (Element child : merged.getChildren()) {
                if (child.getTag().equals("compiler")) {
                    if (compiler == null) {
                        compiler = child;
                    }
                } else if (child.getTag().equals(PLUGIN)) {
                    plugins.add(child);
                } else {
                    fragments.add(child);
                }
            }
        }
        if (!fragments.isEmpty()) {
            log.info("-> Found " + fragments.size() + " custom MuJoCo elements to inject: "
                    + fragments.stream().map(Element::getTag).collect(Collectors.joining(", ")));
        }

        Map<String, String> compilerAttributes = compilerAttributes(compiler, meshDir, compilerOptions);
        Map<String, MimicRelation> mimics = mimicRelations(urdf);
        JointInterfaceMap interfaces = commandInterfaces(urdf);
        return new UrdfSource(fragments, plugins, compilerAttributes, mimics, interfaces);
    }

    Map<String, String> compilerAttributes(Element compiler, String meshDir, List<String> compilerOptions) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("meshdir", meshDir);
        attributes.put("balanceinertia", "false");
        attributes.put("discardvisual", "false");
        attributes.put("fusestatic", "false");
        attributes.put("inertiafromgeom", "false");
        if (compiler != null) {
            attributes.putAll(compiler.getAttributes());
        }
        if (compilerOptions != null) {
            for (String option : compilerOptions) {
                int eq = option.indexOf('=');
                if (eq < 0) {
                    log.warn(Kind.UNPARSEABLE, "Malformed compiler option '" + option
                            + "'. Should be in KEY=VALUE format. Skipping.");
                    continue;
                }
                attributes.put(option.substring(0, eq), option.substring(eq + 1));
            }
        }
        log.info("-> Set <compiler> tag attributes to: " + attributes);
        return attributes;
    }

    Map<String, MimicRelation> mimicRelations(Element urdf) {
        Map<String, MimicRelation> mimics = new LinkedHashMap<>();
        for (Element top : urdf.getChildren()) {
            if (top.getTag().equals(MUJOCO)) {
                continue;
            }
            List<Element> joints = new ArrayList<>();
            if (top.getTag().equals("joint")) {
                joints.add(top);
            }
            joints.addAll(top.findDescendants("joint"));
            for (Element joint : joints) {
                Element mimic = joint.find("mimic");
                if (mimic == null) continue;
                String follower = joint.get("name");
                String leader = mimic.get("joint");
                if (follower == null || follower.isEmpty() || leader == null || leader.isEmpty()) {
                    continue;
                }
                mimics.put(follower, new MimicRelation(leader, mimic.get("multiplier"), mimic.get("offset")));
            }
        }
        if (!mimics.isEmpty()) {
            log.info("-> Found mimic joints: " + String.join(", ", mimics.keySet()));
        }
        return mimics;
    }

    JointInterfaceMap commandInterfaces(Element urdf) {
        JointInterfaceMap map = JointInterfaceMap.empty();
        List<Element> blocks = new ArrayList<>(urdf.findAll("ros2_control"));
        for (Element top : urdf.getChildren()) {
            if (!top.getTag().equals(MUJOCO) && !top.getTag().equals("ros2_control")) {
                blocks.addAll(top.findDescendants("ros2_control"));
            }
        }
        for (Element block : blocks) {
            for (Element joint : block.findAll("joint")) {
                String name = joint.get("name");
                if (name == null || name.isEmpty()) continue;
                Set<String> kinds = new LinkedHashSet<>();
                for (Element commandInterface : joint.findAll("command_interface")) {
                    String kind = commandInterface.get("name", commandInterface.getTrimmedText());
                    if (!kind.isEmpty()) {
                        kinds.add(kind);
                    }
                }
                if (!kinds.isEmpty()) {
                    map.add(name, kinds.toArray(new String[0]));
                    log.info("-> Joint '" + name + "' has command interfaces: " + String.join(", ", kinds));
                }
            }
        }
        return map;
    }
}
