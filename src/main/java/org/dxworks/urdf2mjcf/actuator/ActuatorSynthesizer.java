package org.dxworks.urdf2mjcf.actuator;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.AttributeValues;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.JointInterfaceMap;
import org.dxworks.urdf2mjcf.model.MimicRelation;
import org.dxworks.urdf2mjcf.model.MjcfDocument;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Creates actuator elements for the joints that declare command interfaces, and
 * the follower plugins that keep mimic joints coupled to their leaders.
 */
public class ActuatorSynthesizer {
    public static final String POSITION = "position";
    public static final String VELOCITY = "velocity";
    public static final String ACTUATOR_COMMAND_PLUGIN = "MujocoRosUtils::ActuatorCommand";
    public static final String MIMIC_JOINT_PLUGIN = "MujocoRosUtils::MimicJoint";

    private static final List<String> SUPPORTED_KINDS = List.of(POSITION, VELOCITY);

    private final MjcfDocument document;
    private final ConversionLog log;

    public ActuatorSynthesizer(MjcfDocument document, ConversionLog log) {
        this.document = document;
        this.log = log;
    }

    /**
     * Adds one actuator per requested kind for every listed joint found under
     * {@code worldbody}. Names carry a {@code _position}/{@code _velocity} suffix when
     * a joint gets both kinds or {@code forceSuffix} is set.
     */
    public void addActuators(JointInterfaceMap interfaces, Map<String, MimicRelation> mimics, ActuatorGains gains,
                             boolean forceSuffix, boolean addRosPlugins, String rosInstance) {
        Element worldbody = document.worldbody();
        if (worldbody == null) {
            log.warn(Kind.PRECONDITION, "No <worldbody> found in the model. Cannot add actuators.").withTag("actuator");
            return;
        }
        if (interfaces == null || interfaces.isEmpty()) {
            log.info("-> No ros2_control joints found; skipping actuator generation.");
            return;
        }

        List<Element> joints = new ArrayList<>();
        for (Element joint : worldbody.findDescendants("joint")) {
            if (!"free".equals(joint.get("type")) && interfaces.contains(joint.get("name"))) {
                joints.add(joint);
            }
        }
        if (joints.isEmpty()) {
            log.info("-> No actuatable joints found to create actuators for.");
            return;
        }

        Element actuator = document.ensureActuator();
        if (addRosPlugins) {
            declareExtensionPlugin(ACTUATOR_COMMAND_PLUGIN, rosInstance);
        }

        List<String> actuated = new ArrayList<>();
        List<String> withRosPlugin = new ArrayList<>();
        for (Element joint : joints) {
            String jointName = joint.get("name");
            List<String> kinds = new ArrayList<>();
            for (String kind : SUPPORTED_KINDS) {
                if (interfaces.interfacesOf(jointName).contains(kind)) {
                    kinds.add(kind);
                }
            }
            if (kinds.isEmpty()) {
                log.debug(Kind.OPERATION_SKIPPED, "Joint '" + jointName + "' has no position or velocity interface.");
                continue;
            }

            boolean suffix = kinds.size() > 1 || forceSuffix;
            for (String kind : kinds) {
                String name = suffix ? jointName + "_" + kind : jointName;
                actuator.append(newActuator(kind, name, joint, gains));
                log.info(Kind.ELEMENT_CREATED, "-> Added '" + kind + "' actuator for joint: " + jointName).withTag(kind);
            }
            actuated.add(jointName);

            boolean mimic = mimics != null && mimics.containsKey(jointName);
            if (addRosPlugins && !mimic) {
                Element plugin = new Element("plugin");
                plugin.set("plugin", ACTUATOR_COMMAND_PLUGIN);
                plugin.set("joint", jointName);
                plugin.set("instance", rosInstance);
                actuator.append(plugin);
                withRosPlugin.add(jointName);
            }
        }

        if (!actuated.isEmpty()) {
            log.info("-> Added actuators for joints: " + String.join(", ", actuated));
        }
        if (!withRosPlugin.isEmpty()) {
            log.info("-> Added ROS plugin actuators for joints: " + String.join(", ", withRosPlugin));
        }
    }

    /**
     * Guarantees a position actuator for every follower joint and attaches a
     * {@value #MIMIC_JOINT_PLUGIN} entry pointing at its leader.
     */
    public void addMimicPlugins(Map<String, MimicRelation> mimics, ActuatorGains gains) {
        if (mimics == null || mimics.isEmpty()) {
            return;
        }
        declareExtensionPlugin(MIMIC_JOINT_PLUGIN, null);
        Element actuator = document.ensureActuator();

        Set<String> usedNames = new HashSet<>();
        for (Element existing : actuator.getChildren()) {
            usedNames.add(existing.get("name", ""));
        }

        List<String> created = new ArrayList<>();
        List<String> coupled = new ArrayList<>();
        for (Map.Entry<String, MimicRelation> entry : mimics.entrySet()) {
            String follower = entry.getKey();
            MimicRelation relation = entry.getValue();

            if (!hasPositionActuator(actuator, follower)) {
                String name = usedNames.contains(follower) ? follower + "_" + POSITION : follower;
                Element joint = findJoint(follower);
                Element position = joint != null
                        ? newActuator(POSITION, name, joint, gains)
                        : new Element(POSITION, baseAttributes(POSITION, name, follower, gains));
                actuator.append(position);
                usedNames.add(name);
                created.add(follower);
                log.info(Kind.ELEMENT_CREATED, "-> Added 'position' actuator for mimic joint: '" + follower + "'.")
                        .withTag(POSITION);
            }

            Element plugin = new Element("plugin");
            plugin.set("plugin", MIMIC_JOINT_PLUGIN);
            plugin.set("joint", follower);
            plugin.append(config("mimic_joint", relation.joint));
            plugin.append(config("gear", relation.multiplier));
            if (relation.hasOffset()) {
                plugin.append(config("offset", relation.offset));
            }
            actuator.append(plugin);
            coupled.add(follower);
        }

        if (!created.isEmpty()) {
            log.info("-> Created missing position actuators for mimic joints: " + String.join(", ", created));
        }
        log.info("-> Added ROS mimic joint plugins for joints: " + String.join(", ", coupled));
    }

    private Element newActuator(String kind, String name, Element joint, ActuatorGains gains) {
        Map<String, String> attributes = baseAttributes(kind, name, joint.get("name"), gains);
        if (joint.has("range")) {
            attributes.put("ctrlrange", joint.get("range"));
        }
        if (joint.has("actuatorfrcrange")) {
            attributes.put("forcelimited", "true");
            attributes.put("forcerange", joint.get("actuatorfrcrange"));
        }
        return new Element(kind, attributes);
    }

    private static Map<String, String> baseAttributes(String kind, String name, String jointName, ActuatorGains gains) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("joint", jointName);
        if (POSITION.equals(kind)) {
            attributes.put("kp", AttributeValues.format(gains.getKp()));
            if (gains.hasDampRatio()) {
                attributes.put("dampratio", AttributeValues.format(gains.getDampRatio()));
            }
        } else {
            attributes.put("kv", AttributeValues.format(gains.getKv()));
        }
        return attributes;
    }

    private static boolean hasPositionActuator(Element actuator, String jointName) {
        for (Element child : actuator.getChildren()) {
            if (child.getTag().equals(POSITION) && jointName.equals(child.get("joint"))) {
                return true;
            }
        }
        return false;
    }

    private Element findJoint(String name) {
        for (Element joint : document.getRoot().findDescendants("joint")) {
            if (name.equals(joint.get("name"))) {
                return joint;
            }
        }
        return null;
    }

    /** Declares {@code <extension><plugin plugin=...>} once, with an optional instance. */
    private void declareExtensionPlugin(String pluginName, String instanceName) {
        Element extension = document.ensureExtension();
        for (Element existing : extension.findAll("plugin")) {
            if (pluginName.equals(existing.get("plugin"))) {
                return;
            }
        }
        Element plugin = extension.appendChild("plugin", Map.of("plugin", pluginName));
        if (instanceName != null) {
            plugin.appendChild("instance", Map.of("name", instanceName));
        }
        log.info(Kind.ELEMENT_CREATED, "-> Added '" + pluginName + "' extension plugin.").withTag("plugin");
    }

    private static Element config(String key, String value) {
        Element config = new Element("config");
        config.set("key", key);
        config.set("value", value);
        return config;
    }
}
