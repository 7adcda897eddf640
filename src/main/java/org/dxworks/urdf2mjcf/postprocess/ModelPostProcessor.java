package org.dxworks.urdf2mjcf.postprocess;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.AttributeValues;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.MjcfDocument;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed clean-up and enrichment steps applied to the compiled model, each one
 * independent of the annotation fragments.
 */
public class ModelPostProcessor {
    public static final String ROS_UTILS_PREFIX = "MujocoRosUtils::";
    public static final String CLOCK_PUBLISHER_PLUGIN = "MujocoRosUtils::ClockPublisher";
    public static final String ROS2_CONTROL_PLUGIN = "MujocoRosUtils::Ros2Control";

    private final MjcfDocument document;
    private final ConversionLog log;

    public ModelPostProcessor(MjcfDocument document, ConversionLog log) {
        this.document = document;
        this.log = log;
    }

    public void applyCompilerOptions(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            log.warn(Kind.PRECONDITION, "No <compiler> options found to apply.").withTag("compiler");
            return;
        }
        Element compiler = document.ensureCompiler();
        attributes.forEach(compiler::set);
        log.info(Kind.OPERATION_APPLIED, "-> Applied post-processing to <compiler> tag with attributes: " + attributes)
                .withTag("compiler");
    }

    public void multiplyJointDamping(double factor) {
        int count = 0;
        for (Element joint : document.getRoot().findDescendants("joint")) {
            String damping = joint.get("damping");
            if (damping == null) continue;
            try {
                joint.set("damping", AttributeValues.format(Double.parseDouble(damping.trim()) * factor));
                count++;
            } catch (NumberFormatException e) {
                log.warn(Kind.UNPARSEABLE, "Joint '" + joint.get("name") + "' has non-numeric damping '" + damping
                        + "'. Leaving it unchanged.").withTag("joint");
            }
        }
        log.info(Kind.OPERATION_APPLIED, "-> Multiplied joint damping by a factor of " + factor + " for " + count + " joints.");
    }

    public void addLight() {
        Element worldbody = requireWorldbody("add a default light");
        if (worldbody == null) return;
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("diffuse", ".8 .8 .8");
        attributes.put("pos", "0 0 5");
        attributes.put("dir", "0 0 -1");
        worldbody.appendChild("light", attributes);
        log.info(Kind.ELEMENT_CREATED, "-> Added a default light to the model.").withTag("light");
    }

    public void addFloor() {
        for (Element geom : document.getRoot().findDescendants("geom")) {
            if ("floor".equals(geom.get("name"))) {
                log.info("-> Floor plane already exists in the model; skipping addition.");
                return;
            }
        }
        Element asset = document.ensureBeforeWorldbody(MjcfDocument.ASSET);

        Map<String, String> texture = new LinkedHashMap<>();
        texture.put("name", "floor");
        texture.put("type", "2d");
        texture.put("builtin", "checker");
        texture.put("rgb1", "0.1 0.2 0.3");
        texture.put("rgb2", "0.2 0.3 0.4");
        texture.put("width", "300");
        texture.put("height", "300");
        texture.put("mark", "edge");
        texture.put("markrgb", "0.2 0.3 0.4");
        asset.appendChild("texture", texture);

        Map<String, String> material = new LinkedHashMap<>();
        material.put("name", "floor");
        material.put("texture", "floor");
        material.put("texrepeat", "10 10");
        material.put("texuniform", "true");
        asset.appendChild("material", material);

        Element worldbody = document.worldbody();
        if (worldbody != null) {
            Map<String, String> plane = new LinkedHashMap<>();
            plane.put("name", "floor");
            plane.put("type", "plane");
            plane.put("size", "20 20 0.1");
            plane.put("material", "floor");
            worldbody.appendChild("geom", plane);
        }
        log.info(Kind.ELEMENT_CREATED, "-> Added a floor plane to the model.").withTag("geom");
    }

    /** Adds a free joint to the first body under {@code worldbody} and lifts it when it has no position. */
    public void makeBaseFloating(double heightAboveFloor) {
        Element worldbody = requireWorldbody("make the base floating");
        if (worldbody == null) return;
        Element base = worldbody.find("body");
        if (base == null) {
            log.warn(Kind.PRECONDITION, "No <body> found under <worldbody>. Cannot make the base floating.").withTag("body");
            return;
        }
        boolean hasFreeJoint = base.findAll("joint").stream().anyMatch(j -> "free".equals(j.get("type")));
        if (!hasFreeJoint) {
            Element joint = new Element("joint");
            joint.set("name", "root");
            joint.set("type", "free");
            base.append(joint);
            log.info(Kind.ELEMENT_CREATED, "-> Made the base link '" + base.get("name") + "' floating with a free joint.")
                    .withTag("joint");
        }
        if (!base.has("pos")) {
            base.set("pos", "0 0 " + heightAboveFloor);
        }
    }

    public void enableGravityCompensation() {
        Element worldbody = requireWorldbody("enable gravity compensation");
        if (worldbody == null) return;
        List<Element> bodies = worldbody.findDescendants("body");
        for (Element body : bodies) {
            body.set("gravcomp", "1");
        }
        log.info(Kind.OPERATION_APPLIED, "-> Enabled gravity compensation for " + bodies.size() + " bodies.");
    }

    public void setJointArmature(double armature) {
        Element worldbody = requireWorldbody("set joint armature");
        if (worldbody == null) return;
        List<Element> joints = worldbody.findDescendants("joint");
        String value = AttributeValues.format(armature);
        for (Element joint : joints) {
            joint.set("armature", value);
        }
        log.info(Kind.OPERATION_APPLIED, "-> Set armature to '" + value + "' for " + joints.size() + " joints.");
    }

    public void setSimulationOptions(String solver, String integrator) {
        boolean hasSolver = solver != null && !solver.isEmpty();
        boolean hasIntegrator = integrator != null && !integrator.isEmpty();
        if (!hasSolver && !hasIntegrator) {
            return;
        }
        Element option = document.ensureChildAfter(MjcfDocument.OPTION, MjcfDocument.COMPILER);
        List<String> applied = new ArrayList<>();
        if (hasSolver) {
            option.set("solver", solver);
            applied.add("solver='" + solver + "'");
        }
        if (hasIntegrator) {
            option.set("integrator", integrator);
            applied.add("integrator='" + integrator + "'");
        }
        log.info(Kind.OPERATION_APPLIED, "-> Set simulation options: " + String.join(", ", applied)).withTag("option");
    }

    public void addClockPublisherPlugin() {
        Element extension = document.ensureExtension();
        extension.appendChild("plugin", Map.of("plugin", CLOCK_PUBLISHER_PLUGIN));

        Element worldbody = requireWorldbody("add clock publisher plugin");
        if (worldbody == null) return;
        Element plugin = worldbody.appendChild("plugin", Map.of("plugin", CLOCK_PUBLISHER_PLUGIN));
        plugin.append(config("topic_name", "/clock"));
        plugin.append(config("publish_rate", "100"));
        plugin.append(config("use_sim_time", "true"));
        log.info(Kind.ELEMENT_CREATED, "-> Added '" + CLOCK_PUBLISHER_PLUGIN + "' plugin to the model.").withTag("plugin");
    }

    public void addRos2ControlPlugin(String instance, String configFile) {
        Element extension = document.ensureExtension();
        Element plugin = extension.appendChild("plugin", Map.of("plugin", ROS2_CONTROL_PLUGIN));
        Element instanceNode = plugin.appendChild("instance", Map.of("name", instance));
        if (configFile != null && !configFile.isEmpty()) {
            instanceNode.append(config("config_file", configFile));
        } else {
            log.warn(Kind.PRECONDITION, "Adding ROS2 control WITHOUT a config file! Ros2Control plugin will use "
                    + "default config file and it may not work as expected.").withTag("plugin");
        }
        if (requireWorldbody("add Ros2Control plugin") == null) return;
        log.info(Kind.ELEMENT_CREATED, "-> Added '" + ROS2_CONTROL_PLUGIN + "' plugin to the model.").withTag("plugin");
    }

    /** Moves every {@code MujocoRosUtils::} extension plugin to the end of {@code extension}, keeping their order. */
    public void groupRosUtilsPlugins() {
        Element extension = document.extension();
        if (extension == null) return;
        List<Element> rosPlugins = new ArrayList<>();
        for (Element plugin : extension.findAll("plugin")) {
            if (plugin.get("plugin", "").startsWith(ROS_UTILS_PREFIX)) {
                rosPlugins.add(plugin);
            }
        }
        for (Element plugin : rosPlugins) {
            extension.remove(plugin);
        }
        for (Element plugin : rosPlugins) {
            extension.append(plugin);
        }
    }

    private Element requireWorldbody(String action) {
        Element worldbody = document.worldbody();
        if (worldbody == null) {
            log.warn(Kind.PRECONDITION, "No <worldbody> found in the model. Cannot " + action + ".")
                    .withTag(MjcfDocument.WORLDBODY);
        }
        return worldbody;
    }

    private static Element config(String key, String value) {
        Element config = new Element("config");
        config.set("key", key);
        config.set("value", value);
        return config;
    }
}
