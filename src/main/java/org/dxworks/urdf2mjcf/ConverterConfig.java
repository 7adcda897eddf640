package org.dxworks.urdf2mjcf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.urdf2mjcf.actuator.ActuatorGains;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ConverterConfig {
    private static final Logger LOG = LoggerFactory.getLogger(ConverterConfig.class);

    private static final String CONFIG_FILE_NAME = "urdf2mjcf-config.yml";
    private static final String DEFAULT_MESH_DIR = "assets/";
    private static final String DEFAULT_ROS2_CONTROL_INSTANCE = "ros2_control";

    private ActuatorGains defaultActuatorGains = ActuatorGains.defaults();
    private boolean forceActuatorSuffix = false;
    private List<String> compilerOptions = Collections.emptyList();
    private String meshDir = DEFAULT_MESH_DIR;
    private boolean addFloor = false;
    private boolean floatingBase = false;
    private double heightAboveFloor = 0.0;
    private boolean noActuators = false;
    private Double armature;
    private double dampingMultiplier = 1.0;
    private boolean gravityCompensation = false;
    private boolean addRos2Control = false;
    private String ros2ControlConfig;
    private String ros2ControlInstance = DEFAULT_ROS2_CONTROL_INSTANCE;
    private boolean addRosPlugins = false;
    private boolean addClockPublisher = true;
    private boolean addMimicJoints = true;
    private String solver;
    private String integrator;

    private ConverterConfig() {
    }

    public static ConverterConfig defaults() {
        return new ConverterConfig();
    }

    public static ConverterConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ConverterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        YamlConfig yaml;
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            yaml = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return defaults();
        }
        if (yaml == null) {
            return defaults();
        }

        ConverterConfig config = defaults();
        if (yaml.defaultActuatorGains != null) {
            config.defaultActuatorGains = ActuatorGains.from(yaml.defaultActuatorGains);
        }
        if (yaml.forceActuatorSuffix != null) config.forceActuatorSuffix = yaml.forceActuatorSuffix;
        if (yaml.compilerOptions != null) config.compilerOptions = List.copyOf(yaml.compilerOptions);
        if (yaml.meshDir != null && !yaml.meshDir.isBlank()) config.meshDir = yaml.meshDir;
        if (yaml.addFloor != null) config.addFloor = yaml.addFloor;
        if (yaml.floatingBase != null) config.floatingBase = yaml.floatingBase;
        if (yaml.heightAboveFloor != null) config.heightAboveFloor = yaml.heightAboveFloor;
        if (yaml.noActuators != null) config.noActuators = yaml.noActuators;
        config.armature = yaml.armature;
        if (yaml.dampingMultiplier != null) config.dampingMultiplier = yaml.dampingMultiplier;
        if (yaml.gravityCompensation != null) config.gravityCompensation = yaml.gravityCompensation;
        if (yaml.addRos2Control != null) config.addRos2Control = yaml.addRos2Control;
        config.ros2ControlConfig = yaml.ros2ControlConfig;
        if (yaml.ros2ControlInstance != null && !yaml.ros2ControlInstance.isBlank()) {
            config.ros2ControlInstance = yaml.ros2ControlInstance;
        }
        if (yaml.addRosPlugins != null) config.addRosPlugins = yaml.addRosPlugins;
        if (yaml.addClockPublisher != null) config.addClockPublisher = yaml.addClockPublisher;
        if (yaml.addMimicJoints != null) config.addMimicJoints = yaml.addMimicJoints;
        config.solver = yaml.solver;
        config.integrator = yaml.integrator;
        return config;
    }

    private ConverterConfig copy() {
        ConverterConfig c = new ConverterConfig();
        c.defaultActuatorGains = defaultActuatorGains;
        c.forceActuatorSuffix = forceActuatorSuffix;
        c.compilerOptions = compilerOptions;
        c.meshDir = meshDir;
        c.addFloor = addFloor;
        c.floatingBase = floatingBase;
        c.heightAboveFloor = heightAboveFloor;
        c.noActuators = noActuators;
        c.armature = armature;
        c.dampingMultiplier = dampingMultiplier;
        c.gravityCompensation = gravityCompensation;
        c.addRos2Control = addRos2Control;
        c.ros2ControlConfig = ros2ControlConfig;
        c.ros2ControlInstance = ros2ControlInstance;
        c.addRosPlugins = addRosPlugins;
        c.addClockPublisher = addClockPublisher;
        c.addMimicJoints = addMimicJoints;
        c.solver = solver;
        c.integrator = integrator;
        return c;
    }

    public ConverterConfig withDefaultActuatorGains(ActuatorGains gains) {
        ConverterConfig c = copy();
        c.defaultActuatorGains = gains != null ? gains : ActuatorGains.defaults();
        return c;
    }

    public ConverterConfig withForceActuatorSuffix(boolean value) {
        ConverterConfig c = copy();
        c.forceActuatorSuffix = value;
        return c;
    }

    public ConverterConfig withCompilerOptions(List<String> options) {
        ConverterConfig c = copy();
        c.compilerOptions = options != null ? List.copyOf(options) : Collections.emptyList();
        return c;
    }

    public ConverterConfig withMeshDir(String value) {
        ConverterConfig c = copy();
        c.meshDir = value;
        return c;
    }

    public ConverterConfig withAddFloor(boolean value) {
        ConverterConfig c = copy();
        c.addFloor = value;
        return c;
    }

    public ConverterConfig withFloatingBase(boolean value, double heightAboveFloor) {
        ConverterConfig c = copy();
        c.floatingBase = value;
        c.heightAboveFloor = heightAboveFloor;
        return c;
    }

    public ConverterConfig withNoActuators(boolean value) {
        ConverterConfig c = copy();
        c.noActuators = value;
        return c;
    }

    public ConverterConfig withArmature(Double value) {
        ConverterConfig c = copy();
        c.armature = value;
        return c;
    }

    public ConverterConfig withDampingMultiplier(double value) {
        ConverterConfig c = copy();
        c.dampingMultiplier = value;
        return c;
    }

    public ConverterConfig withGravityCompensation(boolean value) {
        ConverterConfig c = copy();
        c.gravityCompensation = value;
        return c;
    }

    public ConverterConfig withRos2Control(boolean value, String configFile) {
        ConverterConfig c = copy();
        c.addRos2Control = value;
        c.ros2ControlConfig = configFile;
        return c;
    }

    public ConverterConfig withAddRosPlugins(boolean value) {
        ConverterConfig c = copy();
        c.addRosPlugins = value;
        return c;
    }

    public ConverterConfig withAddClockPublisher(boolean value) {
        ConverterConfig c = copy();
        c.addClockPublisher = value;
        return c;
    }

    public ConverterConfig withAddMimicJoints(boolean value) {
        ConverterConfig c = copy();
        c.addMimicJoints = value;
        return c;
    }

    public ConverterConfig withSimulationOptions(String solver, String integrator) {
        ConverterConfig c = copy();
        c.solver = solver;
        c.integrator = integrator;
        return c;
    }

    public ActuatorGains getDefaultActuatorGains() {
        return defaultActuatorGains;
    }

    public boolean isForceActuatorSuffix() {
        return forceActuatorSuffix;
    }

    public List<String> getCompilerOptions() {
        return compilerOptions;
    }

    public String getMeshDir() {
        return meshDir;
    }

    public boolean isAddFloor() {
        return addFloor;
    }

    public boolean isFloatingBase() {
        return floatingBase;
    }

    public double getHeightAboveFloor() {
        return heightAboveFloor;
    }

    public boolean isNoActuators() {
        return noActuators;
    }

    public Double getArmature() {
        return armature;
    }

    public double getDampingMultiplier() {
        return dampingMultiplier;
    }

    public boolean isGravityCompensation() {
        return gravityCompensation;
    }

    public boolean isAddRos2Control() {
        return addRos2Control;
    }

    public String getRos2ControlConfig() {
        return ros2ControlConfig;
    }

    public String getRos2ControlInstance() {
        return ros2ControlInstance;
    }

    public boolean isAddRosPlugins() {
        return addRosPlugins;
    }

    public boolean isAddClockPublisher() {
        return addClockPublisher;
    }

    public boolean isAddMimicJoints() {
        return addMimicJoints;
    }

    public String getSolver() {
        return solver;
    }

    public String getIntegrator() {
        return integrator;
    }

    private static class YamlConfig {
        public Object defaultActuatorGains;
        public Boolean forceActuatorSuffix;
        public List<String> compilerOptions = new ArrayList<>();
        public String meshDir;
        public Boolean addFloor;
        public Boolean floatingBase;
        public Double heightAboveFloor;
        public Boolean noActuators;
        public Double armature;
        public Double dampingMultiplier;
        public Boolean gravityCompensation;
        public Boolean addRos2Control;
        public String ros2ControlConfig;
        public String ros2ControlInstance;
        public Boolean addRosPlugins;
        public Boolean addClockPublisher;
        public Boolean addMimicJoints;
        public String solver;
        public String integrator;
    }
}
