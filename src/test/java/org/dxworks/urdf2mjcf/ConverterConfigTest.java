package org.dxworks.urdf2mjcf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConverterConfigTest {

    @Test
    void defaults_MatchDocumentedValues() {
        ConverterConfig config = ConverterConfig.defaults();

        assertEquals(Map.of("kp", 500.0, "kv", 1.0), config.getDefaultActuatorGains().asMap());
        assertFalse(config.isForceActuatorSuffix());
        assertEquals("assets/", config.getMeshDir());
        assertTrue(config.isAddClockPublisher());
        assertTrue(config.isAddMimicJoints());
        assertFalse(config.isAddRos2Control());
        assertEquals("ros2_control", config.getRos2ControlInstance());
        assertEquals(1.0, config.getDampingMultiplier());
        assertNull(config.getArmature());
        assertTrue(config.getCompilerOptions().isEmpty());
    }

    @Test
    void load_MissingFileGivesDefaults() {
        ConverterConfig config = ConverterConfig.load(Paths.get("src/test/resources/config/does-not-exist.yml"));

        assertEquals("assets/", config.getMeshDir());
    }

    @Test
    void load_ReadsEveryKey() {
        ConverterConfig config = ConverterConfig.load(Paths.get("src/test/resources/config/full-config.yml"));

        assertEquals(100.0, config.getDefaultActuatorGains().getKp());
        assertEquals(0.8, config.getDefaultActuatorGains().getDampRatio());
        assertTrue(config.isForceActuatorSuffix());
        assertEquals(List.of("angle=degree", "autolimits=true"), config.getCompilerOptions());
        assertEquals("meshes/", config.getMeshDir());
        assertTrue(config.isAddFloor());
        assertTrue(config.isFloatingBase());
        assertEquals(0.5, config.getHeightAboveFloor());
        assertEquals(0.01, config.getArmature());
        assertEquals(2.0, config.getDampingMultiplier());
        assertTrue(config.isGravityCompensation());
        assertTrue(config.isAddRos2Control());
        assertEquals("package://arm_bringup/config/controllers.yaml", config.getRos2ControlConfig());
        assertTrue(config.isAddRosPlugins());
        assertFalse(config.isAddClockPublisher());
        assertFalse(config.isAddMimicJoints());
        assertEquals("Newton", config.getSolver());
        assertEquals("implicitfast", config.getIntegrator());
    }

    @Test
    void load_LegacyGainsList() {
        ConverterConfig config = ConverterConfig.load(Paths.get("src/test/resources/config/legacy-gains.yml"));

        assertEquals(Map.of("kp", 250.0, "kv", 2.0), config.getDefaultActuatorGains().asMap());
    }

    @Test
    void load_InvalidGainsFail() {
        Path path = Paths.get("src/test/resources/config/invalid-gains.yml");

        assertThrows(IllegalArgumentException.class, () -> ConverterConfig.load(path));
    }

    @Test
    void load_UnreadableYamlFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path broken = dir.resolve("broken.yml");
        Files.writeString(broken, "addFloor: [unterminated");

        ConverterConfig config = ConverterConfig.load(broken);

        assertFalse(config.isAddFloor());
    }

    @Test
    void with_LeavesOriginalUntouched() {
        ConverterConfig base = ConverterConfig.defaults();

        ConverterConfig changed = base.withAddFloor(true).withFloatingBase(true, 1.0).withArmature(0.2);

        assertFalse(base.isAddFloor());
        assertNull(base.getArmature());
        assertTrue(changed.isAddFloor());
        assertEquals(1.0, changed.getHeightAboveFloor());
        assertEquals(0.2, changed.getArmature());
    }
}
