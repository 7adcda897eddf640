package org.dxworks.urdf2mjcf;

import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.MjcfDocument;
import org.dxworks.urdf2mjcf.xml.XmlReader;
import org.dxworks.urdf2mjcf.xml.XmlWriter;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MjcfConverterTest {
    private static final Path URDF = Paths.get("src/test/resources/samples/arm/robot.urdf");
    private static final Path BASELINE = Paths.get("src/test/resources/samples/arm/baseline.xml");

    private static List<String> tags(Element parent) {
        return parent.getChildren().stream().map(Element::getTag).toList();
    }

    private static Element joint(MjcfDocument document, String name) {
        return document.getRoot().findDescendants("joint").stream()
                .filter(j -> name.equals(j.get("name"))).findFirst().orElseThrow();
    }

    @Test
    void convert_SampleArmWithDefaults() throws Exception {
        ConversionResult result = new MjcfConverter(ConverterConfig.defaults(), Map.of()).convert(BASELINE, URDF);
        MjcfDocument document = result.document;

        assertEquals(List.of("compiler", "extension", "option", "worldbody", "actuator"), tags(document.getRoot()));

        Element compiler = document.compiler();
        assertEquals("radian", compiler.get("angle"));
        assertEquals("meshes/", compiler.get("meshdir"));
        assertEquals("true", compiler.get("balanceinertia"));
        assertEquals("false", compiler.get("fusestatic"));

        assertEquals("0.001", document.section("option").get("timestep"));
        assertEquals("2.0", joint(document, "joint1").get("damping"));
        assertEquals("tip", document.getRoot().findDescendants("site").get(0).get("name"));

        assertEquals(List.of("MujocoRosUtils::ClockPublisher", "MujocoRosUtils::MimicJoint"),
                document.extension().getChildren().stream().map(p -> p.get("plugin")).toList());
        assertEquals(List.of("light", "plugin"), document.worldbody().getChildren().subList(1, 3).stream()
                .map(Element::getTag).toList());

        Element actuator = document.actuator();
        assertEquals(List.of("position", "position", "plugin"), tags(actuator));
        assertEquals("<position name=\"joint1\" joint=\"joint1\" kp=\"500.0\" ctrlrange=\"-1.57 1.57\" "
                + "forcelimited=\"true\" forcerange=\"-10 10\" />", XmlWriter.toString(actuator.getChildren().get(0)).trim());
        assertEquals("finger_joint", actuator.getChildren().get(1).get("name"));
        Element mimic = actuator.find("plugin");
        assertEquals("finger_joint", mimic.get("joint"));
        assertEquals(List.of("joint1", "0.5"), mimic.getChildren().stream().map(c -> c.get("value")).toList());

        assertTrue(result.log.warnings().isEmpty());
    }

    @Test
    void convert_ConfiguredSteps() throws Exception {
        ConverterConfig config = ConverterConfig.defaults()
                .withNoActuators(true)
                .withAddClockPublisher(false)
                .withDampingMultiplier(2.0)
                .withArmature(0.05)
                .withGravityCompensation(true)
                .withAddFloor(true)
                .withFloatingBase(true, 0.3)
                .withSimulationOptions("CG", null)
                .withCompilerOptions(List.of("angle=degree"));

        MjcfDocument document = new MjcfConverter(config, Map.of()).convert(BASELINE, URDF).document;

        assertNull(document.actuator());
        assertNull(document.extension());
        assertEquals("degree", document.compiler().get("angle"));
        assertEquals("CG", document.section("option").get("solver"));
        assertEquals("0.001", document.section("option").get("timestep"));
        // the annotation runs after damping scaling, so it wins
        assertEquals("2.0", joint(document, "joint1").get("damping"));
        assertEquals("0.05", joint(document, "finger_joint").get("armature"));
        assertEquals("1", document.worldbody().find("body").get("gravcomp"));
        assertEquals("0 0 0.1", document.worldbody().find("body").get("pos"));
        assertEquals("free", joint(document, "root").get("type"));
        assertNotNull(document.section("asset"));
    }

    @Test
    void convert_Ros2ControlWithoutConfigFile() throws Exception {
        ConverterConfig config = ConverterConfig.defaults()
                .withRos2Control(true, null)
                .withAddRosPlugins(true)
                .withAddMimicJoints(false);

        ConversionResult result = new MjcfConverter(config, Map.of()).convert(BASELINE, URDF);

        List<String> plugins = result.document.extension().getChildren().stream().map(p -> p.get("plugin")).toList();
        assertEquals(List.of("MujocoRosUtils::ClockPublisher", "MujocoRosUtils::Ros2Control",
                "MujocoRosUtils::ActuatorCommand"), plugins);
        assertEquals(1, result.log.warnings().size());
        assertEquals(1, result.document.actuator().findAll("plugin").size());
    }

    @Test
    void convert_MissingInputFails() {
        MjcfConverter converter = new MjcfConverter(ConverterConfig.defaults(), Map.of());

        ConversionException e = assertThrows(ConversionException.class,
                () -> converter.convert(Paths.get("src/test/resources/samples/arm/missing.xml"), URDF));
        assertTrue(e.getMessage().startsWith("File not found"));
    }

    @Test
    void convert_OutputRoundTripsThroughWriter() throws Exception {
        ConversionResult result = new MjcfConverter(ConverterConfig.defaults(), Map.of()).convert(BASELINE, URDF);

        String xml = XmlWriter.toString(result.document.getRoot(), true);
        Element reread = XmlReader.parse(xml);

        assertTrue(xml.startsWith(XmlWriter.DECLARATION));
        assertEquals(tags(result.document.getRoot()), tags(reread));
    }
}
