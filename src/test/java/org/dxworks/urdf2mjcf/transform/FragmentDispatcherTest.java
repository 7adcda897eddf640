package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.MjcfDocument;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;
import org.dxworks.urdf2mjcf.xml.XmlReader;
import org.dxworks.urdf2mjcf.xml.XmlWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FragmentDispatcherTest {
    private static final String BASELINE = "<mujoco model=\"robot\">"
            + "<compiler angle=\"radian\"/>"
            + "<option integrator=\"RK4\"/>"
            + "<default><default class=\"robot\"><geom group=\"1\"/><geom class=\"x\" group=\"2\"/></default></default>"
            + "<asset/>"
            + "<worldbody>"
            + "<body name=\"base\">"
            + "<geom class=\"visual\" group=\"2\"/>"
            + "<joint name=\"finger_left\"/>"
            + "<body name=\"arm\"><joint name=\"finger_right\"/></body>"
            + "</body>"
            + "</worldbody>"
            + "</mujoco>";

    private ConversionLog log;
    private MjcfDocument document;
    private FragmentDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        log = new ConversionLog();
        document = new MjcfDocument(XmlReader.parse(BASELINE));
        dispatcher = new FragmentDispatcher(document, log);
    }

    private void dispatch(String... fragments) throws Exception {
        List<Element> elements = new ArrayList<>();
        for (String fragment : fragments) {
            elements.add(XmlReader.parse(fragment));
        }
        dispatcher.dispatch(elements);
    }

    private List<String> topLevelTags() {
        return document.getRoot().getChildren().stream().map(Element::getTag).toList();
    }

    private Element body(String name) {
        return new PatternMatcher(new ConversionLog()).find(document.getRoot(), "body", Map.of("name", name)).get(0);
    }

    @Test
    void plan_ClassifiesElements() throws Exception {
        assertEquals(DispatchStep.Kind.CONSUMED,
                dispatcher.plan(XmlReader.parse("<geom inject_attr=\"a='1'\"/>")).getKind());
        assertEquals(DispatchStep.Kind.RECURSE,
                dispatcher.plan(XmlReader.parse("<body name=\"base\"><geom inject_attr=\"a='1'\"/></body>")).getKind());
        assertEquals(DispatchStep.Kind.FALLBACK,
                dispatcher.plan(XmlReader.parse("<contact><exclude body1=\"a\" body2=\"b\"/></contact>")).getKind());
        assertEquals(DispatchStep.Kind.FALLBACK,
                dispatcher.plan(XmlReader.parse("<geom inject_attr=\"broken\"/>")).getKind());
    }

    @Test
    void plan_DoesNotTouchDocument() throws Exception {
        String before = XmlWriter.toString(document.getRoot());

        dispatcher.plan(XmlReader.parse("<sensor inject_attr=\"rate='100'\"/>"));

        assertEquals(before, XmlWriter.toString(document.getRoot()));
    }

    @Test
    void dispatch_CreatesMissingSectionBeforeWorldbody() throws Exception {
        dispatch("<sensor inject_attr=\"rate='100' noise='0.01'\"/>");

        assertEquals(List.of("compiler", "option", "default", "asset", "sensor", "worldbody"), topLevelTags());
        Element sensor = document.section("sensor");
        assertEquals(Map.of("rate", "100", "noise", "0.01"), sensor.getAttributes());
        assertEquals(1, log.eventsOf(Kind.ELEMENT_CREATED).size());
    }

    @Test
    void dispatch_AttributelessInjectTargetsExistingSection() throws Exception {
        dispatch("<option inject_attr=\"timestep='0.001'\"/>");

        assertEquals("0.001", document.section("option").get("timestep"));
        assertEquals("RK4", document.section("option").get("integrator"));
    }

    @Test
    void dispatch_WildcardInjectHitsEveryMatch() throws Exception {
        dispatch("<joint name=\"finger*\" inject_attr=\"damping='0.1'\"/>");

        List<Element> joints = document.worldbody().findDescendants("joint");
        assertTrue(joints.stream().allMatch(j -> "0.1".equals(j.get("damping"))));
    }

    @Test
    void dispatch_ScopedConditionalReplace() throws Exception {
        dispatch("<body name=\"base\"><geom replace_attrs=\"class='visual':class='collision'\"/></body>");

        Element geom = body("base").find("geom");
        assertEquals("collision", geom.get("class"));
        assertEquals("2", geom.get("group"));
    }

    @Test
    void dispatch_ScopedReplaceLeavesOtherScopesAlone() throws Exception {
        dispatch("<default class=\"robot\"><geom replace_attrs=\"group='3'\"/><joint damping=\"0.5\"/></default>");

        Element robotDefault = new PatternMatcher(new ConversionLog())
                .find(document.getRoot(), "default", Map.of("class", "robot")).get(0);
        assertTrue(robotDefault.findAll("geom").stream().allMatch(g -> "3".equals(g.get("group"))));
        assertEquals("0.5", robotDefault.find("joint").get("damping"));
        assertEquals("2", body("base").find("geom").get("group"));
    }

    @Test
    void dispatch_RecurseWithoutParentWarns() throws Exception {
        dispatch("<body name=\"missing\"><geom inject_attr=\"a='1'\"/></body>");

        assertEquals(1, log.warnings().size());
        assertEquals(Kind.NO_MATCH, log.warnings().get(0).kind);
    }

    @Test
    void dispatch_InjectChildrenAppendsTemplateChildren() throws Exception {
        dispatch("<body inject_children=\"name='arm'\"><site name=\"imu\"/><camera name=\"cam\"/></body>");

        Element arm = body("arm");
        assertEquals(List.of("joint", "site", "camera"), arm.getChildren().stream().map(Element::getTag).toList());
        assertNull(body("base").find("site"));
    }

    @Test
    void dispatch_InjectChildrenIgnoresOtherOperations() throws Exception {
        dispatch("<body inject_children=\"name='arm'\" inject_attr=\"gravcomp='1'\"><site name=\"imu\"/></body>");

        Element arm = body("arm");
        assertNotNull(arm.find("site"));
        assertFalse(arm.has("gravcomp"));
        assertEquals(1, log.eventsOf(Kind.OPERATION_SKIPPED).size());
    }

    @Test
    void dispatch_InjectChildrenMatchesLiterally() throws Exception {
        dispatch("<body inject_children=\"name='a*'\"><site name=\"imu\"/></body>");

        assertNull(body("arm").find("site"));
        assertEquals(Kind.NO_MATCH, log.warnings().get(0).kind);
    }

    @Test
    void dispatch_NoMatchIsReportedAndSkipped() throws Exception {
        String before = XmlWriter.toString(document.getRoot());

        dispatch("<geom name=\"nope\" inject_attr=\"rgba='1 0 0 1'\"/>", "<sensor inject_attr=\"rate='5'\"/>");

        assertEquals(Kind.NO_MATCH, log.warnings().get(0).kind);
        assertNotEquals(before, XmlWriter.toString(document.getRoot()));
        assertEquals("5", document.section("sensor").get("rate"));
    }

    @Test
    void dispatch_AttributelessReplaceDoesNotCreatePlaceholder() throws Exception {
        dispatch("<tendon replace_attrs=\"width='0.01'\"/>");

        assertNull(document.section("tendon"));
        assertEquals(Kind.NO_MATCH, log.warnings().get(0).kind);
    }

    @Test
    void dispatch_PlainFragmentCreatesSection() throws Exception {
        dispatch("<contact><exclude body1=\"base\" body2=\"arm\"/></contact>");

        Element contact = document.section("contact");
        assertNotNull(contact);
        assertEquals(document.getRoot().indexOf(document.worldbody()) - 1, document.getRoot().indexOf(contact));
        assertEquals("arm", contact.find("exclude").get("body2"));
    }

    @Test
    void dispatch_PlainFragmentMergesIntoExistingSection() throws Exception {
        dispatch("<option timestep=\"0.001\"><flag warmstart=\"disable\"/></option>");

        Element option = document.section("option");
        assertEquals("RK4", option.get("integrator"));
        assertEquals("0.001", option.get("timestep"));
        assertNotNull(option.find("flag"));
        assertEquals(1, document.getRoot().findAll("option").size());
    }

    @Test
    void dispatch_PlainFragmentDoesNotCopyWildcardValues() throws Exception {
        dispatch("<body name=\"a*\"><site name=\"tip\"/></body>");

        Element arm = body("arm");
        assertEquals("arm", arm.get("name"));
        assertEquals("tip", arm.find("site").get("name"));
        assertNull(document.section("body"));
    }

    @Test
    void dispatch_RecurseCopiesPlainChildrenIntoParent() throws Exception {
        dispatch("<body name=\"arm\"><site name=\"tip\"/><joint name=\"finger_right\" inject_attr=\"range='0 1'\"/></body>");

        Element arm = body("arm");
        assertEquals("tip", arm.find("site").get("name"));
        assertEquals("0 1", arm.find("joint").get("range"));
    }

    @Test
    void dispatch_RecurseDropsMalformedOperationsOnPlainChildren() throws Exception {
        dispatch("<body name=\"base\"><geom class=\"visual\" inject_attr=\"broken\"/>"
                + "<site replace_attrs=\"x='1'\" name=\"s\"/></body>");

        assertEquals(1, log.eventsOf(Kind.UNPARSEABLE).size());
        List<Element> geoms = body("base").findAll("geom");
        assertEquals(2, geoms.size());
        assertEquals(Map.of("class", "visual"), geoms.get(1).getAttributes());
        assertFalse(XmlWriter.toString(document.getRoot()).contains("inject_attr"));
    }

    @Test
    void dispatch_PlainFragmentDropsMalformedOperationsOnChildren() throws Exception {
        dispatch("<default class=\"robot\"><geom replace_attrs=\"broken\"/></default>");

        assertEquals(1, log.eventsOf(Kind.UNPARSEABLE).size());
        Element robotDefault = new PatternMatcher(new ConversionLog())
                .find(document.getRoot(), "default", Map.of("class", "robot")).get(0);
        assertEquals(3, robotDefault.findAll("geom").size());
        assertFalse(XmlWriter.toString(document.getRoot()).contains("replace_attrs"));
    }

    @Test
    void dispatch_PlainMarkupNeverCarriesNestedOperations() throws Exception {
        dispatch("<tendon><spatial name=\"t\"><site site=\"s1\" inject_attr=\"x='1'\"/></spatial></tendon>");

        Element site = document.section("tendon").find("spatial").find("site");
        assertEquals(Map.of("site", "s1"), site.getAttributes());
        assertEquals(1, log.eventsOf(Kind.OPERATION_SKIPPED).size());
    }

    @Test
    void dispatch_InjectChildrenStripsOperationAttributes() throws Exception {
        dispatch("<body inject_children=\"name='arm'\"><site name=\"imu\" inject_attr=\"broken\"/></body>");

        assertEquals(Map.of("name", "imu"), body("arm").find("site").getAttributes());
        assertEquals(1, log.eventsOf(Kind.UNPARSEABLE).size());
    }

    @Test
    void dispatch_NestedWarningsReportedOncePerFragment() throws Exception {
        dispatch("<body name=\"*\"><geom inject_attr=\"a='1' a='2'\"/></body>");

        assertEquals(1, log.eventsOf(Kind.UNPARSEABLE).size());
        assertEquals("2", body("base").find("geom").get("a"));
        assertEquals(1, log.eventsOf(Kind.NO_MATCH).size());
    }

    @Test
    void dispatch_EmptyListIsInformational() {
        dispatcher.dispatch(List.of());

        assertTrue(log.warnings().isEmpty());
        assertEquals(1, log.getEvents().size());
    }
}
