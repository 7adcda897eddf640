package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.transform.AttributeGrammar.ParsedAttributes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AttributeGrammarTest {

    @Test
    void parse_SpaceSeparated() {
        ParsedAttributes parsed = AttributeGrammar.parse("class='visual' group='2'");

        assertEquals(Map.of("class", "visual", "group", "2"), parsed.pairs());
        assertEquals(List.of("class", "group"), List.copyOf(parsed.pairs().keySet()));
    }

    @Test
    void parse_SemicolonAndCommaSeparated() {
        assertEquals(Map.of("a", "1", "b", "2"), AttributeGrammar.parse("a='1';b='2'").pairs());
        assertEquals(Map.of("a", "1", "b", "2"), AttributeGrammar.parse("a='1', b=\"2\"").pairs());
    }

    @Test
    void parse_ValuesKeepSpacesAndSeparators() {
        ParsedAttributes parsed = AttributeGrammar.parse("pos='1.0 2.0 3.0' note='a;b,c'");

        assertEquals("1.0 2.0 3.0", parsed.pairs().get("pos"));
        assertEquals("a;b,c", parsed.pairs().get("note"));
    }

    @Test
    void parse_AssignmentWithColon() {
        assertEquals(Map.of("name", "value"), AttributeGrammar.parse("name:='value'").pairs());
    }

    @Test
    void parse_DuplicateKeysLastWins() {
        ParsedAttributes parsed = AttributeGrammar.parse("a='1' a='2'");

        assertEquals("2", parsed.pairs().get("a"));
        assertEquals(List.of("a"), parsed.duplicateKeys());
    }

    @Test
    void parse_UnquotedOrUnterminatedIsDropped() {
        assertTrue(AttributeGrammar.parse("a=1 b=2").isEmpty());
        assertTrue(AttributeGrammar.parse("a='1").isEmpty());
        assertTrue(AttributeGrammar.parse("a='1\n'").isEmpty());
        assertTrue(AttributeGrammar.parse(null).isEmpty());
    }

    @Test
    void topLevelSeparator_SkipsQuotedAndAssignmentColons() {
        assertEquals(11, AttributeGrammar.topLevelSeparator("class='old':class='new'"));
        assertEquals(-1, AttributeGrammar.topLevelSeparator("name:='value'"));
        assertEquals(-1, AttributeGrammar.topLevelSeparator("url='http://x'"));
        assertEquals(-1, AttributeGrammar.topLevelSeparator(null));
    }
}
