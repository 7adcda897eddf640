package org.dxworks.urdf2mjcf.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GlobPatternTest {

    @Test
    void withoutStar_ComparesVerbatim() {
        assertTrue(GlobPattern.matches("visual", "visual"));
        assertFalse(GlobPattern.matches("visual2", "visual"));
        // '?' alone does not make a pattern
        assertFalse(GlobPattern.matches("link1", "link?"));
        assertTrue(GlobPattern.matches("link?", "link?"));
    }

    @Test
    void prefixStar_MatchesAnySuffix() {
        assertTrue(GlobPattern.matches("finger_joint", "finger*"));
        assertTrue(GlobPattern.matches("finger", "finger*"));
        assertFalse(GlobPattern.matches("left_finger", "finger*"));
    }

    @Test
    void starAndQuestionMark_Combine() {
        assertTrue(GlobPattern.matches("left_wheel_joint", "*_wheel_*"));
        assertTrue(GlobPattern.matches("link1_collision", "link?_*"));
        assertFalse(GlobPattern.matches("link12_collision", "link?_*"));
        assertTrue(GlobPattern.matches("anything", "*"));
        assertTrue(GlobPattern.matches("", "*"));
    }

    @Test
    void matching_IsCaseSensitive() {
        assertFalse(GlobPattern.matches("Finger_joint", "finger*"));
    }
}
