package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Finds elements by tag and attribute constraints below a context node.
 * The context node itself is never a candidate.
 */
public class PatternMatcher {

    public enum MatchMode {
        /** Values containing {@code *} are glob patterns. */
        GLOB,
        /** Every value is compared verbatim, {@code *} included. */
        EXACT
    }

    private final ConversionLog log;

    public PatternMatcher(ConversionLog log) {
        this.log = log;
    }

    public List<Element> find(Element context, String tag, Map<String, String> constraints) {
        return find(context, tag, constraints, MatchMode.GLOB);
    }

    public List<Element> find(Element context, String tag, Map<String, String> constraints, MatchMode mode) {
        if (context == null) {
            return Collections.emptyList();
        }
        Map<String, String> safeConstraints = constraints == null ? Collections.emptyMap() : constraints;
        List<Element> matches = new ArrayList<>();
        context.forEachDescendant(candidate -> {
            if (candidate.getTag().equals(tag) && satisfies(candidate, safeConstraints, mode)) {
                matches.add(candidate);
            }
        });

        String pattern = Element.describe(tag, safeConstraints);
        if (matches.isEmpty()) {
            log.debug(Kind.NO_MATCH, "No elements matched pattern " + pattern + " within <" + context.getTag() + ">")
                    .withTag(tag);
        } else {
            log.info(Kind.MATCH, "Found " + matches.size() + " element(s) matching pattern " + pattern)
                    .withTag(tag)
                    .withCount(matches.size());
        }
        return matches;
    }

    static boolean satisfies(Element candidate, Map<String, String> constraints, MatchMode mode) {
        for (Map.Entry<String, String> constraint : constraints.entrySet()) {
            String value = candidate.get(constraint.getKey());
            if (value == null) {
                return false;
            }
            boolean ok = mode == MatchMode.EXACT
                    ? value.equals(constraint.getValue())
                    : GlobPattern.matches(value, constraint.getValue());
            if (!ok) {
                return false;
            }
        }
        return true;
    }
}
