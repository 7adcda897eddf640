package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;
import org.dxworks.urdf2mjcf.transform.AttributeGrammar.ParsedAttributes;
import org.dxworks.urdf2mjcf.transform.operation.ConditionalReplaceOperation;
import org.dxworks.urdf2mjcf.transform.operation.InjectChildrenOperation;
import org.dxworks.urdf2mjcf.transform.operation.InjectOperation;
import org.dxworks.urdf2mjcf.transform.operation.Operation;
import org.dxworks.urdf2mjcf.transform.operation.ReplaceOperation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes the reserved operation attributes of an annotation element:
 * <ul>
 *   <li>{@code inject_attr="k1='v1' k2='v2'"}</li>
 *   <li>{@code inject_attrs="k1='v1';k2='v2'"}</li>
 *   <li>{@code replace_attrs="k1='v1',k2='v2'"} or {@code replace_attrs="cond='a':new='b'"}</li>
 *   <li>{@code inject_children="k1='v1',k2='v2'"}</li>
 * </ul>
 * Malformed values are reported and dropped; they never abort parsing of the others.
 */
public class OperationParser {
    public static final String INJECT_ATTR = "inject_attr";
    public static final String INJECT_ATTRS = "inject_attrs";
    public static final String REPLACE_ATTRS = "replace_attrs";
    public static final String INJECT_CHILDREN = "inject_children";

    public static final Set<String> RESERVED_ATTRIBUTES = Set.of(INJECT_ATTR, INJECT_ATTRS, REPLACE_ATTRS, INJECT_CHILDREN);

    private final ConversionLog log;

    public OperationParser(ConversionLog log) {
        this.log = log;
    }

    public List<Operation> parse(Element element) {
        return decode(element, true);
    }

    /** True when the element declares at least one well-formed operation. Reports nothing. */
    public boolean declaresOperations(Element element) {
        return !decode(element, false).isEmpty();
    }

    /** The element's attributes minus the reserved operation names. */
    public static Map<String, String> matchingAttributes(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : element.getAttributes().entrySet()) {
            if (!RESERVED_ATTRIBUTES.contains(entry.getKey())) {
                attributes.put(entry.getKey(), entry.getValue());
            }
        }
        return attributes;
    }

    public static boolean hasOperationAttributes(Element element) {
        for (String name : element.getAttributes().keySet()) {
            if (RESERVED_ATTRIBUTES.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /** Deep copy with the reserved operation attributes removed at every level. */
    public static Element withoutOperations(Element element) {
        Element copy = new Element(element.getTag(), matchingAttributes(element));
        copy.setText(element.getText());
        for (Element child : element.getChildren()) {
            copy.append(withoutOperations(child));
        }
        return copy;
    }

    private List<Operation> decode(Element element, boolean report) {
        List<Operation> operations = new ArrayList<>();

        String injectAttr = element.get(INJECT_ATTR);
        if (isPresent(injectAttr)) {
            Map<String, String> attrs = pairs(injectAttr, " ", report);
            if (!attrs.isEmpty()) {
                operations.add(new InjectOperation(attrs));
            }
        }

        String injectAttrs = element.get(INJECT_ATTRS);
        if (isPresent(injectAttrs)) {
            Map<String, String> attrs = pairs(injectAttrs, ";", report);
            if (!attrs.isEmpty()) {
                operations.add(new InjectOperation(attrs));
            }
        }

        String replaceAttrs = element.get(REPLACE_ATTRS);
        if (isPresent(replaceAttrs)) {
            Operation replace = AttributeGrammar.topLevelSeparator(replaceAttrs) >= 0
                    ? conditionalReplace(replaceAttrs, report)
                    : simpleReplace(replaceAttrs, report);
            if (replace != null) {
                operations.add(replace);
            }
        }

        String injectChildren = element.get(INJECT_CHILDREN);
        if (isPresent(injectChildren)) {
            Map<String, String> attrs = pairs(injectChildren, ",", report);
            if (!attrs.isEmpty()) {
                operations.add(new InjectChildrenOperation(attrs, element));
            }
        }

        return operations;
    }

    private Operation simpleReplace(String value, boolean report) {
        Map<String, String> attrs = pairs(value, ",", report);
        return attrs.isEmpty() ? null : new ReplaceOperation(attrs);
    }

    private Operation conditionalReplace(String value, boolean report) {
        int separator = AttributeGrammar.topLevelSeparator(value);
        String conditionsPart = value.substring(0, separator).trim();
        String replacementsPart = value.substring(separator + 1).trim();

        Map<String, String> conditions = pairs(conditionsPart, ",", report);
        Map<String, String> replacements = pairs(replacementsPart, ",", report);
        if (conditions.isEmpty()) {
            if (report) {
                log.warn(Kind.UNPARSEABLE, "No valid conditions found in conditional replacement: " + value);
            }
            return null;
        }
        if (replacements.isEmpty()) {
            if (report) {
                log.warn(Kind.UNPARSEABLE, "No valid replacements found in conditional replacement: " + value);
            }
            return null;
        }
        return new ConditionalReplaceOperation(conditions, replacements);
    }

    private Map<String, String> pairs(String value, String separator, boolean report) {
        ParsedAttributes parsed = AttributeGrammar.parse(value);
        if (report) {
            for (String key : parsed.duplicateKeys()) {
                log.warn(Kind.UNPARSEABLE, "Duplicate attribute '" + key + "' found in '" + value
                        + "'. Using last value: '" + parsed.pairs().get(key) + "'");
            }
            if (parsed.isEmpty()) {
                log.warn(Kind.UNPARSEABLE, "Could not parse attribute string: '" + value
                        + "'. Expected format like key1='value1'" + separator + "key2='value2' or key:='value'");
            }
        }
        return parsed.pairs();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
