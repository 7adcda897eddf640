package org.dxworks.urdf2mjcf.transform.operation;

import java.util.Map;

/**
 * When every condition holds on the target, drops the condition attributes and
 * sets the replacements. Otherwise leaves the target untouched.
 */
public class ConditionalReplaceOperation extends Operation {
    private final Map<String, String> conditions;
    private final Map<String, String> replacements;

    public ConditionalReplaceOperation(Map<String, String> conditions, Map<String, String> replacements) {
        super(OperationKind.CONDITIONAL_REPLACE);
        this.conditions = frozen(conditions);
        this.replacements = frozen(replacements);
    }

    public Map<String, String> getConditions() {
        return conditions;
    }

    public Map<String, String> getReplacements() {
        return replacements;
    }
}
