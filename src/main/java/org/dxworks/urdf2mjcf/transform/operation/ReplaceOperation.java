package org.dxworks.urdf2mjcf.transform.operation;

import java.util.Map;

/** Overwrites attributes the target already has; never introduces new names. */
public class ReplaceOperation extends Operation {
    private final Map<String, String> attributes;

    public ReplaceOperation(Map<String, String> attributes) {
        super(OperationKind.REPLACE);
        this.attributes = frozen(attributes);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }
}
