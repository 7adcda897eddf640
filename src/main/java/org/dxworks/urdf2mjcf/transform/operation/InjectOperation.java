package org.dxworks.urdf2mjcf.transform.operation;

import java.util.Map;

/** Sets every attribute on the target, overwriting existing values. */
public class InjectOperation extends Operation {
    private final Map<String, String> attributes;

    public InjectOperation(Map<String, String> attributes) {
        super(OperationKind.INJECT);
        this.attributes = frozen(attributes);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }
}
