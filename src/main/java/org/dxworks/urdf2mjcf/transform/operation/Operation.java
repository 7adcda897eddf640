package org.dxworks.urdf2mjcf.transform.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A mutation decoded from one reserved attribute of an annotation element.
 */
public abstract class Operation {
    private final OperationKind kind;

    protected Operation(OperationKind kind) {
        this.kind = kind;
    }

    public OperationKind getKind() {
        return kind;
    }

    protected static Map<String, String> frozen(Map<String, String> attributes) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public String toString() {
        return kind.getName();
    }
}
