package org.dxworks.urdf2mjcf.transform.operation;

public enum OperationKind {
    INJECT("inject"),
    REPLACE("replace"),
    CONDITIONAL_REPLACE("conditional_replace"),
    INJECT_CHILDREN("inject_children");

    private final String name;

    OperationKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
