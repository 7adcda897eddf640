package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.transform.operation.Operation;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of classifying one annotation element during the fragment walk.
 */
public final class DispatchStep {

    public enum Kind {
        /** The element carries operations and is consumed by applying them. */
        CONSUMED,
        /** Only its children carry operations; the element provides their parent context. */
        RECURSE,
        /** No operations at this level; the element is injected as plain markup. */
        FALLBACK
    }

    private static final DispatchStep RECURSE = new DispatchStep(Kind.RECURSE, Collections.emptyList());
    private static final DispatchStep FALLBACK = new DispatchStep(Kind.FALLBACK, Collections.emptyList());

    private final Kind kind;
    private final List<Operation> operations;

    private DispatchStep(Kind kind, List<Operation> operations) {
        this.kind = kind;
        this.operations = operations;
    }

    public static DispatchStep consumed(List<Operation> operations) {
        return new DispatchStep(Kind.CONSUMED, List.copyOf(operations));
    }

    public static DispatchStep recurse() {
        return RECURSE;
    }

    public static DispatchStep fallback() {
        return FALLBACK;
    }

    public Kind getKind() {
        return kind;
    }

    /** Operations to apply; empty unless {@link Kind#CONSUMED}. */
    public List<Operation> getOperations() {
        return operations;
    }

    @Override
    public String toString() {
        return kind + (operations.isEmpty() ? "" : " " + operations);
    }
}
