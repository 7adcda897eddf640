package org.dxworks.urdf2mjcf.transform.operation;

import org.dxworks.urdf2mjcf.model.Element;

import java.util.Map;

/**
 * Uses the annotation element as a template: its children are copied into every
 * element of the same tag whose attributes equal {@link #getMatchAttributes()}.
 */
public class InjectChildrenOperation extends Operation {
    private final Map<String, String> matchAttributes;
    private final Element template;

    public InjectChildrenOperation(Map<String, String> matchAttributes, Element template) {
        super(OperationKind.INJECT_CHILDREN);
        this.matchAttributes = frozen(matchAttributes);
        this.template = template;
    }

    public Map<String, String> getMatchAttributes() {
        return matchAttributes;
    }

    /** The annotation element; read-only. */
    public Element getTemplate() {
        return template;
    }
}
