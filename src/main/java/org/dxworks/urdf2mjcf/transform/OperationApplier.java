package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;
import org.dxworks.urdf2mjcf.transform.operation.ConditionalReplaceOperation;
import org.dxworks.urdf2mjcf.transform.operation.InjectChildrenOperation;
import org.dxworks.urdf2mjcf.transform.operation.InjectOperation;
import org.dxworks.urdf2mjcf.transform.operation.Operation;
import org.dxworks.urdf2mjcf.transform.operation.ReplaceOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Performs one decoded operation on one matched target element.
 */
public class OperationApplier {
    private final ConversionLog log;

    public OperationApplier(ConversionLog log) {
        this.log = log;
    }

    public void apply(Element target, Operation operation) {
        switch (operation.getKind()) {
            case INJECT -> inject(target, (InjectOperation) operation);
            case REPLACE -> replace(target, (ReplaceOperation) operation);
            case CONDITIONAL_REPLACE -> conditionalReplace(target, (ConditionalReplaceOperation) operation);
            case INJECT_CHILDREN -> injectChildren(target, (InjectChildrenOperation) operation);
        }
    }

    public void applyAll(Element target, List<Operation> operations) {
        for (Operation operation : operations) {
            apply(target, operation);
        }
        log.info(Kind.OPERATION_APPLIED, "Applied custom operations to element: " + target.describe())
                .withTag(target.getTag());
    }

    private void inject(Element target, InjectOperation operation) {
        for (Map.Entry<String, String> entry : operation.getAttributes().entrySet()) {
            String old = target.set(entry.getKey(), entry.getValue());
            if (old != null) {
                log.debug(Kind.OPERATION_APPLIED, "Injected attribute " + entry.getKey() + "='" + entry.getValue()
                        + "' (overwrote '" + old + "') into <" + target.getTag() + ">");
            } else {
                log.debug(Kind.OPERATION_APPLIED, "Injected attribute " + entry.getKey() + "='" + entry.getValue()
                        + "' into <" + target.getTag() + ">");
            }
        }
    }

    private void replace(Element target, ReplaceOperation operation) {
        for (Map.Entry<String, String> entry : operation.getAttributes().entrySet()) {
            if (!target.has(entry.getKey())) {
                log.warn(Kind.ATTRIBUTE_MISSING, "Cannot replace non-existent attribute '" + entry.getKey()
                        + "' in <" + target.getTag() + ">. Use inject_attr(s) to add new attributes.")
                        .withTag(target.getTag());
                continue;
            }
            String old = target.set(entry.getKey(), entry.getValue());
            log.debug(Kind.OPERATION_APPLIED, "Replaced attribute " + entry.getKey() + "='" + old
                    + "' with '" + entry.getValue() + "' in <" + target.getTag() + ">");
        }
    }

    private void conditionalReplace(Element target, ConditionalReplaceOperation operation) {
        for (Map.Entry<String, String> condition : operation.getConditions().entrySet()) {
            if (!condition.getValue().equals(target.get(condition.getKey()))) {
                log.debug(Kind.OPERATION_SKIPPED, "Conditional replacement conditions not met for " + target.describe());
                return;
            }
        }

        List<String> changes = new ArrayList<>();
        for (String key : operation.getConditions().keySet()) {
            String old = target.removeAttribute(key);
            if (old != null) {
                changes.add("removed " + key + "='" + old + "'");
            }
        }
        for (Map.Entry<String, String> replacement : operation.getReplacements().entrySet()) {
            String old = target.set(replacement.getKey(), replacement.getValue());
            changes.add(old != null
                    ? "set " + replacement.getKey() + "='" + replacement.getValue() + "' (overwrote '" + old + "')"
                    : "set " + replacement.getKey() + "='" + replacement.getValue() + "'");
        }
        log.debug(Kind.OPERATION_APPLIED, "Conditional replacement applied to <" + target.getTag() + ">: "
                + String.join(", ", changes));
    }

    private void injectChildren(Element target, InjectChildrenOperation operation) {
        List<Element> children = operation.getTemplate().getChildren();
        log.info(Kind.OPERATION_APPLIED, "Injecting " + children.size() + " child element(s) into " + target.describe())
                .withTag(target.getTag());
        for (Element child : children) {
            Element copy = target.append(OperationParser.withoutOperations(child));
            log.debug(Kind.OPERATION_APPLIED, "  -> Injected " + copy.describe() + " into matching <" + target.getTag() + ">");
        }
    }
}
