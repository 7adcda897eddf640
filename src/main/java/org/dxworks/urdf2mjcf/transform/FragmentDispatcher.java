package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.ConversionLog;
import org.dxworks.urdf2mjcf.model.Element;
import org.dxworks.urdf2mjcf.model.MjcfDocument;
import org.dxworks.urdf2mjcf.model.TransformEvent.Kind;
import org.dxworks.urdf2mjcf.transform.PatternMatcher.MatchMode;
import org.dxworks.urdf2mjcf.transform.operation.InjectChildrenOperation;
import org.dxworks.urdf2mjcf.transform.operation.Operation;
import org.dxworks.urdf2mjcf.transform.operation.OperationKind;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks the annotation fragments extracted from the source document and folds
 * them into the target document. Each element is classified by {@link #plan(Element)}
 * and then handled by the matching branch; a missing match is reported and the
 * walk moves on.
 */
public class FragmentDispatcher {
    private final MjcfDocument document;
    private final ConversionLog log;
    private final PatternMatcher matcher;
    private final OperationParser parser;
    private final OperationApplier applier;
    private final Map<Element, DispatchStep> planned = new IdentityHashMap<>();
    private final Set<Element> skippedReported = Collections.newSetFromMap(new IdentityHashMap<>());

    public FragmentDispatcher(MjcfDocument document, ConversionLog log) {
        this.document = document;
        this.log = log;
        this.matcher = new PatternMatcher(log);
        this.parser = new OperationParser(log);
        this.applier = new OperationApplier(log);
    }

    public void dispatch(List<Element> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            log.info("No custom MJCF elements found to inject from URDF.");
            return;
        }
        log.info("-> Injecting " + fragments.size() + " custom MJCF element(s) from URDF: "
                + fragments.stream().map(Element::describe).collect(Collectors.joining(", ")));
        for (Element fragment : fragments) {
            process(fragment, null);
        }
    }

    /** Classifies an annotation element without touching the target document. */
    public DispatchStep plan(Element fragment) {
        List<Operation> operations = parser.parse(fragment);
        if (!operations.isEmpty()) {
            return DispatchStep.consumed(operations);
        }
        for (Element child : fragment.getChildren()) {
            if (parser.declaresOperations(child)) {
                return DispatchStep.recurse();
            }
        }
        return DispatchStep.fallback();
    }

    void process(Element fragment, Element parentContext) {
        DispatchStep step = stepFor(fragment);
        log.debug(Kind.INFO, "Processing " + fragment.describe() + " as " + step);
        switch (step.getKind()) {
            case CONSUMED -> consume(fragment, step.getOperations(), parentContext);
            case RECURSE -> injectIntoParents(fragment, parentContext);
            case FALLBACK -> injectPlain(fragment, parentContext);
        }
    }

    /** Plans each annotation element once, so its warnings are reported once however many parents it meets. */
    private DispatchStep stepFor(Element fragment) {
        DispatchStep step = planned.get(fragment);
        if (step == null) {
            step = plan(fragment);
            planned.put(fragment, step);
        }
        return step;
    }

    private void consume(Element fragment, List<Operation> operations, Element parentContext) {
        InjectChildrenOperation injectChildren = operations.stream()
                .filter(op -> op.getKind() == OperationKind.INJECT_CHILDREN)
                .map(InjectChildrenOperation.class::cast)
                .findFirst()
                .orElse(null);
        if (injectChildren != null) {
            injectChildren(fragment, injectChildren, operations, parentContext);
            return;
        }

        String tag = fragment.getTag();
        Map<String, String> matching = OperationParser.matchingAttributes(fragment);
        List<Element> targets = resolveTargets(tag, matching, parentContext);
        if (targets.isEmpty()) {
            boolean injects = operations.stream().anyMatch(op -> op.getKind() == OperationKind.INJECT);
            if (parentContext == null && matching.isEmpty() && injects) {
                Element placeholder = document.insertBeforeWorldbody(new Element(tag));
                log.info(Kind.ELEMENT_CREATED, "Created new <" + tag + "> tag in MJCF to apply custom operations.")
                        .withTag(tag);
                targets = List.of(placeholder);
            } else {
                log.warn(Kind.NO_MATCH, "No matching elements found for custom operations pattern "
                        + Element.describe(tag, matching) + " " + describeScope(parentContext)).withTag(tag);
            }
        }
        for (Element target : targets) {
            applier.applyAll(target, operations);
        }

        // nested declarations share the same parent context
        for (Element child : fragment.getChildren()) {
            process(child, parentContext);
        }
    }

    private void injectChildren(Element fragment, InjectChildrenOperation operation,
                                List<Operation> declared, Element parentContext) {
        if (declared.size() > 1) {
            log.warn(Kind.OPERATION_SKIPPED, "Ignoring other operations on " + fragment.describe()
                    + " because inject_children consumes the element").withTag(fragment.getTag());
        }
        for (Element child : fragment.getChildren()) {
            reportNestedOperations(child);
        }
        Element scope = parentContext != null ? parentContext : document.getRoot();
        List<Element> targets = matcher.find(scope, fragment.getTag(), operation.getMatchAttributes(), MatchMode.EXACT);
        if (targets.isEmpty()) {
            log.warn(Kind.NO_MATCH, "No matching <" + fragment.getTag() + "> elements found with attributes "
                    + operation.getMatchAttributes() + " " + describeScope(parentContext)).withTag(fragment.getTag());
            return;
        }
        for (Element target : targets) {
            applier.apply(target, operation);
        }
    }

    private void injectIntoParents(Element fragment, Element parentContext) {
        Map<String, String> matching = OperationParser.matchingAttributes(fragment);
        List<Element> parents = resolveTargets(fragment.getTag(), matching, parentContext);
        if (parents.isEmpty()) {
            log.warn(Kind.NO_MATCH, "No matching parent element found for " + Element.describe(fragment.getTag(), matching)
                    + " - cannot apply child operations").withTag(fragment.getTag());
            return;
        }
        for (Element parent : parents) {
            for (Element child : fragment.getChildren()) {
                if (stepFor(child).getKind() == DispatchStep.Kind.CONSUMED) {
                    process(child, parent);
                } else {
                    parent.append(plainCopy(child));
                    log.debug(Kind.OPERATION_APPLIED, "Injected regular child <" + child.getTag()
                            + "> into existing <" + parent.getTag() + ">.");
                }
            }
        }
    }

    private void injectPlain(Element fragment, Element parentContext) {
        String tag = fragment.getTag();
        Map<String, String> attributes = OperationParser.matchingAttributes(fragment);

        if (parentContext != null) {
            Element copy = new Element(tag, attributes);
            copy.setText(fragment.getText());
            copyChildren(fragment, copy);
            parentContext.append(copy);
            log.debug(Kind.OPERATION_APPLIED, "Injected " + copy.describe() + " into <" + parentContext.getTag() + ">.");
            return;
        }

        List<Element> matches = attributes.isEmpty()
                ? Collections.emptyList()
                : matcher.find(document.getRoot(), tag, attributes);
        if (!matches.isEmpty()) {
            for (Element target : matches) {
                log.info(Kind.OPERATION_APPLIED, "Injecting element " + Element.describe(tag, attributes)
                        + " into existing element: " + target.describe()).withTag(tag);
                copyAttributes(attributes, target);
                copyChildren(fragment, target);
            }
            return;
        }

        Element target = document.section(tag);
        if (target == null) {
            target = document.ensureBeforeWorldbody(tag);
            log.info(Kind.ELEMENT_CREATED, "Created new <" + tag + "> tag in MJCF.").withTag(tag);
        }
        copyAttributes(attributes, target);
        copyChildren(fragment, target);
    }

    /**
     * Global attribute-less patterns resolve to the top-level section of that tag;
     * everything else goes through the matcher within the scope.
     */
    private List<Element> resolveTargets(String tag, Map<String, String> matching, Element parentContext) {
        if (parentContext == null && matching.isEmpty()) {
            Element section = document.section(tag);
            return section == null ? Collections.emptyList() : List.of(section);
        }
        Element scope = parentContext != null ? parentContext : document.getRoot();
        return matcher.find(scope, tag, matching);
    }

    private void copyAttributes(Map<String, String> attributes, Element target) {
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            if (GlobPattern.hasWildcard(entry.getValue())) {
                continue; // match pattern, not a value
            }
            target.set(entry.getKey(), entry.getValue());
            log.debug(Kind.OPERATION_APPLIED, "Copied attribute " + entry.getKey() + "='" + entry.getValue()
                    + "' to <" + target.getTag() + ">");
        }
    }

    private void copyChildren(Element source, Element target) {
        for (Element child : source.getChildren()) {
            target.append(plainCopy(child));
            log.debug(Kind.OPERATION_APPLIED, "Injected <" + child.getTag() + "> into <" + target.getTag() + ">.");
        }
    }

    /** Copy of markup injected as-is; operation attributes never reach the document. */
    private Element plainCopy(Element source) {
        reportNestedOperations(source);
        return OperationParser.withoutOperations(source);
    }

    private void reportNestedOperations(Element element) {
        if (OperationParser.hasOperationAttributes(element)
                && stepFor(element).getKind() == DispatchStep.Kind.CONSUMED
                && skippedReported.add(element)) {
            log.warn(Kind.OPERATION_SKIPPED, "Ignoring operations on " + element.describe()
                    + " nested inside plain markup").withTag(element.getTag());
        }
        for (Element child : element.getChildren()) {
            reportNestedOperations(child);
        }
    }

    private static String describeScope(Element parentContext) {
        return parentContext != null ? "within " + parentContext.getTag() : "globally";
    }
}
