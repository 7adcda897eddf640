package org.dxworks.urdf2mjcf.transform;

import org.dxworks.urdf2mjcf.model.Element;

import java.util.List;

/**
 * Unions annotation fragments that share a root tag. Two children are folded
 * together only when tag, attribute set and trimmed text are all identical;
 * everything else is kept side by side.
 */
public final class FragmentMerger {

    private FragmentMerger() {
        // utility class
    }

    public static Element merge(List<Element> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("At least one fragment is required to merge");
        }
        Element merged = fragments.get(0).deepCopy();
        for (int i = 1; i < fragments.size(); i++) {
            mergeChildren(merged, fragments.get(i));
        }
        return merged;
    }

    private static void mergeChildren(Element accumulator, Element incoming) {
        for (Element child : incoming.getChildren()) {
            Element equivalent = findEquivalent(accumulator, child);
            if (equivalent == null) {
                accumulator.append(child.deepCopy());
            } else if (equivalent.hasChildren() || child.hasChildren()) {
                mergeChildren(equivalent, child);
            }
            // equivalent leaves: nothing to add
        }
    }

    private static Element findEquivalent(Element accumulator, Element child) {
        for (Element existing : accumulator.getChildren()) {
            if (existing.isEquivalentTo(child)) {
                return existing;
            }
        }
        return null;
    }
}
