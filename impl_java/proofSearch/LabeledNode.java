package proofSearch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Minimal mutable tree used by the optimizer, independent of what the labels are.
 */
public class LabeledNode<L> {
    private final L label;
    private final List<LabeledNode<L>> children = new ArrayList<>();

    public LabeledNode(L label) {
        this.label = label;
    }

    public LabeledNode<L> addChild(LabeledNode<L> child) {
        children.add(child);
        return this;
    }

    boolean removeChild(LabeledNode<L> child) {
        return children.remove(child);
    }

    public L getLabel() {
        return label;
    }

    public List<LabeledNode<L>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        return String.valueOf(label);
    }
}
