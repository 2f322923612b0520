package proofSearch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Post-hoc clean up of proof trees. None of these operations feed back into the provers.
 */
public final class ProofOptimizer {

    private ProofOptimizer() {
    }

    /**
     * Remove every proper subtree whose root matches. The root of the tree itself is kept.
     *
     * @return number of subtrees removed
     */
    public static <L> int prune(LabeledNode<L> root, Predicate<? super LabeledNode<L>> shouldPrune) {
        int removed = 0;
        for (var child : new ArrayList<>(root.getChildren())) {
            if (shouldPrune.test(child)) {
                root.removeChild(child);
                removed++;
            } else {
                removed += prune(child, shouldPrune);
            }
        }
        return removed;
    }

    /**
     * Drop children that repeat an earlier sibling's whole subtree, comparing labels through
     * {@code key}.
     *
     * @return number of subtrees removed
     */
    public static <L> int removeRedundant(LabeledNode<L> root, Function<? super L, ?> key) {
        int removed = 0;
        Set<String> seen = new HashSet<>();
        for (var child : new ArrayList<>(root.getChildren())) {
            if (!seen.add(signature(child, key))) {
                root.removeChild(child);
                removed++;
            } else {
                removed += removeRedundant(child, key);
            }
        }
        return removed;
    }

    public static <L> int size(LabeledNode<L> root) {
        int size = 1;
        for (var child : root.getChildren()) {
            size += size(child);
        }
        return size;
    }

    public static <L> int depth(LabeledNode<L> root) {
        int deepest = 0;
        for (var child : root.getChildren()) {
            deepest = Math.max(deepest, depth(child));
        }
        return deepest + 1;
    }

    public static <L> List<L> leaves(LabeledNode<L> root) {
        List<L> out = new ArrayList<>();
        collectLeaves(root, out);
        return out;
    }

    private static <L> void collectLeaves(LabeledNode<L> node, List<L> out) {
        if (node.isLeaf()) {
            out.add(node.getLabel());
            return;
        }
        for (var child : node.getChildren()) {
            collectLeaves(child, out);
        }
    }

    private static <L> String signature(LabeledNode<L> node, Function<? super L, ?> key) {
        StringBuilder sb = new StringBuilder(String.valueOf(key.apply(node.getLabel())));
        if (!node.isLeaf()) {
            sb.append('(');
            for (var child : node.getChildren()) {
                sb.append(signature(child, key)).append(';');
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
