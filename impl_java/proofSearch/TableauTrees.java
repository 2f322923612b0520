package proofSearch;

import tableau.NodeStatus;
import tableau.Tableau;
import tableau.TableauNode;

/**
 * Views of a finished tableau as a {@link LabeledNode} tree.
 */
public final class TableauTrees {

    private TableauTrees() {
    }

    public static LabeledNode<TableauNode> toLabeledTree(Tableau tableau) {
        return copy(tableau.getRoot());
    }

    /**
     * The tableau with every closed subtree removed, leaving the branches that stayed open.
     */
    public static LabeledNode<TableauNode> openBranches(Tableau tableau) {
        var tree = toLabeledTree(tableau);
        ProofOptimizer.prune(tree, node -> isClosed(node.getLabel()));
        return tree;
    }

    /**
     * Label key comparing nodes by world and formulas, ignoring identity.
     */
    public static String describe(TableauNode node) {
        return "w" + node.getWorld() + " " + node.getFormulas() + " " + node.getStatus();
    }

    private static boolean isClosed(TableauNode node) {
        if (node.getStatus() == NodeStatus.CLOSED) return true;
        if (node.getChildren().isEmpty()) return false;
        return node.getChildren().stream().allMatch(TableauTrees::isClosed);
    }

    private static LabeledNode<TableauNode> copy(TableauNode node) {
        var labeled = new LabeledNode<>(node);
        for (var child : node.getChildren()) {
            labeled.addChild(copy(child));
        }
        return labeled;
    }
}
