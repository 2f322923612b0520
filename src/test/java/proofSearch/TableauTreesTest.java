package proofSearch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import modal.ModalLogic;
import org.junit.jupiter.api.Test;
import tableau.NodeStatus;
import tableau.TableauProver;

final class TableauTreesTest {

    @Test
    void openBranchesDropClosedSubtrees() {
        var tableau = new TableauProver(ModalLogic.K).prove("R", List.of("P∨Q", "¬P")).tableau();

        var full = TableauTrees.toLabeledTree(tableau);
        assertEquals(3, ProofOptimizer.size(full));
        assertSame(tableau.getRoot(), full.getLabel());

        var open = TableauTrees.openBranches(tableau);
        assertEquals(2, ProofOptimizer.size(open));
        var survivor = open.getChildren().get(0).getLabel();
        assertEquals(NodeStatus.SATURATED, survivor.getStatus());
        assertTrue(survivor.getFormulas().contains("Q"));
    }

    @Test
    void describeIgnoresIdentity() {
        var tableau = new TableauProver(ModalLogic.K).prove("Q", List.of("◇P")).tableau();
        var child = tableau.getRoot().getChildren().get(0);
        assertEquals("w1 [P] SATURATED", TableauTrees.describe(child));
    }
}
