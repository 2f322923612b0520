package proofSearch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import modal.ModalLogic;
import org.junit.jupiter.api.Test;
import tableau.Tableau;
import tableau.TableauNode;
import tableau.TableauProver;

final class LoopCheckTest {

    @Test
    void blocksNodeRepeatingAnAncestor() {
        var root = new TableauNode(Set.of("A", "B"), 0);
        var tableau = new Tableau(root, ModalLogic.K);
        var loopCheck = new LoopCheck();

        assertTrue(loopCheck.shouldExpand(tableau, root, 10));
        assertFalse(loopCheck.shouldExpand(tableau, root.branch(0, "B", "X"), 10));
        assertTrue(loopCheck.shouldExpand(tableau, root.branch(0, "C", "B"), 10));
        assertEquals(1, loopCheck.getBlockedCount());
    }

    @Test
    void doesNotChangeProvableResults() {
        var loopCheck = new LoopCheck();
        var prover = new TableauProver(ModalLogic.K).withHook(loopCheck);
        assertTrue(prover.prove("P", List.of("P")).success());
        assertTrue(prover.prove("R", List.of("P∨Q", "¬P", "¬Q")).success());
        assertEquals(0, loopCheck.getBlockedCount());
    }
}
