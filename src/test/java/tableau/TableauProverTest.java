package tableau;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import modal.ModalLogic;
import modal.ProverOptions;
import proof.ProofStep;
import org.junit.jupiter.api.Test;

final class TableauProverTest {

    private static List<String> ruleNames(TableauResult result) {
        return result.tableau().getProofSteps().stream().map(ProofStep::ruleName).toList();
    }

    @Test
    void atomIsNotValidInK() {
        var result = new TableauProver(ModalLogic.K).prove("P");
        assertFalse(result.success());
        var root = result.tableau().getRoot();
        assertEquals(Set.of("¬P"), root.getFormulas());
        assertEquals(NodeStatus.SATURATED, root.getStatus());
    }

    @Test
    void assumptionProvesItself() {
        var result = new TableauProver(ModalLogic.K).prove("P", List.of("P"));
        assertTrue(result.success());
        assertEquals(0, result.tableau().getWorldCounter());
        assertEquals(List.of("Close"), ruleNames(result));
    }

    @Test
    void necessityImpliesTruthInT() {
        var result = new TableauProver(ModalLogic.T).prove("P", List.of("□P"));
        assertTrue(result.success());
        assertEquals(List.of("T", "Close"), ruleNames(result));
    }

    @Test
    void necessityDoesNotImplyTruthInKOrD() {
        assertFalse(new TableauProver(ModalLogic.K).prove("P", List.of("□P")).success());
        var d = new TableauProver(ModalLogic.D).prove("P", List.of("□P"));
        assertFalse(d.success());
        assertEquals(1, d.tableau().getWorldCounter());
        assertEquals(List.of("BoxElim"), ruleNames(d));
    }

    @Test
    void disjunctionSplitsIntoTwoChildrenAtTheSameWorld() {
        var result = new TableauProver(ModalLogic.K).prove("R", List.of("P∨Q"));
        assertFalse(result.success());
        var children = result.tableau().getRoot().getChildren();
        assertEquals(2, children.size());
        assertEquals(Set.of("¬R", "P"), children.get(0).getFormulas());
        assertEquals(Set.of("¬R", "Q"), children.get(1).getFormulas());
        for (var child : children) {
            assertEquals(0, child.getWorld());
            assertFalse(child.getFormulas().contains("P∨Q"));
        }
    }

    @Test
    void closesOnlyWhenBothBranchesClose() {
        var prover = new TableauProver(ModalLogic.K);
        var oneOpen = prover.prove("R", List.of("P∨Q", "¬P"));
        assertFalse(oneOpen.success());
        var children = oneOpen.tableau().getRoot().getChildren();
        assertEquals(NodeStatus.CLOSED, children.get(0).getStatus());
        assertEquals(NodeStatus.SATURATED, children.get(1).getStatus());

        assertTrue(prover.prove("R", List.of("P∨Q", "¬P", "¬Q")).success());
    }

    @Test
    void conjunctionExpandsInPlaceAndCanClose() {
        var result = new TableauProver(ModalLogic.K).prove("Q", List.of("P∧¬P"));
        assertTrue(result.success());
        var root = result.tableau().getRoot();
        assertTrue(root.getChildren().isEmpty());
        assertTrue(root.getFormulas().containsAll(List.of("P", "¬P")));
        assertEquals(List.of("AndElim", "Close"), ruleNames(result));
    }

    @Test
    void doubleNegationIsStripped() {
        var result = new TableauProver(ModalLogic.K).prove("Z", List.of("¬¬R∧S"));
        assertFalse(result.success());
        assertTrue(result.tableau().getRoot().getFormulas().contains("R"));
        assertEquals(List.of("AndElim", "NotElim"), ruleNames(result));
    }

    @Test
    void possibilityOpensANewWorld() {
        var result = new TableauProver(ModalLogic.K).prove("Q", List.of("◇P"));
        var root = result.tableau().getRoot();
        assertEquals(1, result.tableau().getWorldCounter());
        assertEquals(Set.of(1), root.getAccessibleWorlds());
        var child = root.getChildren().get(0);
        assertEquals(1, child.getWorld());
        assertEquals(Set.of("P"), child.getFormulas());
    }

    @Test
    void necessityAddsClosureAxiomBeforeOpeningAWorldInT() {
        var result = new TableauProver(ModalLogic.T).prove("Q", List.of("□P"));
        assertFalse(result.success());
        var root = result.tableau().getRoot();
        assertTrue(root.getFormulas().contains("P"));
        assertEquals(1, result.tableau().getWorldCounter());
        assertEquals(List.of("T", "BoxElim"), ruleNames(result));
    }

    @Test
    void depthBoundStopsTheS4TransitivityChain() {
        var prover = new TableauProver(ModalLogic.S4, ProverOptions.defaults().withMaxDepth(5));
        var result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> prover.prove("Q", List.of("□P")));
        assertFalse(result.success());
        assertEquals(List.of("T", "4", "4", "4", "4"), ruleNames(result));
        assertEquals(NodeStatus.OPEN, result.tableau().getRoot().getStatus());
        assertTrue(result.tableau().getRoot().getFormulas().contains("□□□□□P"));
    }

    @Test
    void everyProveCallBuildsAFreshTableau() {
        var prover = new TableauProver(ModalLogic.K);
        var first = prover.prove("Q", List.of("◇P"));
        var second = prover.prove("Q", List.of("◇P"));
        assertEquals(1, first.tableau().getWorldCounter());
        assertEquals(1, second.tableau().getWorldCounter());
    }

    @Test
    void nullAssumptionsMeanNone() {
        var result = new TableauProver(ModalLogic.K).prove("P", null);
        assertEquals(Set.of("¬P"), result.tableau().getRoot().getFormulas());
    }

    @Test
    void vetoingHookLeavesNodeOpen() {
        var prover = new TableauProver(ModalLogic.K).withHook((tableau, node, depth) -> false);
        var result = prover.prove("P", List.of("P"));
        assertFalse(result.success());
        assertEquals(NodeStatus.OPEN, result.tableau().getRoot().getStatus());
        assertTrue(result.tableau().getProofSteps().isEmpty());
    }

    @Test
    void interruptedThreadStopsExpansion() {
        Thread.currentThread().interrupt();
        try {
            var result = new TableauProver(ModalLogic.K).prove("P", List.of("P"));
            assertFalse(result.success());
            assertTrue(result.tableau().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void negateMirrorsFormulaNegation() {
        assertEquals("¬P", TableauProver.negate("P"));
        assertEquals("P", TableauProver.negate("¬P"));
    }
}
