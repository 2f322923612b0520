package proof.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import modal.ModalLogic;
import modal.ProverOptions;
import org.junit.jupiter.api.Test;
import proof.ModalProver;
import proof.ProofStatus;
import proof.ProofTree;

final class InMemoryProofStoreTest {

    private static ProofTree proof(ProofStatus status) {
        return new ProofTree("P", List.of(), ModalLogic.K, status, List.of(), Map.of());
    }

    @Test
    void firstWriterWins() {
        var store = new InMemoryProofStore();
        var first = proof(ProofStatus.SUCCESS);
        assertTrue(store.putIfAbsent("key", first));
        assertFalse(store.putIfAbsent("key", proof(ProofStatus.FAILURE)));
        assertSame(first, store.get("key").orElseThrow());
        assertEquals(1, store.size());
        assertTrue(store.get("other").isEmpty());
    }

    @Test
    void keysIgnoreAssumptionOrderButNotProcedure() {
        assertEquals(ProofKeys.of("G", List.of("A", "B"), "K"), ProofKeys.of("G", List.of("B", "A"), "K"));
        assertNotEquals(ProofKeys.of("G", List.of("A"), "K"), ProofKeys.of("G", List.of("A"), "S4"));
        assertEquals(64, ProofKeys.of("G", List.of(), "K").length());
    }

    @Test
    void proverReusesStoredProof() {
        var store = new InMemoryProofStore();
        var prover = new ModalProver(ModalLogic.K, ProverOptions.defaults()).withStore(store);
        var first = prover.prove("P", List.of("P"));
        var second = prover.prove("P", List.of("P"));
        assertSame(first, second);
        assertEquals(1, store.size());
    }

    @Test
    void shallowFailureIsNotReusedByADeeperProver() {
        var store = new InMemoryProofStore();
        var shallow = new ModalProver(ModalLogic.T, ProverOptions.defaults().withMaxDepth(1)).withStore(store);
        var deep = new ModalProver(ModalLogic.T, ProverOptions.defaults()).withStore(store);

        assertEquals(ProofStatus.FAILURE, shallow.prove("P", List.of("□P")).status());
        assertEquals(ProofStatus.SUCCESS, deep.prove("P", List.of("□P")).status());
        assertEquals(2, store.size());
    }

    @Test
    void timeoutsAreNotStored() {
        var store = new InMemoryProofStore();
        var prover = new ModalProver(ModalLogic.K, ProverOptions.defaults()).withStore(store);
        Thread.currentThread().interrupt();
        try {
            assertEquals(ProofStatus.TIMEOUT, prover.prove("P", List.of("P")).status());
        } finally {
            Thread.interrupted();
        }
        assertEquals(0, store.size());
    }
}
