package proofSearch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import modal.ModalLogic;
import modal.ProverOptions;
import org.junit.jupiter.api.Test;
import proof.ModalProver;
import proof.ProofStatus;
import proof.ProofTree;
import proof.Prover;

final class ParallelProofSearchTest {

    private static final Prover FAILING = new Prover() {
        @Override
        public ProofTree prove(String goal, List<String> assumptions) {
            throw new IllegalStateException("broken prover");
        }

        @Override
        public String getName() {
            return "broken";
        }
    };

    private static final Prover SLOW = new Prover() {
        @Override
        public ProofTree prove(String goal, List<String> assumptions) {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ProofTree(goal, assumptions, null, ProofStatus.UNKNOWN, List.of(), Map.of());
        }

        @Override
        public String getName() {
            return "slow";
        }
    };

    @Test
    void firstProvedSpaceWinsDespiteFailingSpaces() {
        var k = new ModalProver(ModalLogic.K, ProverOptions.defaults());
        var t = new ModalProver(ModalLogic.T, ProverOptions.defaults());
        var spaces = List.of(
                new SearchSpace(k, "P", List.of("□P")),
                new SearchSpace(FAILING, "P", List.of("□P")),
                new SearchSpace(t, "P", List.of("□P")));
        try (var search = new ParallelProofSearch(2)) {
            var outcome = search.race(spaces).orElseThrow();
            assertEquals("T", outcome.space().prover().getName());
            assertEquals(ProofStatus.SUCCESS, outcome.proof().status());
        }
    }

    @Test
    void emptyWhenNothingIsProved() {
        var k = new ModalProver(ModalLogic.K, ProverOptions.defaults());
        var spaces = List.of(new SearchSpace(k, "P", List.of()), new SearchSpace(FAILING, "Q", List.of()));
        try (var search = new ParallelProofSearch(2, new Heuristics.SubmissionOrder())) {
            assertTrue(search.race(spaces).isEmpty());
        }
    }

    @Test
    void timeoutAbandonsSlowSpaces() {
        var spaces = List.of(new SearchSpace(SLOW, "P", List.of()));
        try (var search = new ParallelProofSearch(1)) {
            var outcome = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> search.race(spaces, Duration.ofMillis(100)));
            assertTrue(outcome.isEmpty());
        }
    }

    @Test
    void poolSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelProofSearch(0));
    }
}
