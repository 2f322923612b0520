package proofSearch;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import proof.ProofTree;
import proof.Prover;

/**
 * One independent proof attempt: a prover together with the goal and assumptions to give it.
 */
public record SearchSpace(long id, Prover prover, String goal, List<String> assumptions) {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    public SearchSpace {
        assumptions = List.copyOf(assumptions);
    }

    public SearchSpace(Prover prover, String goal, List<String> assumptions) {
        this(NEXT_ID.getAndIncrement(), prover, goal, assumptions);
    }

    public ProofTree run() {
        return prover.prove(goal, assumptions);
    }

    @Override
    public String toString() {
        return "SearchSpace[%d, %s, %s | %s]".formatted(id, prover.getName(), goal, String.join(", ", assumptions));
    }
}
