package proofSearch;

import proof.ProofTree;

public record SearchOutcome(SearchSpace space, ProofTree proof) {
}
