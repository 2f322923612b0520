package resolution;

import java.util.List;
import proof.ProofStep;

/**
 * @param success true iff the empty clause was derived
 */
public record ResolutionResult(boolean success, List<ProofStep> proofSteps) {

    public ResolutionResult {
        proofSteps = List.copyOf(proofSteps);
    }
}
