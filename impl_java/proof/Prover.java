package proof;

import java.util.List;

public interface Prover {

    ProofTree prove(String goal, List<String> assumptions);

    default ProofTree prove(String goal) {
        return prove(goal, List.of());
    }

    /**
     * @return the tag identifying the proof procedure, used in cache keys and logs
     */
    String getName();
}
