package proof;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import modal.ProverOptions;
import resolution.ResolutionProver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolution refutation reported through {@link ProofTree}. Each call uses a fresh
 * {@link ResolutionProver}, so instances can be shared between threads.
 */
public class PropositionalProver implements Prover {
    private static final Logger LOG = LoggerFactory.getLogger(PropositionalProver.class);

    public static final String NAME = "PROP";

    private final ProverOptions options;

    public PropositionalProver(ProverOptions options) {
        this.options = options;
    }

    @Override
    public ProofTree prove(String goal, List<String> assumptions) {
        List<String> given = assumptions == null ? List.of() : List.copyOf(assumptions);
        long start = System.nanoTime();
        try {
            var result = new ResolutionProver(options).prove(goal, given);
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("elapsedMs", Long.toString((System.nanoTime() - start) / 1_000_000));
            var status = result.success() ? ProofStatus.SUCCESS : ProofStatus.FAILURE;
            LOG.info("Resolution proof of '{}': {}", goal, status);
            return new ProofTree(goal, given, null, status, result.proofSteps(), metadata);
        } catch (RuntimeException e) {
            LOG.error("Resolution prover failed on '{}'", goal, e);
            return new ProofTree(goal, given, null, ProofStatus.ERROR, List.of(),
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @Override
    public String getName() {
        return NAME;
    }
}
