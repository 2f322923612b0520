package proof;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import modal.ModalLogic;
import modal.ProverOptions;
import proof.store.ProofKeys;
import proof.store.ProofStore;
import tableau.TableauProver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tableau prover for one modal logic, reporting through {@link ProofTree}. When a
 * {@link ProofStore} is attached, finished proofs are looked up before proving and stored after.
 */
public class ModalProver implements Prover {
    private static final Logger LOG = LoggerFactory.getLogger(ModalProver.class);

    private final TableauProver tableauProver;
    private final ProofStore store;

    public ModalProver(ModalLogic logic, ProverOptions options) {
        this(new TableauProver(logic, options), null);
    }

    public ModalProver(TableauProver tableauProver, ProofStore store) {
        this.tableauProver = tableauProver;
        this.store = store;
    }

    public ModalProver withStore(ProofStore store) {
        return new ModalProver(tableauProver, store);
    }

    @Override
    public ProofTree prove(String goal, List<String> assumptions) {
        List<String> given = assumptions == null ? List.of() : List.copyOf(assumptions);
        String key = ProofKeys.of(goal, given, storeProcedure());
        if (store != null) {
            var cached = store.get(key);
            if (cached.isPresent()) {
                LOG.debug("Reusing stored {} proof of '{}'", getName(), goal);
                return cached.get();
            }
        }

        ProofTree proof;
        long start = System.nanoTime();
        try {
            var result = tableauProver.prove(goal, given);
            var tableau = result.tableau();
            ProofStatus status;
            if (result.success()) {
                status = ProofStatus.SUCCESS;
            } else if (tableau.isInterrupted()) {
                status = ProofStatus.TIMEOUT;
            } else {
                status = ProofStatus.FAILURE;
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("worlds", Integer.toString(tableau.getWorldCounter()));
            metadata.put("nodes", Integer.toString(tableau.countNodes()));
            metadata.put("elapsedMs", Long.toString((System.nanoTime() - start) / 1_000_000));
            proof = new ProofTree(goal, given, getLogic(), status, tableau.getProofSteps(), metadata);
        } catch (RuntimeException e) {
            LOG.error("{} prover failed on '{}'", getName(), goal, e);
            proof = new ProofTree(goal, given, getLogic(), ProofStatus.ERROR, List.of(),
                    Map.of("error", String.valueOf(e.getMessage())));
        }
        LOG.info("{} proof of '{}': {}", getName(), goal, proof.status());

        if (store != null && (proof.status() == ProofStatus.SUCCESS || proof.status() == ProofStatus.FAILURE)
                && !store.putIfAbsent(key, proof)) {
            return store.get(key).orElse(proof);
        }
        return proof;
    }

    /**
     * Results depend on the depth bound, so provers with different bounds never share entries.
     */
    private String storeProcedure() {
        return getName() + "/depth=" + tableauProver.getOptions().maxDepth();
    }

    public ModalLogic getLogic() {
        return tableauProver.getLogic();
    }

    @Override
    public String getName() {
        return getLogic().name();
    }
}
