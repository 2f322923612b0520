package proof.store;

import java.util.Optional;
import proof.ProofTree;

/**
 * Key to proof persistence. Implementations decide where the proofs live; the provers only
 * read through and write back.
 */
public interface ProofStore {

    Optional<ProofTree> get(String key);

    /**
     * Store the proof unless the key is already taken.
     *
     * @return true if this call stored the proof, false if an earlier one won
     */
    boolean putIfAbsent(String key, ProofTree proof);

    int size();
}
