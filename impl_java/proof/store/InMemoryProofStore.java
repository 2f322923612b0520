package proof.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import proof.ProofTree;

public class InMemoryProofStore implements ProofStore {
    private final ConcurrentMap<String, ProofTree> proofs = new ConcurrentHashMap<>();

    @Override
    public Optional<ProofTree> get(String key) {
        return Optional.ofNullable(proofs.get(key));
    }

    @Override
    public boolean putIfAbsent(String key, ProofTree proof) {
        return proofs.putIfAbsent(key, proof) == null;
    }

    @Override
    public int size() {
        return proofs.size();
    }
}
