package proof.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

public final class ProofKeys {

    private ProofKeys() {
    }

    /**
     * Content address of a proof request. Assumption order is irrelevant.
     */
    public static String of(String goal, List<String> assumptions, String procedure) {
        String canonical = procedure + "\n" + goal + "\n" + String.join("\n", assumptions.stream().sorted().toList());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
