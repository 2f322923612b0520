package modal;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds shared by the provers.
 *
 * @param maxDepth plies of tableau expansion before a branch is left open
 * @param maxRounds saturation rounds of the resolution prover
 * @param timeout wall-clock budget for one proof, {@link Duration#ZERO} for none
 */
public record ProverOptions(int maxDepth, int maxRounds, Duration timeout) {
    private static final Logger LOG = LoggerFactory.getLogger(ProverOptions.class);

    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_ROUNDS = 1000;

    private static final String MAX_DEPTH_PROPERTY = "prover.maxDepth";
    private static final String MAX_DEPTH_ENV = "PROVER_MAX_DEPTH";
    private static final String MAX_ROUNDS_PROPERTY = "prover.maxRounds";
    private static final String MAX_ROUNDS_ENV = "PROVER_MAX_ROUNDS";
    private static final String TIMEOUT_PROPERTY = "prover.timeoutMs";
    private static final String TIMEOUT_ENV = "PROVER_TIMEOUT_MS";
    // Deadlines are computed in nanoseconds.
    private static final long MAX_TIMEOUT_MS = Long.MAX_VALUE / 1_000_000;

    public ProverOptions {
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        if (maxRounds <= 0) throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
        if (timeout == null || timeout.isNegative()) timeout = Duration.ZERO;
    }

    public static ProverOptions defaults() {
        return new ProverOptions(DEFAULT_MAX_DEPTH, DEFAULT_MAX_ROUNDS, Duration.ZERO);
    }

    /**
     * Read the bounds from system properties ({@code prover.maxDepth}, {@code prover.maxRounds},
     * {@code prover.timeoutMs}), then the matching environment variables, then the defaults.
     */
    public static ProverOptions fromSystemProperties() {
        int depth = (int) lookup(MAX_DEPTH_PROPERTY, MAX_DEPTH_ENV, DEFAULT_MAX_DEPTH, Integer.MAX_VALUE);
        int rounds = (int) lookup(MAX_ROUNDS_PROPERTY, MAX_ROUNDS_ENV, DEFAULT_MAX_ROUNDS, Integer.MAX_VALUE);
        long timeoutMs = lookup(TIMEOUT_PROPERTY, TIMEOUT_ENV, 0, MAX_TIMEOUT_MS);
        return new ProverOptions(depth > 0 ? depth : DEFAULT_MAX_DEPTH,
                rounds > 0 ? rounds : DEFAULT_MAX_ROUNDS,
                Duration.ofMillis(Math.max(0, timeoutMs)));
    }

    public ProverOptions withMaxDepth(int maxDepth) {
        return new ProverOptions(maxDepth, maxRounds, timeout);
    }

    public ProverOptions withMaxRounds(int maxRounds) {
        return new ProverOptions(maxDepth, maxRounds, timeout);
    }

    public ProverOptions withTimeout(Duration timeout) {
        return new ProverOptions(maxDepth, maxRounds, timeout);
    }

    public boolean hasTimeout() {
        return !timeout.isZero();
    }

    private static long lookup(String property, String env, long fallback, long max) {
        String value = System.getProperty(property);
        if (value == null) value = System.getenv(env);
        if (value == null) return fallback;
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric value '{}' for {}, using {}", value, property, fallback);
            return fallback;
        }
        if (parsed < Integer.MIN_VALUE || parsed > max) {
            LOG.warn("Ignoring out-of-range value '{}' for {}, using {}", value, property, fallback);
            return fallback;
        }
        return parsed;
    }
}
