package proofSearch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Races independent search spaces on a fixed pool. The first space to report a successful
 * proof wins and the rest are cancelled. A space that throws drops out of the race.
 */
public class ParallelProofSearch implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ParallelProofSearch.class);

    private final ExecutorService executor;
    private final int poolSize;
    private final Heuristics.Heuristic heuristic;

    public ParallelProofSearch(int poolSize) {
        this(poolSize, new Heuristics.SimplestFirst());
    }

    public ParallelProofSearch(int poolSize, Heuristics.Heuristic heuristic) {
        if (poolSize <= 0) throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
        this.poolSize = poolSize;
        this.heuristic = heuristic;
        this.executor = Executors.newFixedThreadPool(poolSize);
    }

    public Optional<SearchOutcome> race(List<SearchSpace> spaces) {
        return race(spaces, Duration.ZERO);
    }

    /**
     * @param timeout overall budget, {@link Duration#ZERO} to wait for every space
     * @return the first successful outcome, or empty if none succeeded in time
     */
    public Optional<SearchOutcome> race(List<SearchSpace> spaces, Duration timeout) {
        List<SearchSpace> ordered = spaces.stream().sorted(heuristic).toList();
        CompletionService<SearchOutcome> completion = new ExecutorCompletionService<>(executor);
        List<Future<SearchOutcome>> futures = new ArrayList<>(ordered.size());
        for (final var space : ordered) {
            futures.add(completion.submit(() -> new SearchOutcome(space, space.run())));
        }
        LOG.info("Racing {} search spaces on {} workers ({})", ordered.size(), poolSize, heuristic.getName());

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (int finished = 0; finished < futures.size(); finished++) {
                Future<SearchOutcome> next;
                if (timeout.isZero()) {
                    next = completion.take();
                } else {
                    next = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                    if (next == null) {
                        LOG.info("Search timed out after {} ms", timeout.toMillis());
                        return Optional.empty();
                    }
                }
                try {
                    var outcome = next.get();
                    if (outcome.proof().isProved()) {
                        LOG.info("{} proved the goal", outcome.space());
                        return Optional.of(outcome);
                    }
                    LOG.debug("{} finished with {}", outcome.space(), outcome.proof().status());
                } catch (ExecutionException e) {
                    LOG.warn("A search space failed and was dropped from the race", e.getCause());
                }
            }
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            for (var future : futures) {
                future.cancel(true);
            }
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
