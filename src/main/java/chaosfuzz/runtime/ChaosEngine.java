package chaosfuzz.runtime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.ExecutionOutcome;
import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.model.Finding;
import chaosfuzz.model.FindingCategory;
import chaosfuzz.model.FindingSeverity;
import chaosfuzz.model.ResourceProfile;
import chaosfuzz.model.TestCase;
import chaosfuzz.model.TestMetrics;
import chaosfuzz.model.TestResult;
import chaosfuzz.runtime.monitoring.GlobalStats;
import chaosfuzz.security.MonitorIntegrityException;
import chaosfuzz.security.SecurityMonitor;

/**
 * Dispatches test cases onto a fixed worker pool, chunk by chunk.
 *
 * <p>Before each chunk the circuit breaker is consulted; once it is open the
 * remaining tests are recorded as {@link ExecutionStatus#SKIPPED_CIRCUIT_OPEN}
 * and never run. Tests already running are allowed to finish.
 *
 * <p>Each test is mutated with its own {@link Random} derived from the session
 * seed and its queue index, so mutations do not depend on thread timing.
 */
public final class ChaosEngine implements AutoCloseable {
    private static final Logger LOGGER = LoggingConfig.getLogger(ChaosEngine.class);
    private static final long SEED_MIX = 0x9E3779B97F4A7C15L;

    private final ChaosConfig config;
    private final ResourcePool resourcePool;
    private final MutationAttemptEngine mutationEngine;
    private final Executor executor;
    private final SecurityMonitor monitor;
    private final GlobalStats globalStats;
    private final long sessionSeed;
    private final ExecutorService workers;
    private final AtomicInteger inFlight = new AtomicInteger();

    public ChaosEngine(ChaosConfig config,
                       ResourcePool resourcePool,
                       MutationAttemptEngine mutationEngine,
                       Executor executor,
                       SecurityMonitor monitor,
                       GlobalStats globalStats,
                       long sessionSeed) {
        this.config = Objects.requireNonNull(config, "config");
        this.resourcePool = Objects.requireNonNull(resourcePool, "resourcePool");
        this.mutationEngine = Objects.requireNonNull(mutationEngine, "mutationEngine");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.globalStats = Objects.requireNonNull(globalStats, "globalStats");
        this.sessionSeed = sessionSeed;
        this.workers = Executors.newFixedThreadPool(config.maxConcurrent(),
                workerThreadFactory(config.workerStackSize()));
    }

    /**
     * Runs every test case in {@code queue} and returns one result per case.
     *
     * @throws InterruptedException if the calling thread is interrupted while
     *         waiting for a chunk; tests of that chunk keep running
     */
    public RunSummary executeTests(List<TestCase> queue) throws InterruptedException {
        Objects.requireNonNull(queue, "queue");
        int total = queue.size();
        int chunkSize = config.chunkSize();
        TestResult[] slots = new TestResult[total];
        String haltReason = null;

        LOGGER.info(String.format("Executing %d test(s) in chunks of %d on %d worker(s)",
                total, chunkSize, config.maxConcurrent()));

        for (int start = 0; start < total; start += chunkSize) {
            if (monitor.isCircuitOpen()) {
                haltReason = monitor.tripReason().orElse("Circuit breaker open");
                LOGGER.warning(String.format("Circuit breaker open; skipping %d remaining test(s): %s",
                        total - start, haltReason));
                for (int i = start; i < total; i++) {
                    slots[i] = TestResult.skipped(queue.get(i), ExecutionStatus.SKIPPED_CIRCUIT_OPEN);
                    globalStats.recordResult(slots[i]);
                }
                break;
            }

            int end = Math.min(start + chunkSize, total);
            List<CompletableFuture<Void>> futures = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                final int index = i;
                final TestCase testCase = queue.get(i);
                globalStats.recordTestDispatched();
                futures.add(CompletableFuture.runAsync(
                        () -> slots[index] = executeOne(testCase, index), workers));
            }
            awaitChunk(futures);

            if (config.evaluateBetweenChunks()) {
                evaluateMonitor();
            }
        }

        boolean tripped = haltReason != null || monitor.isCircuitOpen();
        RunSummary summary = new RunSummary(Arrays.asList(slots), tripped, haltReason,
                monitor.circuitState(), globalStats.getPeakInFlight());
        LOGGER.info(String.format("Run finished: %s%s", summary.countsByStatus(),
                tripped ? " (circuit breaker tripped)" : ""));
        return summary;
    }

    TestResult executeOne(TestCase parent, int index) {
        Random random = new Random(sessionSeed ^ (index * SEED_MIX));
        TestCase testCase;
        try {
            testCase = mutationEngine.mutate(parent, config.mutationConfig(), random);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, String.format("Mutation of %s failed; running it unmodified", parent.getName()), e);
            testCase = parent;
        }

        ResourceProfile profile = testCase.getResourceProfile();
        try {
            resourcePool.acquire(profile);
        } catch (InsufficientCapacityException e) {
            LOGGER.fine(String.format("Skipping %s: %s", testCase.getName(), e.getMessage()));
            TestResult skipped = TestResult.skipped(testCase, ExecutionStatus.INSUFFICIENT_CAPACITY);
            globalStats.recordResult(skipped);
            return skipped;
        }

        TestResult result;
        globalStats.recordInFlight(inFlight.incrementAndGet());
        try {
            result = executor.run(testCase, config.computeBudget(), config.timeout());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, String.format("Executor failed on %s", testCase.getName()), e);
            result = executorFailure(testCase, e);
        } finally {
            inFlight.decrementAndGet();
            resourcePool.release(profile);
        }

        globalStats.recordResult(result);
        monitor.report(result);
        return result;
    }

    private void awaitChunk(List<CompletableFuture<Void>> futures) throws InterruptedException {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (ExecutionException e) {
            // executeOne handles its own failures; anything here is a bug.
            throw new IllegalStateException("Worker failed outside test execution", e.getCause());
        }
    }

    private void evaluateMonitor() throws InterruptedException {
        try {
            monitor.evaluateNow();
        } catch (MonitorIntegrityException e) {
            LOGGER.log(Level.SEVERE, "Monitor integrity failure between chunks", e);
        }
    }

    private TestResult executorFailure(TestCase testCase, RuntimeException e) {
        Finding finding = Finding.of(FindingCategory.LOGIC_ERROR, FindingSeverity.MEDIUM,
                "Execution error: " + e, Instant.now(), testCase.getName());
        return new TestResult(testCase.getName(), testCase.getKind(), ExecutionStatus.EXECUTION_FAILED,
                ExecutionOutcome.CRASH, List.of(finding), TestMetrics.NONE);
    }

    public int inFlight() {
        return inFlight.get();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warning("Worker pool did not terminate in time; forcing shutdown.");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreadFactory(long stackSize) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(null, r, "chaos-worker-" + counter.incrementAndGet(), stackSize);
            t.setDaemon(true);
            return t;
        };
    }
}
