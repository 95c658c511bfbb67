package chaosfuzz.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import chaosfuzz.io.EventSink;
import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.Alert;
import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.model.Finding;
import chaosfuzz.model.TestResult;

/**
 * Periodic safety check over the results reported by the engine.
 *
 * <p>Each cycle passes the rate limiter, snapshots the signal counters and
 * evaluates the circuit breaker. Cycles run on a single "security-monitor"
 * thread and never overlap. Workers only call {@link #report(TestResult)} and
 * {@link #isCircuitOpen()}.
 *
 * <p>If the counters overflow the monitor fails closed: the breaker opens and a
 * critical alert is emitted.
 */
public final class SecurityMonitor implements AutoCloseable {
    private static final Logger LOGGER = LoggingConfig.getLogger(SecurityMonitor.class);

    public static final String SECURITY_VIOLATION_CATEGORY = "security_violation";
    public static final String ACCOUNT_VALIDATION_CATEGORY = "account_validation";

    private final SlidingWindowRateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final SecurityMetrics metrics = new SecurityMetrics();
    private final EventSink eventSink;
    private final Clock clock;
    private final Duration interval;
    private final ScheduledExecutorService ticker;
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong cyclesEvaluated = new AtomicLong();
    private final AtomicLong cyclesRateLimited = new AtomicLong();
    private volatile CycleReport lastCycle;

    public SecurityMonitor(SlidingWindowRateLimiter rateLimiter,
                           CircuitBreaker circuitBreaker,
                           Duration interval,
                           EventSink eventSink,
                           Clock clock) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Monitor interval must be positive.");
        }
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "security-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /** Starts the fixed-delay ticker. Calling it twice has no effect. */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long millis = interval.toMillis();
        ticker.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.info(String.format("Security monitor started (interval=%d ms, threshold=%d, limit=%d/%d s)",
                millis, circuitBreaker.threshold(), rateLimiter.maxOperations(), rateLimiter.window().toSeconds()));
    }

    /**
     * Feeds one finished test into the signal counters and forwards its
     * findings. Safe to call from any worker.
     */
    public void report(TestResult result) {
        try {
            ExecutionStatus status = result.status();
            if (status.invokedTarget()) {
                metrics.recordTransaction(status == ExecutionStatus.PASSED);
            }
            if (status == ExecutionStatus.CRASHED || status == ExecutionStatus.TIMEOUT) {
                if (result.kind() != null) {
                    result.kind().manipulationType()
                            .ifPresent(type -> metrics.recordManipulationAttempt(type, 1L));
                    result.kind().exploitCategory()
                            .ifPresent(category -> metrics.recordExploitAttempt(category, 1L));
                }
            } else if (status == ExecutionStatus.SECURITY_VIOLATION) {
                metrics.recordExploitAttempt(SECURITY_VIOLATION_CATEGORY, 1L);
            } else if (status == ExecutionStatus.ACCOUNT_VALIDATION) {
                metrics.recordExploitAttempt(ACCOUNT_VALIDATION_CATEGORY, 1L);
            }
        } catch (MonitorIntegrityException e) {
            failClosed(e);
        }
        for (Finding finding : result.findings()) {
            eventSink.record(finding);
        }
    }

    /**
     * Runs one periodic cycle on the calling thread. The cycle takes a slot in
     * the rate limiter; when none is free it is reported as
     * {@link CycleReport.Outcome#RATE_LIMITED} and skips the status report, but
     * the breaker is still evaluated.
     *
     * @throws MonitorIntegrityException if the counters overflowed; the breaker
     *         is already open when this is thrown
     */
    public CycleReport runCycle() {
        return cycle(true);
    }

    /**
     * Runs a cycle on the monitor thread and waits for it, so the caller sees
     * the breaker state that cycle produced. These cycles do not count against
     * the rate limit.
     */
    public CycleReport evaluateNow() throws InterruptedException {
        Future<CycleReport> future = ticker.submit(() -> cycle(false));
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Monitoring cycle failed", cause);
        }
    }

    private CycleReport cycle(boolean metered) {
        Instant now = clock.instant();
        if (!cycleRunning.compareAndSet(false, true)) {
            return new CycleReport(now, CycleReport.Outcome.ALREADY_RUNNING, null, circuitBreaker.state());
        }
        try {
            boolean admitted = !metered || admit(now);
            SecurityMetricsSnapshot snapshot = metrics.snapshot();
            if (!circuitBreaker.isOpen()) {
                Optional<String> reason = circuitBreaker.evaluate(snapshot);
                reason.ifPresent(r -> trip(r, now));
            }
            cyclesEvaluated.incrementAndGet();
            if (metered && admitted) {
                LOGGER.info(String.format(
                        "Monitoring cycle: vote=%d, execution=%d, state=%d, exploits=%s, failed=%d/%d, breaker=%s",
                        snapshot.voteManipulations(), snapshot.executionManipulations(),
                        snapshot.stateManipulations(), snapshot.exploitAttempts(),
                        snapshot.failedTransactions(), snapshot.totalTransactions(), circuitBreaker.state()));
            }
            CycleReport report = new CycleReport(now,
                    admitted ? CycleReport.Outcome.EVALUATED : CycleReport.Outcome.RATE_LIMITED,
                    snapshot, circuitBreaker.state());
            lastCycle = report;
            return report;
        } catch (MonitorIntegrityException e) {
            failClosed(e);
            throw e;
        } finally {
            cycleRunning.set(false);
        }
    }

    private boolean admit(Instant now) {
        try {
            rateLimiter.acquire(now);
            return true;
        } catch (RateLimitExceededException e) {
            cyclesRateLimited.incrementAndGet();
            LOGGER.fine(String.format("Monitoring cycle at %s: %s", now, e.getMessage()));
            return false;
        }
    }

    public boolean isCircuitOpen() {
        return circuitBreaker.isOpen();
    }

    public CircuitBreakerState circuitState() {
        return circuitBreaker.state();
    }

    public Optional<String> tripReason() {
        return circuitBreaker.tripReason();
    }

    /**
     * Manual recovery: clears every counter and closes the breaker, starting a
     * new monitoring epoch.
     */
    public void resetCircuitBreaker() {
        metrics.reset();
        circuitBreaker.reset();
        LOGGER.info(String.format("Circuit breaker reset; monitoring epoch %d started", circuitBreaker.epoch()));
    }

    public long epoch() {
        return circuitBreaker.epoch();
    }

    public SecurityMetricsSnapshot metricsSnapshot() {
        return metrics.snapshot();
    }

    SecurityMetrics metrics() {
        return metrics;
    }

    public Optional<CycleReport> lastCycle() {
        return Optional.ofNullable(lastCycle);
    }

    public long cyclesEvaluated() {
        return cyclesEvaluated.get();
    }

    public long cyclesRateLimited() {
        return cyclesRateLimited.get();
    }

    @Override
    public void close() {
        ticker.shutdownNow();
        try {
            if (!ticker.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Security monitor thread did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void tick() {
        try {
            runCycle();
        } catch (MonitorIntegrityException e) {
            // Already failed closed; keep the ticker alive.
            LOGGER.log(Level.SEVERE, "Monitoring cycle aborted", e);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unexpected failure in monitoring cycle", e);
            trip("Monitoring cycle failed: " + e.getMessage(), clock.instant());
        }
    }

    private void trip(String reason, Instant now) {
        if (circuitBreaker.trip(reason)) {
            LOGGER.severe(String.format("Circuit breaker triggered: %s", reason));
            eventSink.record(Alert.critical("Circuit breaker triggered: " + reason, now));
        }
    }

    private void failClosed(MonitorIntegrityException e) {
        LOGGER.log(Level.SEVERE, "Monitor integrity failure: " + e.getMessage(), e);
        trip("Monitor integrity failure: " + e.getMessage(), clock.instant());
    }
}
