package chaosfuzz.runtime;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;
import java.util.logging.Logger;

import chaosfuzz.io.EventSink;
import chaosfuzz.io.JsonLinesEventSink;
import chaosfuzz.io.LoggingEventSink;
import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.TestCase;
import chaosfuzz.runtime.monitoring.GlobalStats;
import chaosfuzz.runtime.scheduling.UniformRandomMutatorScheduler;
import chaosfuzz.security.CircuitBreaker;
import chaosfuzz.security.InputSanitizer;
import chaosfuzz.security.SecurityMonitor;
import chaosfuzz.security.SlidingWindowRateLimiter;
import chaosfuzz.target.TargetProgram;

/**
 * One chaos session: builds the pool, mutator, executor, monitor and engine
 * from a {@link ChaosConfig} and hands them to each other. There is no global
 * state; two sessions never share anything.
 */
public final class ChaosSession implements AutoCloseable {
    private static final Logger LOGGER = LoggingConfig.getLogger(ChaosSession.class);

    private final ChaosConfig config;
    private final Clock clock;
    private final GlobalStats globalStats = new GlobalStats();
    private final ResourcePool resourcePool;
    private final SecurityMonitor monitor;
    private final ChaosEngine engine;
    private final SessionReportWriter reportWriter;
    private long sessionSeed;

    public ChaosSession(ChaosConfig config, TargetProgram target) {
        this(config, target, Clock.systemUTC(), List.of());
    }

    public ChaosSession(ChaosConfig config, TargetProgram target, Clock clock, List<EventSink> extraSinks) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(target, "target");
        initialiseRandom();

        List<EventSink> sinks = new ArrayList<>();
        sinks.add(new LoggingEventSink());
        config.eventLogPath().ifPresent(path -> sinks.add(new JsonLinesEventSink(path)));
        sinks.addAll(extraSinks);
        EventSink eventSink = EventSink.composite(sinks);

        this.resourcePool = new ResourcePool(config.maxCpu(), config.maxMem());
        InputSanitizer sanitizer = new InputSanitizer(config.maxInstructionSize(),
                List.of(InputSanitizer.DEFAULT_BLOCKED_PATTERN));
        Executor executor = new Executor(config.programId(), target, sanitizer,
                config.performanceThresholds(), clock);
        this.monitor = new SecurityMonitor(
                new SlidingWindowRateLimiter(config.rateLimitWindow(), config.maxOperationsPerWindow()),
                new CircuitBreaker(config.circuitBreakerThreshold()),
                config.monitorInterval(),
                eventSink,
                clock);
        MutationAttemptEngine mutationEngine =
                new MutationAttemptEngine(new UniformRandomMutatorScheduler(), globalStats);
        this.engine = new ChaosEngine(config, resourcePool, mutationEngine, executor, monitor,
                globalStats, sessionSeed);
        this.reportWriter = new SessionReportWriter(config, globalStats, monitor, sessionSeed, clock);
    }

    private void initialiseRandom() {
        OptionalLong seedOpt = config.configuredRngSeed();
        if (seedOpt.isPresent()) {
            sessionSeed = seedOpt.getAsLong();
        } else {
            sessionSeed = new Random().nextLong();
        }
        LOGGER.info(String.format("Using random seed: %d", sessionSeed));
    }

    /**
     * Starts the monitor ticker, runs the batch and writes the final report.
     */
    public RunSummary run(List<TestCase> queue) throws InterruptedException {
        Instant startedAt = clock.instant();
        monitor.start();
        RunSummary summary = engine.executeTests(queue);
        reportWriter.writeFinalReport(summary, startedAt);
        return summary;
    }

    /** Manual breaker recovery; see {@link SecurityMonitor#resetCircuitBreaker()}. */
    public void resetCircuitBreaker() {
        monitor.resetCircuitBreaker();
    }

    public long sessionSeed() {
        return sessionSeed;
    }

    public GlobalStats globalStats() {
        return globalStats;
    }

    public SecurityMonitor monitor() {
        return monitor;
    }

    public ResourcePool resourcePool() {
        return resourcePool;
    }

    @Override
    public void close() {
        engine.close();
        monitor.close();
    }
}
