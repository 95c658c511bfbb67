package chaosfuzz.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

import chaosfuzz.io.Jsons;
import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.runtime.monitoring.GlobalStats;
import chaosfuzz.security.SecurityMonitor;

final class SessionReportWriter {
    private static final Logger LOGGER = LoggingConfig.getLogger(SessionReportWriter.class);

    private final ChaosConfig config;
    private final GlobalStats globalStats;
    private final SecurityMonitor monitor;
    private final long sessionSeed;
    private final Clock clock;

    SessionReportWriter(ChaosConfig config, GlobalStats globalStats, SecurityMonitor monitor,
                        long sessionSeed, Clock clock) {
        this.config = config;
        this.globalStats = globalStats;
        this.monitor = monitor;
        this.sessionSeed = sessionSeed;
        this.clock = clock;
    }

    SessionReport writeFinalReport(RunSummary summary, Instant startedAt) {
        Instant finishedAt = clock.instant();
        Duration elapsed = Duration.between(startedAt, finishedAt);
        GlobalStats.FinalMetrics metrics = globalStats.snapshotFinalMetrics();
        double elapsedSeconds = Math.max(0.0, elapsed.toMillis() / 1000.0);
        double throughput = (elapsedSeconds > 0.0) ? metrics.totalExecuted() / elapsedSeconds : 0.0;
        String text = String.format(
                """
                Final run metrics:
                  tests submitted: %,d
                  tests dispatched: %,d
                  tests executed: %,d
                  passed: %,d
                  crashed: %,d
                  timeouts: %,d
                  execution failures: %,d
                  sanitizer rejections: %,d
                  skipped (capacity): %,d
                  skipped (circuit open): %,d
                  findings: %,d
                  peak concurrently held: %d
                  average exec runtime: %.3f ms
                  average compute units: %.1f
                  circuit breaker: %s%s
                  throughput (executed/s): %.2f
                  total runtime: %s (%.3f s)
                """,
                summary.results().size(),
                metrics.totalDispatched(),
                metrics.totalExecuted(),
                metrics.count(ExecutionStatus.PASSED),
                metrics.count(ExecutionStatus.CRASHED),
                metrics.count(ExecutionStatus.TIMEOUT),
                metrics.count(ExecutionStatus.EXECUTION_FAILED),
                metrics.count(ExecutionStatus.SECURITY_VIOLATION) + metrics.count(ExecutionStatus.ACCOUNT_VALIDATION),
                metrics.count(ExecutionStatus.INSUFFICIENT_CAPACITY),
                metrics.count(ExecutionStatus.SKIPPED_CIRCUIT_OPEN),
                metrics.findings(),
                metrics.peakInFlight(),
                metrics.avgExecTimeMillis(),
                metrics.avgComputeUnits(),
                summary.breakerState(),
                summary.halted() ? " (" + summary.haltReason() + ")" : "",
                throughput,
                formatElapsedDuration(elapsed),
                elapsedSeconds).stripTrailing();
        LOGGER.info(text);

        SessionReport report = new SessionReport(
                config.programId(),
                sessionSeed,
                startedAt,
                finishedAt,
                elapsed.toMillis(),
                summary.circuitBreakerTripped(),
                summary.haltReason(),
                summary.breakerState(),
                monitor.epoch(),
                metrics,
                monitor.metricsSnapshot(),
                summary.results());
        config.reportPath().ifPresent(path -> writeJson(path, report));
        return report;
    }

    private void writeJson(Path path, SessionReport report) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, Jsons.toJson(report), StandardCharsets.UTF_8);
            LOGGER.info(String.format("Session report written to %s", path));
        } catch (IOException e) {
            LOGGER.warning(String.format("Failed to write session report %s: %s", path, e.getMessage()));
        }
    }

    static String formatElapsedDuration(Duration elapsed) {
        if (elapsed == null) {
            return "0:00:00";
        }
        long totalSeconds = Math.max(0L, elapsed.getSeconds());
        long hours = totalSeconds / 3600L;
        long minutes = (totalSeconds % 3600L) / 60L;
        long seconds = totalSeconds % 60L;
        return String.format("%d:%02d:%02d", hours, minutes, seconds);
    }
}
