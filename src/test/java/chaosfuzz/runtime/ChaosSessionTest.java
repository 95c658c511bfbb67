package chaosfuzz.runtime;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import chaosfuzz.io.Jsons;
import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.model.ResourceProfile;
import chaosfuzz.model.TestCase;
import chaosfuzz.model.TestKind;
import chaosfuzz.model.TestMetrics;
import chaosfuzz.model.TestResult;
import chaosfuzz.security.CircuitBreakerState;
import chaosfuzz.support.MutableClock;
import chaosfuzz.support.RecordingEventSink;
import chaosfuzz.support.ScriptedTargetProgram;
import chaosfuzz.support.TestCases;
import chaosfuzz.target.InvocationResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChaosSessionTest {

    @TempDir
    Path tempDir;

    private ChaosConfig.Builder baseConfig() {
        return ChaosConfig.builder()
                .maxConcurrent(2)
                .maxCpu(4)
                .maxMem(4)
                .mutationRate(0.0)
                .mutateAccounts(false)
                .monitorInterval(Duration.ofHours(1))
                .rngSeed(7L);
    }

    private static List<TestCase> queueWithOneCrash() {
        List<TestCase> queue = new ArrayList<>(TestCases.batch(3, ResourceProfile.of(1, 1)));
        queue.add(TestCases.withPayload("crashing", new byte[] {9, 9}));
        return queue;
    }

    private static ScriptedTargetProgram crashOnNine() {
        return ScriptedTargetProgram.answering(invocation -> invocation.payload().length > 0
                && invocation.payload()[0] == 9
                ? InvocationResult.failure(6001, 500L)
                : InvocationResult.success(1_000L));
    }

    @Test
    void runShouldWriteReportAndEventLog() throws Exception {
        Path report = tempDir.resolve("out").resolve("report.json");
        Path events = tempDir.resolve("out").resolve("events.ndjson");
        ChaosConfig config = baseConfig().reportPath(report).eventLogPath(events).build();
        RecordingEventSink recorder = new RecordingEventSink();

        RunSummary summary;
        try (ChaosSession session = new ChaosSession(config, crashOnNine(), MutableClock.startingAtEpoch(),
                List.of(recorder))) {
            summary = session.run(queueWithOneCrash());
            assertEquals(7L, session.sessionSeed());
            assertEquals(4L, session.globalStats().snapshotFinalMetrics().totalExecuted());
            assertEquals(4L, session.resourcePool().availableCpu());
        }

        assertEquals(4, summary.results().size());
        assertEquals(3L, summary.count(ExecutionStatus.PASSED));
        assertEquals(1L, summary.count(ExecutionStatus.CRASHED));
        assertFalse(summary.circuitBreakerTripped());
        assertEquals(1, recorder.findings().size());

        JsonNode root = Jsons.mapper().readTree(Files.readString(report, StandardCharsets.UTF_8));
        assertEquals(7L, root.path("sessionSeed").asLong());
        assertEquals(TestCases.SYSTEM_PROGRAM, root.path("programId").asText());
        assertFalse(root.path("circuitBreakerTripped").asBoolean());
        assertEquals(4, root.path("results").size());
        assertEquals("2024-01-01T00:00:00Z", root.path("startedAt").asText());

        List<String> lines = Files.readAllLines(events, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        JsonNode finding = Jsons.mapper().readTree(lines.get(0));
        assertEquals("finding", finding.path("type").asText());
        assertEquals("crashing", finding.path("event").path("relatedTestId").asText());
    }

    @Test
    void sessionsShouldNotShareState() throws Exception {
        ChaosConfig config = baseConfig().build();

        try (ChaosSession first = new ChaosSession(config, crashOnNine(), MutableClock.startingAtEpoch(), List.of());
             ChaosSession second = new ChaosSession(config, ScriptedTargetProgram.alwaysSucceeding(),
                     MutableClock.startingAtEpoch(), List.of())) {
            first.run(queueWithOneCrash());

            assertEquals(4L, first.globalStats().snapshotFinalMetrics().totalExecuted());
            assertEquals(0L, second.globalStats().snapshotFinalMetrics().totalExecuted());
            assertEquals(0L, second.monitor().metricsSnapshot().totalTransactions());
        }
    }

    @Test
    void manualResetShouldReopenTrippedSession() throws Exception {
        ChaosConfig config = baseConfig().circuitBreakerThreshold(0).build();

        try (ChaosSession session = new ChaosSession(config, crashOnNine(), MutableClock.startingAtEpoch(),
                List.of())) {
            session.monitor().evaluateNow();
            session.monitor().report(
                    new TestResult("rejected", TestKind.INSTRUCTION_FUZZ, ExecutionStatus.SECURITY_VIOLATION,
                            null, List.of(), TestMetrics.NONE));
            session.monitor().evaluateNow();
            assertTrue(session.monitor().isCircuitOpen());

            RunSummary halted = session.run(TestCases.batch(2, ResourceProfile.of(1, 1)));
            assertTrue(halted.circuitBreakerTripped());
            assertEquals(2L, halted.count(ExecutionStatus.SKIPPED_CIRCUIT_OPEN));

            session.resetCircuitBreaker();
            assertEquals(CircuitBreakerState.CLOSED, session.monitor().circuitState());
            RunSummary resumed = session.run(TestCases.batch(2, ResourceProfile.of(1, 1)));
            assertEquals(2L, resumed.count(ExecutionStatus.PASSED));
        }
    }
}
