package chaosfuzz.runtime;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import chaosfuzz.model.AccountRef;
import chaosfuzz.model.ComputeBudget;
import chaosfuzz.model.ExecutionOutcome;
import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.model.ExpectedResult;
import chaosfuzz.model.Finding;
import chaosfuzz.model.FindingCategory;
import chaosfuzz.model.FindingSeverity;
import chaosfuzz.model.ResourceProfile;
import chaosfuzz.model.TestCase;
import chaosfuzz.model.TestKind;
import chaosfuzz.model.TestResult;
import chaosfuzz.security.InputSanitizer;
import chaosfuzz.support.MutableClock;
import chaosfuzz.support.ScriptedTargetProgram;
import chaosfuzz.support.TestCases;
import chaosfuzz.target.InvocationException;
import chaosfuzz.target.InvocationResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorTest {

    private static final ComputeBudget BUDGET = ComputeBudget.ofUnits(200_000);
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final MutableClock clock = MutableClock.startingAtEpoch();

    private Executor executor(ScriptedTargetProgram target) {
        return new Executor(TestCases.SYSTEM_PROGRAM, target, new InputSanitizer(),
                new PerformanceThresholds(150_000, Duration.ofSeconds(5)), clock);
    }

    private static TestCase expecting(ExpectedResult expected) {
        return new TestCase("case", TestKind.INSTRUCTION_FUZZ, new byte[] {1, 2}, TestCases.accounts(),
                expected, ResourceProfile.of(1, 1));
    }

    @Test
    void classifyShouldMatchOnlyExpectedOutcomes() {
        InvocationResult ok = InvocationResult.success(10);
        InvocationResult fail7 = InvocationResult.failure(7, 10);
        InvocationResult failNoCode = InvocationResult.failure(10);

        assertEquals(ExecutionOutcome.OK, Executor.classify(ok, ExpectedResult.success()));
        assertEquals(ExecutionOutcome.CRASH, Executor.classify(ok, ExpectedResult.revert()));
        assertEquals(ExecutionOutcome.CRASH, Executor.classify(ok, ExpectedResult.failWith(7)));

        assertEquals(ExecutionOutcome.OK, Executor.classify(fail7, ExpectedResult.failWith(7)));
        assertEquals(ExecutionOutcome.CRASH, Executor.classify(fail7, ExpectedResult.failWith(8)));
        assertEquals(ExecutionOutcome.OK, Executor.classify(fail7, ExpectedResult.revert()));
        assertEquals(ExecutionOutcome.CRASH, Executor.classify(fail7, ExpectedResult.success()));

        assertEquals(ExecutionOutcome.CRASH, Executor.classify(failNoCode, ExpectedResult.failWith(7)));
        assertEquals(ExecutionOutcome.OK, Executor.classify(failNoCode, ExpectedResult.revert()));
    }

    @Test
    void matchingResultShouldPassWithMetrics() {
        ScriptedTargetProgram target = ScriptedTargetProgram.answering(
                invocation -> InvocationResult.success(5_000).withMemoryBytes(2_048));

        TestResult result = executor(target).run(expecting(ExpectedResult.success()), BUDGET, TIMEOUT);

        assertEquals(ExecutionStatus.PASSED, result.status());
        assertEquals(ExecutionOutcome.OK, result.outcome());
        assertEquals(5_000, result.metrics().computeUnits());
        assertEquals(2_048, result.metrics().memoryBytes());
        assertTrue(result.findings().isEmpty());
        assertEquals(1, target.invocations());
    }

    @Test
    void unexpectedResultShouldCrashWithLogicFinding() {
        ScriptedTargetProgram target = ScriptedTargetProgram.answering(
                invocation -> InvocationResult.failure(3, 100));

        TestResult result = executor(target).run(expecting(ExpectedResult.success()), BUDGET, TIMEOUT);

        assertEquals(ExecutionStatus.CRASHED, result.status());
        assertEquals(ExecutionOutcome.CRASH, result.outcome());
        assertEquals(1, result.findings().size());
        assertEquals(FindingCategory.LOGIC_ERROR, result.findings().get(0).category());
        assertEquals(FindingSeverity.HIGH, result.findings().get(0).severity());
        assertEquals("case", result.findings().get(0).relatedTestId());
    }

    @Test
    void expensiveInvocationShouldReportPerformanceIssueEvenWhenPassing() {
        ScriptedTargetProgram target = ScriptedTargetProgram.answering(
                invocation -> InvocationResult.success(180_000));

        TestResult result = executor(target).run(expecting(ExpectedResult.success()), BUDGET, TIMEOUT);

        assertEquals(ExecutionStatus.PASSED, result.status());
        assertEquals(1, result.findings().size());
        Finding finding = result.findings().get(0);
        assertEquals(FindingCategory.PERFORMANCE_ISSUE, finding.category());
        assertEquals("180000", finding.metadata().get("cost"));
        assertEquals("150000", finding.metadata().get("threshold"));
        assertEquals(clock.instant(), finding.timestamp());
    }

    @Test
    void slowInvocationShouldBeOverriddenToTimeout() {
        ScriptedTargetProgram target = new ScriptedTargetProgram(invocation -> {
            try {
                Thread.sleep(80);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return InvocationResult.success(10);
        });

        TestResult result = executor(target).run(expecting(ExpectedResult.success()), BUDGET, Duration.ofMillis(20));

        assertEquals(ExecutionStatus.TIMEOUT, result.status());
        assertEquals(ExecutionOutcome.CRASH, result.outcome());
        assertTrue(result.findings().stream().anyMatch(f -> f.category() == FindingCategory.RESOURCE_EXHAUSTION));
        assertTrue(result.metrics().executionTimeMillis() >= 20);
    }

    @Test
    void invocationExceptionShouldBecomeExecutionFailure() {
        ScriptedTargetProgram target = new ScriptedTargetProgram(invocation -> {
            throw new InvocationException("transport closed");
        });

        TestResult result = executor(target).run(expecting(ExpectedResult.revert()), BUDGET, TIMEOUT);

        assertEquals(ExecutionStatus.EXECUTION_FAILED, result.status());
        assertEquals(ExecutionOutcome.CRASH, result.outcome());
        assertEquals(FindingSeverity.MEDIUM, result.findings().get(0).severity());
        assertTrue(result.findings().get(0).description().contains("transport closed"));
    }

    @Test
    void oversizedOrBlockedPayloadShouldNeverReachTarget() {
        ScriptedTargetProgram target = ScriptedTargetProgram.alwaysSucceeding();
        Executor executor = executor(target);

        TestResult oversized = executor.run(TestCases.withPayload("big", new byte[1025]), BUDGET, TIMEOUT);
        TestResult blocked = executor.run(
                TestCases.withPayload("blocked", new byte[] {0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF}),
                BUDGET, TIMEOUT);

        assertEquals(ExecutionStatus.SECURITY_VIOLATION, oversized.status());
        assertEquals(ExecutionStatus.SECURITY_VIOLATION, blocked.status());
        assertEquals(FindingCategory.SECURITY_VULNERABILITY, blocked.findings().get(0).category());
        assertEquals(0, target.invocations());
    }

    @Test
    void malformedAccountShouldBeRejectedAsAccountValidation() {
        ScriptedTargetProgram target = ScriptedTargetProgram.alwaysSucceeding();
        TestCase testCase = new TestCase("bad-account", TestKind.INSTRUCTION_FUZZ, new byte[] {1},
                List.of(new AccountRef("0OIl-not-base58", true, true)), ExpectedResult.success(),
                ResourceProfile.of(1, 1));

        TestResult result = executor(target).run(testCase, BUDGET, TIMEOUT);

        assertEquals(ExecutionStatus.ACCOUNT_VALIDATION, result.status());
        assertEquals(FindingCategory.UNAUTHORIZED_ACCESS, result.findings().get(0).category());
        assertEquals(0, target.invocations());
    }
}
