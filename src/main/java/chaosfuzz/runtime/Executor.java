package chaosfuzz.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import chaosfuzz.logging.LoggingConfig;
import chaosfuzz.model.ComputeBudget;
import chaosfuzz.model.ExecutionOutcome;
import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.model.ExpectedResult;
import chaosfuzz.model.Finding;
import chaosfuzz.model.FindingCategory;
import chaosfuzz.model.FindingSeverity;
import chaosfuzz.model.TestCase;
import chaosfuzz.model.TestMetrics;
import chaosfuzz.model.TestResult;
import chaosfuzz.security.AccountValidationException;
import chaosfuzz.security.InputSanitizer;
import chaosfuzz.security.InputValidationException;
import chaosfuzz.target.Invocation;
import chaosfuzz.target.InvocationException;
import chaosfuzz.target.InvocationResult;
import chaosfuzz.target.TargetProgram;

/**
 * Runs one test case against the target program and classifies the outcome.
 *
 * <p>The invocation happens on the calling thread. The timeout is checked after
 * the call returns; a slow call is reported as {@link ExecutionStatus#TIMEOUT}
 * but is never interrupted.
 */
public class Executor {
    private static final Logger LOGGER = LoggingConfig.getLogger(Executor.class);

    private final String programId;
    private final TargetProgram target;
    private final InputSanitizer sanitizer;
    private final PerformanceThresholds thresholds;
    private final Clock clock;

    public Executor(String programId, TargetProgram target, InputSanitizer sanitizer,
                    PerformanceThresholds thresholds, Clock clock) {
        this.programId = Objects.requireNonNull(programId, "programId");
        this.target = Objects.requireNonNull(target, "target");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TestResult run(TestCase testCase, ComputeBudget budget, Duration timeout) {
        Objects.requireNonNull(testCase, "testCase");
        Objects.requireNonNull(budget, "budget");
        Objects.requireNonNull(timeout, "timeout");

        try {
            sanitizer.validate(testCase);
        } catch (InputValidationException e) {
            LOGGER.fine(String.format("Test %s rejected by sanitizer: %s", testCase.getName(), e.getMessage()));
            if (e instanceof AccountValidationException) {
                return rejected(testCase, ExecutionStatus.ACCOUNT_VALIDATION,
                        FindingCategory.UNAUTHORIZED_ACCESS, e.getMessage());
            }
            return rejected(testCase, ExecutionStatus.SECURITY_VIOLATION,
                    FindingCategory.SECURITY_VULNERABILITY, e.getMessage());
        }

        Invocation invocation = new Invocation(programId, testCase.getAccounts(), testCase.getPayload(), budget);
        List<Finding> findings = new ArrayList<>();
        long startNanos = System.nanoTime();
        InvocationResult invocationResult = null;
        InvocationException invocationError = null;
        try {
            invocationResult = target.invoke(invocation);
        } catch (InvocationException e) {
            invocationError = e;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        Instant now = clock.instant();

        long computeUnits = invocationResult != null ? invocationResult.computeUnitsConsumed() : 0L;
        long memoryBytes = invocationResult != null ? invocationResult.memoryBytes() : 0L;
        TestMetrics metrics = new TestMetrics(computeUnits, memoryBytes, elapsed.toMillis());
        checkPerformance(testCase, computeUnits, elapsed, now, findings);

        ExecutionStatus status;
        if (elapsed.compareTo(timeout) > 0) {
            status = ExecutionStatus.TIMEOUT;
            findings.add(Finding.of(FindingCategory.RESOURCE_EXHAUSTION, FindingSeverity.MEDIUM,
                    String.format("Execution took %d ms, exceeding the %d ms timeout",
                            elapsed.toMillis(), timeout.toMillis()),
                    now, testCase.getName()));
        } else if (invocationError != null) {
            status = ExecutionStatus.EXECUTION_FAILED;
            LOGGER.warning(String.format("Execution of %s failed: %s", testCase.getName(), invocationError.getMessage()));
            findings.add(Finding.of(FindingCategory.LOGIC_ERROR, FindingSeverity.MEDIUM,
                    "Execution error: " + invocationError.getMessage(), now, testCase.getName()));
        } else if (classify(invocationResult, testCase.getExpectedResult()) == ExecutionOutcome.CRASH) {
            status = ExecutionStatus.CRASHED;
            findings.add(Finding.of(FindingCategory.LOGIC_ERROR, FindingSeverity.HIGH,
                    String.format("Unexpected result %s, expected %s",
                            invocationResult, testCase.getExpectedResult()),
                    now, testCase.getName()));
        } else {
            status = ExecutionStatus.PASSED;
        }

        ExecutionOutcome outcome = status == ExecutionStatus.PASSED ? ExecutionOutcome.OK : ExecutionOutcome.CRASH;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Test %s finished with %s in %d ms (%d CU)",
                    testCase.getName(), status, elapsed.toMillis(), computeUnits));
        }
        return new TestResult(testCase.getName(), testCase.getKind(), status, outcome, findings, metrics);
    }

    /**
     * Maps what the target did onto what the test expected. Only an exact
     * match is {@link ExecutionOutcome#OK}.
     */
    public static ExecutionOutcome classify(InvocationResult result, ExpectedResult expected) {
        if (result.isSuccess()) {
            return expected.kind() == ExpectedResult.Kind.SUCCESS ? ExecutionOutcome.OK : ExecutionOutcome.CRASH;
        }
        switch (expected.kind()) {
            case REVERT:
                return ExecutionOutcome.OK;
            case FAIL_WITH:
                if (result.errorCode().isPresent()
                        && result.errorCode().getAsInt() == expected.code().getAsInt()) {
                    return ExecutionOutcome.OK;
                }
                return ExecutionOutcome.CRASH;
            default:
                return ExecutionOutcome.CRASH;
        }
    }

    private void checkPerformance(TestCase testCase, long computeUnits, Duration elapsed, Instant now,
                                  List<Finding> findings) {
        if (computeUnits > thresholds.computeUnits()) {
            findings.add(Finding.of(FindingCategory.PERFORMANCE_ISSUE, FindingSeverity.HIGH,
                            String.format("High compute cost: %d CU", computeUnits), now, testCase.getName())
                    .withMetadata("metric", "compute_units")
                    .withMetadata("cost", Long.toString(computeUnits))
                    .withMetadata("threshold", Long.toString(thresholds.computeUnits())));
        }
        if (elapsed.compareTo(thresholds.executionTime()) > 0) {
            findings.add(Finding.of(FindingCategory.PERFORMANCE_ISSUE, FindingSeverity.HIGH,
                            String.format("Slow execution: %d ms", elapsed.toMillis()), now, testCase.getName())
                    .withMetadata("metric", "execution_time_ms")
                    .withMetadata("cost", Long.toString(elapsed.toMillis()))
                    .withMetadata("threshold", Long.toString(thresholds.executionTime().toMillis())));
        }
    }

    private TestResult rejected(TestCase testCase, ExecutionStatus status, FindingCategory category, String message) {
        Finding finding = Finding.of(category, FindingSeverity.HIGH, message, clock.instant(), testCase.getName());
        return new TestResult(testCase.getName(), testCase.getKind(), status, null, List.of(finding), TestMetrics.NONE);
    }
}
