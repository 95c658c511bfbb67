package chaosfuzz.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one test case as seen by the engine. {@code outcome} is
 * {@link ExecutionOutcome#CRASH} for every status other than {@link ExecutionStatus#PASSED}
 * that actually reached the target.
 */
public record TestResult(
        String testId,
        TestKind kind,
        ExecutionStatus status,
        ExecutionOutcome outcome,
        List<Finding> findings,
        TestMetrics metrics) {

    public TestResult {
        Objects.requireNonNull(testId, "testId");
        Objects.requireNonNull(status, "status");
        findings = List.copyOf(findings);
        metrics = metrics != null ? metrics : TestMetrics.NONE;
    }

    public static TestResult skipped(TestCase testCase, ExecutionStatus status) {
        if (!status.isSkipped()) {
            throw new IllegalArgumentException("Not a skip status: " + status);
        }
        return new TestResult(testCase.getName(), testCase.getKind(), status, null, List.of(), TestMetrics.NONE);
    }

    public boolean passed() {
        return status == ExecutionStatus.PASSED;
    }
}
