package chaosfuzz.runtime;

import java.time.Duration;
import java.util.Objects;

/** Cost above which an invocation is reported as a performance issue. */
public record PerformanceThresholds(long computeUnits, Duration executionTime) {

    public static final PerformanceThresholds DEFAULT =
            new PerformanceThresholds(150_000L, Duration.ofSeconds(1));

    public PerformanceThresholds {
        Objects.requireNonNull(executionTime, "executionTime");
        if (computeUnits <= 0) {
            throw new IllegalArgumentException("Compute unit threshold must be positive.");
        }
        if (executionTime.isNegative() || executionTime.isZero()) {
            throw new IllegalArgumentException("Execution time threshold must be positive.");
        }
    }
}
