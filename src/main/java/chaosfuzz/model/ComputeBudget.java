package chaosfuzz.model;

import java.util.OptionalLong;

/** Execution-cost ceiling forwarded with every invocation. */
public record ComputeBudget(long units, Long heapBytes) {

    public ComputeBudget {
        if (units <= 0) {
            throw new IllegalArgumentException("Compute units must be positive.");
        }
        if (heapBytes != null && heapBytes <= 0) {
            throw new IllegalArgumentException("Heap bytes must be positive.");
        }
    }

    public static ComputeBudget ofUnits(long units) {
        return new ComputeBudget(units, null);
    }

    public OptionalLong heap() {
        return heapBytes == null ? OptionalLong.empty() : OptionalLong.of(heapBytes);
    }
}
