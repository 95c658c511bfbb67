package chaosfuzz.target;

import java.util.OptionalInt;

/**
 * What the target reported for one invocation.
 */
public final class InvocationResult {

    private final boolean success;
    private final Integer errorCode;
    private final long computeUnitsConsumed;
    private final long memoryBytes;

    private InvocationResult(boolean success, Integer errorCode, long computeUnitsConsumed, long memoryBytes) {
        this.success = success;
        this.errorCode = errorCode;
        this.computeUnitsConsumed = computeUnitsConsumed;
        this.memoryBytes = memoryBytes;
    }

    public static InvocationResult success(long computeUnits) {
        return new InvocationResult(true, null, computeUnits, 0L);
    }

    public static InvocationResult failure(int errorCode, long computeUnits) {
        return new InvocationResult(false, errorCode, computeUnits, 0L);
    }

    /** Failure without a typed error code. */
    public static InvocationResult failure(long computeUnits) {
        return new InvocationResult(false, null, computeUnits, 0L);
    }

    public InvocationResult withMemoryBytes(long bytes) {
        return new InvocationResult(success, errorCode, computeUnitsConsumed, bytes);
    }

    public boolean isSuccess() {
        return success;
    }

    public OptionalInt errorCode() {
        return errorCode == null ? OptionalInt.empty() : OptionalInt.of(errorCode);
    }

    public long computeUnitsConsumed() {
        return computeUnitsConsumed;
    }

    public long memoryBytes() {
        return memoryBytes;
    }

    @Override
    public String toString() {
        if (success) {
            return "Success(cu=" + computeUnitsConsumed + ")";
        }
        return "Failure(code=" + (errorCode == null ? "none" : errorCode) + ", cu=" + computeUnitsConsumed + ")";
    }
}
