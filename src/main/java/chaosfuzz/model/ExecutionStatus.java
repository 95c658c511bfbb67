package chaosfuzz.model;

/**
 * Final status of one submitted test case. Every submitted case ends in
 * exactly one of these.
 */
public enum ExecutionStatus {
    PASSED(true),
    CRASHED(true),
    TIMEOUT(true),
    EXECUTION_FAILED(true),
    ACCOUNT_VALIDATION(false),
    SECURITY_VIOLATION(false),
    /** Pool had no room; the executor was never called. */
    INSUFFICIENT_CAPACITY(false),
    /** Dispatch stopped because the circuit breaker was open. */
    SKIPPED_CIRCUIT_OPEN(false);

    private final boolean invoked;

    ExecutionStatus(boolean invoked) {
        this.invoked = invoked;
    }

    /** Whether the target program was actually invoked. */
    public boolean invokedTarget() {
        return invoked;
    }

    public boolean isSkipped() {
        return this == INSUFFICIENT_CAPACITY || this == SKIPPED_CIRCUIT_OPEN;
    }
}
