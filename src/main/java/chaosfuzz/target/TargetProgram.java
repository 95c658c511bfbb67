package chaosfuzz.target;

/**
 * The external transactional program under test. Implementations must be safe
 * to call from several worker threads at once.
 */
@FunctionalInterface
public interface TargetProgram {

    /**
     * Runs one instruction. A program-level failure is reported through the
     * returned {@link InvocationResult}; {@link InvocationException} is reserved
     * for failures of the invocation itself (transport, harness setup).
     */
    InvocationResult invoke(Invocation invocation) throws InvocationException;
}
