package chaosfuzz.security;

/**
 * Monitor counters can no longer be trusted (checked arithmetic overflowed).
 * Fatal for the current monitoring cycle.
 */
public class MonitorIntegrityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MonitorIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
