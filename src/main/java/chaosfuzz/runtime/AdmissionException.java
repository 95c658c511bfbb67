package chaosfuzz.runtime;

/**
 * Expected, recoverable refusal to admit more work. Callers retry later or
 * skip; it never aborts a run.
 */
public class AdmissionException extends Exception {

    private static final long serialVersionUID = 1L;

    public AdmissionException(String message) {
        super(message);
    }
}
