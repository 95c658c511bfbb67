package chaosfuzz.security;

/** A test case was rejected before reaching the target program. */
public abstract class InputValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    protected InputValidationException(String message) {
        super(message);
    }
}
