package chaosfuzz.security;

public class SecurityViolationException extends InputValidationException {

    private static final long serialVersionUID = 1L;

    public SecurityViolationException(String message) {
        super(message);
    }
}
