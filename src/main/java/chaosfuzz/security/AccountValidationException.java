package chaosfuzz.security;

public class AccountValidationException extends InputValidationException {

    private static final long serialVersionUID = 1L;

    public AccountValidationException(String message) {
        super(message);
    }
}
