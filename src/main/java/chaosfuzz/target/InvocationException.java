package chaosfuzz.target;

public class InvocationException extends Exception {

    private static final long serialVersionUID = 1L;

    public InvocationException(String message) {
        super(message);
    }

    public InvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
