package pro.javacard.webeid.common;

// Malformed command arguments. Raised before anything is sent to the token.
public class InputDataError extends RuntimeException {

    private static final long serialVersionUID = 4417652286117150843L;

    public InputDataError(String message) {
        super(message);
    }

    public InputDataError(String message, Throwable throwable) {
        super(message, throwable);
    }
}
