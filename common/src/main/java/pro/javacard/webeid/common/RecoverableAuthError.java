package pro.javacard.webeid.common;

/**
 * The attempt failed but may be repeated with a fresh PIN entry. The user interface has already been
 * told why; the cause is the original {@link VerifyPinFailed}.
 */
public class RecoverableAuthError extends RuntimeException {

    private static final long serialVersionUID = -6731408915093321756L;

    public RecoverableAuthError(VerifyPinFailed failure) {
        super(failure.getMessage(), failure);
    }

    public VerifyPinFailed getFailure() {
        return (VerifyPinFailed) getCause();
    }
}
