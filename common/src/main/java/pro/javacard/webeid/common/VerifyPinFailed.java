package pro.javacard.webeid.common;

/**
 * PIN verification outcome reported by the security token or by PIN entry.
 * <p>
 * The retry count is meaningful for every status except user cancel and timeout.
 */
public class VerifyPinFailed extends AuthenticationFailed {

    private static final long serialVersionUID = -4391729021470226613L;

    public enum Status {
        RETRY_ALLOWED,
        INVALID_PIN_LENGTH,
        PIN_ENTRY_TIMEOUT,
        PIN_ENTRY_CANCEL,
        PIN_ENTRY_DISABLED,
        PIN_BLOCKED
    }

    private final Status status;
    private final int retries;

    public VerifyPinFailed(Status status, int retries) {
        super(String.format("PIN verification failed: %s, %d retries left", status, retries));
        if (retries < 0)
            throw new IllegalArgumentException("Negative retry count: " + retries);
        this.status = status;
        this.retries = retries;
    }

    public static VerifyPinFailed blocked() {
        return new VerifyPinFailed(Status.PIN_BLOCKED, 0);
    }

    public Status status() {
        return status;
    }

    public int retries() {
        return retries;
    }
}
