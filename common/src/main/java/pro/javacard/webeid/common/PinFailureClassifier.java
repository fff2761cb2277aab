package pro.javacard.webeid.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what a failed PIN verification means for the authentication attempt.
 * <ul>
 *     <li>user cancel and timeout end the attempt quietly;</li>
 *     <li>everything else is first reported to the user interface, then becomes a
 *     {@link RecoverableAuthError} if retries remain, or the original failure if none do.</li>
 * </ul>
 */
public final class PinFailureClassifier {
    private static final Logger logger = LoggerFactory.getLogger(PinFailureClassifier.class);

    public enum Disposition {
        ABORT,
        RECOVERABLE,
        FATAL
    }

    private final AuthenticationUI ui;

    public PinFailureClassifier(AuthenticationUI ui) {
        this.ui = ui;
    }

    public Disposition classify(VerifyPinFailed failure) {
        switch (failure.status()) {
            case PIN_ENTRY_CANCEL:
            case PIN_ENTRY_TIMEOUT:
                logger.debug("PIN entry ended: {}", failure.status());
                return Disposition.ABORT;
            case PIN_ENTRY_DISABLED:
                ui.onVerificationDisabled();
                break;
            default:
                ui.onVerifyPinFailed(failure.status(), failure.retries());
        }
        return failure.retries() > 0 ? Disposition.RECOVERABLE : Disposition.FATAL;
    }

    // Returns normally only when the attempt should end quietly
    public void handle(VerifyPinFailed failure) {
        Disposition disposition = classify(failure);
        logger.info("{} with {} retries left: {}", failure.status(), failure.retries(), disposition);
        switch (disposition) {
            case ABORT:
                return;
            case RECOVERABLE:
                throw new RecoverableAuthError(failure);
            default:
                throw failure;
        }
    }
}
