package pro.javacard.webeid.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.security.auth.callback.Callback;
import javax.security.auth.callback.CallbackHandler;
import javax.security.auth.callback.PasswordCallback;
import javax.security.auth.callback.TextOutputCallback;
import javax.security.auth.callback.UnsupportedCallbackException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;

// PIN entry and notifications over JAAS callbacks. A null password means the user cancelled.
public class CallbackHandlerUI implements PinProvider, AuthenticationUI {
    private static final Logger logger = LoggerFactory.getLogger(CallbackHandlerUI.class);

    private final CallbackHandler handler;

    public CallbackHandlerUI(CallbackHandler handler) {
        this.handler = handler;
    }

    @Override
    public void getPin(PinBuffer pin, ElectronicID eid) throws IOException {
        PinInfo info = eid.authPinInfo();
        PasswordCallback pc = new PasswordCallback(String.format("%s authentication PIN (%d-%d digits)", eid.name(), info.getMinLength(), info.getMaxLength()), false);
        try {
            handler.handle(new Callback[]{pc});
        } catch (UnsupportedCallbackException e) {
            throw new IllegalStateException("PIN entry not supported by " + handler.getClass().getSimpleName(), e);
        }
        char[] entered = pc.getPassword();
        pc.clearPassword();
        if (entered == null)
            throw new VerifyPinFailed(VerifyPinFailed.Status.PIN_ENTRY_CANCEL, eid.authPinRetriesLeft());
        try {
            if (!info.isValidLength(entered.length)) {
                logger.debug("PIN length outside {}", info);
                throw new VerifyPinFailed(VerifyPinFailed.Status.INVALID_PIN_LENGTH, eid.authPinRetriesLeft());
            }
            pin.append(entered);
        } finally {
            Arrays.fill(entered, '\0');
        }
    }

    @Override
    public void onVerifyPinFailed(VerifyPinFailed.Status status, int retriesLeft) {
        switch (status) {
            case PIN_BLOCKED:
                show(TextOutputCallback.ERROR, "PIN is blocked");
                break;
            case INVALID_PIN_LENGTH:
                show(TextOutputCallback.WARNING, String.format("Invalid PIN length, %d attempts left", retriesLeft));
                break;
            default:
                if (retriesLeft == 0)
                    show(TextOutputCallback.ERROR, "Wrong PIN, no attempts left");
                else
                    show(TextOutputCallback.WARNING, String.format("Wrong PIN, %d attempts left", retriesLeft));
        }
    }

    @Override
    public void onVerificationDisabled() {
        show(TextOutputCallback.WARNING, "PIN verification is disabled on this card");
    }

    void show(int type, String message) {
        try {
            handler.handle(new Callback[]{new TextOutputCallback(type, message)});
        } catch (UnsupportedCallbackException e) {
            throw new IllegalStateException("Messages not supported by " + handler.getClass().getSimpleName(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
