package pro.javacard.webeid.common;

// Notifications about failed PIN verification, delivered synchronously
public interface AuthenticationUI {

    void onVerifyPinFailed(VerifyPinFailed.Status status, int retriesLeft);

    void onVerificationDisabled();
}
