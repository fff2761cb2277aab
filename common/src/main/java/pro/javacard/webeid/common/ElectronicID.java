package pro.javacard.webeid.common;

import java.io.IOException;

// What the authentication flow needs from a security token
public interface ElectronicID {

    String name();

    JsonWebSignatureAlgorithm authSignatureAlgorithm();

    byte[] getAuthCertificate() throws IOException;

    PinInfo authPinInfo();

    int authPinRetriesLeft() throws IOException;

    // Verifies the PIN and signs the hash with the authentication key. The PIN buffer is owned by the caller.
    byte[] signWithAuthKey(PinBuffer pin, byte[] hash) throws VerifyPinFailed, IOException;
}
