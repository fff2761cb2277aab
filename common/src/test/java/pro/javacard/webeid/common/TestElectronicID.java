package pro.javacard.webeid.common;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.util.Arrays;

// P-256 token in memory, PIN "1234"
class TestElectronicID implements ElectronicID {
    static final byte[] CERTIFICATE = "not really a certificate".getBytes(StandardCharsets.US_ASCII);

    final KeyPair keyPair;
    PinInfo pinInfo = new PinInfo(4, 12, false);
    byte[] correctPin = "1234".getBytes(StandardCharsets.US_ASCII);
    int retries = 3;

    VerifyPinFailed failure;
    IOException ioFailure;

    PinBuffer lastPin;
    byte[] lastHash;
    int signCalls = 0;

    TestElectronicID() throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        keyPair = generator.generateKeyPair();
    }

    @Override
    public String name() {
        return "Test";
    }

    @Override
    public JsonWebSignatureAlgorithm authSignatureAlgorithm() {
        return JsonWebSignatureAlgorithm.ES256;
    }

    @Override
    public byte[] getAuthCertificate() {
        return CERTIFICATE.clone();
    }

    @Override
    public PinInfo authPinInfo() {
        return pinInfo;
    }

    @Override
    public int authPinRetriesLeft() {
        return retries;
    }

    @Override
    public byte[] signWithAuthKey(PinBuffer pin, byte[] hash) throws IOException {
        signCalls++;
        lastPin = pin;
        lastHash = hash.clone();
        if (ioFailure != null)
            throw ioFailure;
        if (failure != null)
            throw failure;

        byte[] entered = new byte[pin.length()];
        pin.copyTo(entered, 0);
        if (!Arrays.equals(entered, correctPin)) {
            retries--;
            throw new VerifyPinFailed(retries == 0 ? VerifyPinFailed.Status.PIN_BLOCKED : VerifyPinFailed.Status.RETRY_ALLOWED, retries);
        }
        retries = 3;
        try {
            Signature signature = Signature.getInstance("NONEwithECDSA");
            signature.initSign(keyPair.getPrivate());
            signature.update(hash);
            return CryptoUtils.der2rs(signature.sign(), 32);
        } catch (GeneralSecurityException e) {
            throw new IOException(e);
        }
    }
}
