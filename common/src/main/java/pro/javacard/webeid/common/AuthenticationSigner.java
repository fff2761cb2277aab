package pro.javacard.webeid.common;

import java.io.IOException;

public final class AuthenticationSigner {

    private AuthenticationSigner() {
    }

    public static byte[] createSignature(Origin origin, ChallengeNonce challengeNonce, ElectronicID eid, PinBuffer pin) throws IOException {
        byte[] hash = AuthenticationDigest.create(origin, challengeNonce, eid.authSignatureAlgorithm());
        return sign(eid, pin, hash);
    }

    // The PIN is cleared on every path out, including exceptions
    public static byte[] sign(ElectronicID eid, PinBuffer pin, byte[] hash) throws IOException {
        try (pin) {
            return eid.signWithAuthKey(pin, hash);
        }
    }
}
