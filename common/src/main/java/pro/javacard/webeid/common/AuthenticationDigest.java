package pro.javacard.webeid.common;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static pro.javacard.webeid.common.CryptoUtils.concatenate;

/**
 * Derives the value the authentication key signs:
 * <pre>
 *     H(H(origin) || H(challengeNonce))
 * </pre>
 * where H is picked by the signature algorithm of the key. Relying parties recompute the same value
 * when verifying, so the construction must not change.
 */
public final class AuthenticationDigest {

    static final Map<JsonWebSignatureAlgorithm, HashAlgorithm> SIGNATURE_ALGO_TO_HASH;

    static {
        Map<JsonWebSignatureAlgorithm, HashAlgorithm> table = new EnumMap<>(JsonWebSignatureAlgorithm.class);
        table.put(JsonWebSignatureAlgorithm.RS256, HashAlgorithm.SHA256);
        table.put(JsonWebSignatureAlgorithm.PS256, HashAlgorithm.SHA256);
        table.put(JsonWebSignatureAlgorithm.ES256, HashAlgorithm.SHA256);
        table.put(JsonWebSignatureAlgorithm.ES384, HashAlgorithm.SHA384);
        table.put(JsonWebSignatureAlgorithm.ES512, HashAlgorithm.SHA512);
        SIGNATURE_ALGO_TO_HASH = Collections.unmodifiableMap(table);
    }

    private AuthenticationDigest() {
    }

    public static HashAlgorithm hashAlgorithm(JsonWebSignatureAlgorithm algorithm) {
        return hashAlgorithm(SIGNATURE_ALGO_TO_HASH, algorithm);
    }

    static HashAlgorithm hashAlgorithm(Map<JsonWebSignatureAlgorithm, HashAlgorithm> table, JsonWebSignatureAlgorithm algorithm) {
        HashAlgorithm hash = algorithm == null ? null : table.get(algorithm);
        if (hash == null)
            throw new ProgrammingError("Hash algorithm mapping missing for signature algorithm " + algorithm);
        return hash;
    }

    public static byte[] create(Origin origin, ChallengeNonce challengeNonce, JsonWebSignatureAlgorithm algorithm) {
        return create(SIGNATURE_ALGO_TO_HASH, origin, challengeNonce, algorithm);
    }

    static byte[] create(Map<JsonWebSignatureAlgorithm, HashAlgorithm> table, Origin origin, ChallengeNonce challengeNonce, JsonWebSignatureAlgorithm algorithm) {
        return digest(hashAlgorithm(table, algorithm), origin.url(), challengeNonce.value());
    }

    static byte[] digest(HashAlgorithm hash, String origin, String challengeNonce) {
        // Hash origin and nonce separately to keep the fields apart
        byte[] originHash = hash.digest(origin.getBytes(StandardCharsets.UTF_8));
        byte[] challengeNonceHash = hash.digest(challengeNonce.getBytes(StandardCharsets.UTF_8));
        return hash.digest(concatenate(originHash, challengeNonceHash));
    }
}
