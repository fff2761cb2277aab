package pro.javacard.webeid.common;

import java.util.Arrays;
import java.util.Optional;

// Authentication key algorithms, named as in JWS (RFC 7518)
public enum JsonWebSignatureAlgorithm {
    RS256,
    PS256,
    ES256,
    ES384,
    ES512;

    public static Optional<JsonWebSignatureAlgorithm> valueOfName(String name) {
        return Arrays.stream(values()).filter(algorithm -> algorithm.name().equals(name)).findFirst();
    }

    public static JsonWebSignatureAlgorithm fromName(String name) {
        return valueOfName(name).orElseThrow(() -> new ProgrammingError("Unknown signature algorithm " + name));
    }
}
