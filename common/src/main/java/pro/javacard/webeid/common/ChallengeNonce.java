package pro.javacard.webeid.common;

import java.util.Objects;

public final class ChallengeNonce {
    // At least 256 bits of entropy, usually Base64-encoded: 32 bytes are 44 characters.
    public static final int MIN_LENGTH = 44;
    public static final int MAX_LENGTH = 128;

    private final String value;

    private ChallengeNonce(String value) {
        this.value = value;
    }

    public static ChallengeNonce valueOf(String nonce) {
        Objects.requireNonNull(nonce, "nonce");
        if (nonce.length() < MIN_LENGTH)
            throw new InputDataError(String.format("Challenge nonce argument 'challengeNonce' must be at least %d characters long", MIN_LENGTH));
        if (nonce.length() > MAX_LENGTH)
            throw new InputDataError(String.format("Challenge nonce argument 'challengeNonce' cannot be longer than %d characters", MAX_LENGTH));
        return new ChallengeNonce(nonce);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChallengeNonce)) return false;
        return value.equals(((ChallengeNonce) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
