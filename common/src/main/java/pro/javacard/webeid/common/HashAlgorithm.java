package pro.javacard.webeid.common;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;

public enum HashAlgorithm {
    SHA256("SHA-256", 32),
    SHA384("SHA-384", 48),
    SHA512("SHA-512", 64);

    private final String jcaName;
    private final int length;

    HashAlgorithm(String jcaName, int length) {
        this.jcaName = jcaName;
        this.length = length;
    }

    public int getLength() {
        return length;
    }

    public byte[] digest(byte[] data) {
        try {
            return MessageDigest.getInstance(jcaName).digest(data);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException(e);
        }
    }
}
