package pro.javacard.webeid.common;

import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

// Byte blob and signature encoding helpers
public final class CryptoUtils {

    private CryptoUtils() {
    }

    public static byte[] concatenate(byte[]... args) {
        int length = 0, pos = 0;
        for (byte[] arg : args) {
            length += arg.length;
        }
        byte[] result = new byte[length];
        for (byte[] arg : args) {
            System.arraycopy(arg, 0, result, pos, arg.length);
            pos += arg.length;
        }
        return result;
    }

    // Right-align byte array to the specified size, padding with 0 from left if needed,
    // taking only rightmost bytes if more than len present
    public static byte[] leftpad(byte[] bytes, int len) {
        byte[] nv = new byte[len];
        if (bytes.length < len) {
            System.arraycopy(bytes, 0, nv, len - bytes.length, bytes.length);
        } else {
            System.arraycopy(bytes, bytes.length - len, nv, 0, len);
        }
        return nv;
    }

    // Convert DER (as returned by cards and Java) to the fixed length R||S used by JWS
    public static byte[] der2rs(byte[] der, int len) throws SignatureException {
        try {
            ASN1Sequence sequence = ASN1Sequence.getInstance(der);
            if (sequence.size() != 2)
                throw new SignatureException("ECDSA signature must have two components: " + sequence.size());
            BigInteger r = ASN1Integer.getInstance(sequence.getObjectAt(0)).getPositiveValue();
            BigInteger s = ASN1Integer.getInstance(sequence.getObjectAt(1)).getPositiveValue();
            if (r.bitLength() > len * 8 || s.bitLength() > len * 8)
                throw new SignatureException("ECDSA signature component longer than " + len + " bytes");
            return concatenate(leftpad(r.toByteArray(), len), leftpad(s.toByteArray(), len));
        } catch (IllegalArgumentException e) {
            throw new SignatureException("Can not parse DER signature: " + e.getMessage(), e);
        }
    }

    // Convert the R||S representation to DER (as used by Java)
    public static byte[] rs2der(byte[] rs) throws SignatureException {
        if (rs.length % 2 != 0) {
            throw new IllegalArgumentException("R||S representation must be even bytes: " + rs.length);
        }
        try {
            byte[] r = Arrays.copyOfRange(rs, 0, rs.length / 2);
            byte[] s = Arrays.copyOfRange(rs, rs.length / 2, rs.length);
            ASN1EncodableVector v = new ASN1EncodableVector();
            v.add(new ASN1Integer(new BigInteger(1, r)));
            v.add(new ASN1Integer(new BigInteger(1, s)));
            return new DERSequence(v).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new SignatureException("Can not convert R||S to DER: " + e.getMessage());
        }
    }
}
