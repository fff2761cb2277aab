package pro.javacard.webeid.tokens;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.nist.NISTObjectIdentifiers;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.DigestInfo;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pro.javacard.webeid.common.AuthenticationDigest;
import pro.javacard.webeid.common.CryptoUtils;
import pro.javacard.webeid.common.ElectronicID;
import pro.javacard.webeid.common.JsonWebSignatureAlgorithm;
import pro.javacard.webeid.common.PinBuffer;
import pro.javacard.webeid.common.PinInfo;
import pro.javacard.webeid.common.VerifyPinFailed;

import javax.smartcardio.CommandAPDU;
import javax.smartcardio.ResponseAPDU;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.PublicKey;
import java.security.SignatureException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Arrays;
import java.util.zip.GZIPInputStream;

import static pro.javacard.webeid.common.CryptoUtils.concatenate;

/**
 * PIV card application (NIST SP 800-73-4) as an authentication token: the PIV Authentication key (9A)
 * and its certificate, guarded by the application PIN (80).
 */
public class PIVElectronicID implements ElectronicID {
    private static final Logger logger = LoggerFactory.getLogger(PIVElectronicID.class);

    static final byte[] PIV_AID = Hex.decode("A000000308000010000100");
    static final byte[] AUTH_CERTIFICATE_TAG = Hex.decode("5FC105");

    static final int INS_GENERAL_AUTHENTICATE = 0x87;
    static final int INS_GET_DATA = 0xCB;
    static final int PIN_REFERENCE = 0x80;
    static final int AUTH_KEY_REFERENCE = 0x9A;

    static final int ALG_RSA_2048 = 0x07;
    static final int ALG_EC_P256 = 0x11;
    static final int ALG_EC_P384 = 0x14;

    // 6 to 8 characters, padded with 0xFF to 8 bytes
    static final PinInfo PIN_INFO = new PinInfo(6, 8, false);
    static final int PIN_BLOCK = 8;

    // Reported after a successful VERIFY, which resets the counter
    static final int DEFAULT_PIN_RETRIES = 3;

    private final ISO7816Transport transport;
    private final byte[] certificate;
    private final JsonWebSignatureAlgorithm algorithm;
    private final int pivAlgorithm;
    private final int keyLength; // field size for EC, modulus for RSA, in bytes

    private PIVElectronicID(ISO7816Transport transport, byte[] certificate, JsonWebSignatureAlgorithm algorithm, int pivAlgorithm, int keyLength) {
        this.transport = transport;
        this.certificate = certificate.clone();
        this.algorithm = algorithm;
        this.pivAlgorithm = pivAlgorithm;
        this.keyLength = keyLength;
    }

    public static PIVElectronicID getInstance(ISO7816Transport transport) throws IOException {
        transport.check(transport.transceive(new CommandAPDU(0x00, 0xA4, 0x04, 0x00, PIV_AID, 256)), 0x9000);
        byte[] certificate = readCertificate(transport);
        PublicKey key = parseCertificate(certificate).getPublicKey();

        final PIVElectronicID eid;
        if (key instanceof RSAPublicKey) {
            int bits = ((RSAPublicKey) key).getModulus().bitLength();
            if (bits != 2048)
                throw new IOException("Unsupported RSA key size: " + bits);
            eid = new PIVElectronicID(transport, certificate, JsonWebSignatureAlgorithm.RS256, ALG_RSA_2048, 256);
        } else if (key instanceof ECPublicKey) {
            int bits = ((ECPublicKey) key).getParams().getCurve().getField().getFieldSize();
            if (bits == 256)
                eid = new PIVElectronicID(transport, certificate, JsonWebSignatureAlgorithm.ES256, ALG_EC_P256, 32);
            else if (bits == 384)
                eid = new PIVElectronicID(transport, certificate, JsonWebSignatureAlgorithm.ES384, ALG_EC_P384, 48);
            else
                throw new IOException("Unsupported EC key size: " + bits);
        } else {
            throw new IOException("Unsupported authentication key: " + key.getAlgorithm());
        }
        logger.info("PIV authentication key in {} uses {}", transport.getDeviceName(), eid.algorithm);
        return eid;
    }

    static byte[] readCertificate(ISO7816Transport transport) throws IOException {
        ResponseAPDU response = transport.transceive(new CommandAPDU(0x00, INS_GET_DATA, 0x3F, 0xFF, TLV.encode(0x5C, AUTH_CERTIFICATE_TAG), 256));
        if (response.getSW() == 0x6A82)
            throw new IOException("No PIV authentication certificate in " + transport.getDeviceName());
        transport.check(response, 0x9000);

        byte[] object = TLV.get(response.getData(), 0x53);
        byte[] certificate = TLV.get(object, 0x70);
        byte[] info = TLV.find(object, 0x71).orElse(new byte[]{0x00});
        if (info.length > 0 && (info[0] & 0x01) == 0x01) {
            try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(certificate))) {
                certificate = gzip.readAllBytes();
            }
        }
        return certificate;
    }

    static X509Certificate parseCertificate(byte[] certificate) throws IOException {
        try {
            CertificateFactory cf = CertificateFactory.getInstance("X.509");
            return (X509Certificate) cf.generateCertificate(new ByteArrayInputStream(certificate));
        } catch (CertificateException e) {
            throw new IOException("Invalid PIV authentication certificate: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "PIV";
    }

    @Override
    public JsonWebSignatureAlgorithm authSignatureAlgorithm() {
        return algorithm;
    }

    @Override
    public byte[] getAuthCertificate() {
        return certificate.clone();
    }

    @Override
    public PinInfo authPinInfo() {
        return PIN_INFO;
    }

    @Override
    public int authPinRetriesLeft() throws IOException {
        int sw = new ResponseAPDU(transport.transmit(new CommandAPDU(0x00, ISO7816Transport.INS_VERIFY, 0x00, PIN_REFERENCE).getBytes())).getSW();
        if (sw == 0x9000)
            return DEFAULT_PIN_RETRIES;
        if ((sw & 0xFFF0) == 0x63C0)
            return sw & 0x0F;
        if (sw == 0x6983)
            return 0;
        throw new IOException(String.format("Could not read PIN retry counter: 0x%04X", sw));
    }

    @Override
    public byte[] signWithAuthKey(PinBuffer pin, byte[] hash) throws VerifyPinFailed, IOException {
        int expected = AuthenticationDigest.hashAlgorithm(algorithm).getLength();
        if (hash.length != expected)
            throw new IllegalArgumentException(String.format("%s needs a %d byte hash, got %d", algorithm, expected, hash.length));

        transport.beginExclusive();
        try {
            verifyPin(pin);
            byte[] challenge = algorithm == JsonWebSignatureAlgorithm.RS256 ? pkcs1(hash, keyLength) : hash;
            byte[] template = TLV.encode(0x7C, concatenate(TLV.encode(0x82, new byte[0]), TLV.encode(0x81, challenge)));
            ResponseAPDU response = transport.transceive(new CommandAPDU(0x00, INS_GENERAL_AUTHENTICATE, pivAlgorithm, AUTH_KEY_REFERENCE, template, 256));
            if (response.getSW() == 0x6982)
                throw new IOException("Card refused to sign: security status not satisfied");
            transport.check(response, 0x9000);
            byte[] signature = TLV.get(TLV.get(response.getData(), 0x7C), 0x82);
            if (algorithm == JsonWebSignatureAlgorithm.RS256)
                return signature;
            return CryptoUtils.der2rs(signature, keyLength);
        } catch (SignatureException e) {
            throw new IOException("Invalid signature from card: " + e.getMessage(), e);
        } finally {
            transport.endExclusive();
        }
    }

    void verifyPin(PinBuffer pin) throws IOException {
        if (!PIN_INFO.isValidLength(pin.length()))
            throw new VerifyPinFailed(VerifyPinFailed.Status.INVALID_PIN_LENGTH, authPinRetriesLeft());

        // Raw transmit, so the PIN exists in this buffer only
        byte[] apdu = new byte[5 + PIN_BLOCK];
        try {
            apdu[1] = (byte) ISO7816Transport.INS_VERIFY;
            apdu[3] = (byte) PIN_REFERENCE;
            apdu[4] = PIN_BLOCK;
            Arrays.fill(apdu, 5, apdu.length, (byte) 0xFF);
            pin.copyTo(apdu, 5);
            int sw = new ResponseAPDU(transport.transmit(apdu)).getSW();
            if (sw == 0x9000)
                return;
            if ((sw & 0xFFF0) == 0x63C0) {
                int retries = sw & 0x0F;
                throw new VerifyPinFailed(retries == 0 ? VerifyPinFailed.Status.PIN_BLOCKED : VerifyPinFailed.Status.RETRY_ALLOWED, retries);
            }
            if (sw == 0x6983)
                throw VerifyPinFailed.blocked();
            throw new IOException(String.format("PIN verification failed: 0x%04X", sw));
        } finally {
            Arrays.fill(apdu, (byte) 0x00);
        }
    }

    // EMSA-PKCS1-v1_5 encoding of a SHA-256 hash, the card does raw RSA
    static byte[] pkcs1(byte[] hash, int keyLength) throws IOException {
        byte[] digestInfo = new DigestInfo(new AlgorithmIdentifier(NISTObjectIdentifiers.id_sha256, DERNull.INSTANCE), hash).getEncoded(ASN1Encoding.DER);
        if (digestInfo.length + 11 > keyLength)
            throw new IllegalArgumentException("Key too short for DigestInfo");
        byte[] block = new byte[keyLength];
        block[1] = 0x01;
        Arrays.fill(block, 2, keyLength - digestInfo.length - 1, (byte) 0xFF);
        System.arraycopy(digestInfo, 0, block, keyLength - digestInfo.length, digestInfo.length);
        return block;
    }

    @Override
    public String toString() {
        return String.format("PIV in %s (%s)", transport.getDeviceName(), algorithm);
    }
}
