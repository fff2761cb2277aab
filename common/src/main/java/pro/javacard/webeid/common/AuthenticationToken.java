package pro.javacard.webeid.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.bouncycastle.util.encoders.Base64;

import java.io.UncheckedIOException;

@JsonPropertyOrder({"unverifiedCertificate", "algorithm", "signature", "format", "appVersion"})
public final class AuthenticationToken {
    public static final String FORMAT = "web-eid:1.0";
    public static final String APP_VERSION_URL = "https://web-eid.eu/web-eid-app/releases/%s";

    static final ObjectMapper mapper = new ObjectMapper();

    private final String unverifiedCertificate;
    private final String algorithm;
    private final String signature;
    private final String appVersion;

    private AuthenticationToken(String unverifiedCertificate, String algorithm, String signature, String appVersion) {
        this.unverifiedCertificate = unverifiedCertificate;
        this.algorithm = algorithm;
        this.signature = signature;
        this.appVersion = appVersion;
    }

    public static AuthenticationToken create(JsonWebSignatureAlgorithm algorithm, byte[] certificateDer, byte[] signature, String version) {
        return new AuthenticationToken(Base64.toBase64String(certificateDer), algorithm.name(),
                Base64.toBase64String(signature), String.format(APP_VERSION_URL, version));
    }

    @JsonProperty("unverifiedCertificate")
    public String getUnverifiedCertificate() {
        return unverifiedCertificate;
    }

    @JsonProperty("algorithm")
    public String getAlgorithm() {
        return algorithm;
    }

    @JsonProperty("signature")
    public String getSignature() {
        return signature;
    }

    @JsonProperty("format")
    public String getFormat() {
        return FORMAT;
    }

    @JsonProperty("appVersion")
    public String getAppVersion() {
        return appVersion;
    }

    public ObjectNode toJSON() {
        return mapper.valueToTree(this);
    }

    @Override
    public String toString() {
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
