package pro.javacard.webeid.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * The "authenticate" command: signs the origin and challenge nonce with the authentication key of a
 * security token and returns the Web eID authentication token.
 */
public class Authenticate {
    private static final Logger logger = LoggerFactory.getLogger(Authenticate.class);

    private final AuthenticateArguments arguments;
    private final String appVersion;

    public Authenticate(AuthenticateArguments arguments, String appVersion) {
        this.arguments = arguments;
        this.appVersion = appVersion;
    }

    public static Authenticate fromJSON(JsonNode arguments, String appVersion) {
        return new Authenticate(AuthenticateArguments.fromJSON(arguments), appVersion);
    }

    public AuthenticateArguments getArguments() {
        return arguments;
    }

    public Optional<AuthenticationToken> authenticate(ElectronicID eid, PinProvider pinProvider, AuthenticationUI ui) throws IOException {
        return authenticate(eid, eid.getAuthCertificate(), pinProvider, ui);
    }

    /**
     * Runs one attempt.
     *
     * @return the token, or empty if the user cancelled or PIN entry timed out
     * @throws RecoverableAuthError if the attempt can be repeated with a new PIN
     * @throws VerifyPinFailed      if no retries remain
     */
    public Optional<AuthenticationToken> authenticate(ElectronicID eid, byte[] certificateDer, PinProvider pinProvider, AuthenticationUI ui) throws IOException {
        PinFailureClassifier classifier = new PinFailureClassifier(ui);
        try {
            JsonWebSignatureAlgorithm algorithm = eid.authSignatureAlgorithm();
            if (eid.authPinRetriesLeft() == 0)
                throw VerifyPinFailed.blocked();

            final byte[] signature;
            try (PinBuffer pin = new PinBuffer()) {
                // PIN pad readers collect the PIN themselves
                if (!eid.authPinInfo().hasPinPad())
                    pinProvider.getPin(pin, eid);
                signature = AuthenticationSigner.createSignature(arguments.getOrigin(), arguments.getChallengeNonce(), eid, pin);
            }
            logger.info("Signed authentication challenge for {} with {} ({})", arguments.getOrigin(), eid.name(), algorithm);
            return Optional.of(AuthenticationToken.create(algorithm, certificateDer, signature, appVersion));
        } catch (VerifyPinFailed failure) {
            classifier.handle(failure);
            return Optional.empty();
        }
    }
}
