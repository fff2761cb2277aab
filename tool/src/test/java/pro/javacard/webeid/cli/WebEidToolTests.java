package pro.javacard.webeid.cli;

import com.fasterxml.jackson.databind.JsonNode;
import joptsimple.OptionException;
import joptsimple.OptionSet;
import org.testng.Assert;
import org.testng.annotations.Test;
import pro.javacard.webeid.common.Authenticate;
import pro.javacard.webeid.common.AuthenticateArguments;
import pro.javacard.webeid.common.AuthenticationToken;
import pro.javacard.webeid.common.AuthenticationUI;
import pro.javacard.webeid.common.ElectronicID;
import pro.javacard.webeid.common.InputDataError;
import pro.javacard.webeid.common.JsonWebSignatureAlgorithm;
import pro.javacard.webeid.common.PinBuffer;
import pro.javacard.webeid.common.PinInfo;
import pro.javacard.webeid.common.PinProvider;
import pro.javacard.webeid.common.RecoverableAuthError;
import pro.javacard.webeid.common.VerifyPinFailed;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class WebEidToolTests {
    static final String NONCE = "12345678901234567890123456789012345678901234";
    static final List<String> READERS = List.of("ACS ACR39U 00 00", "Yubico YubiKey OTP+FIDO+CCID 01 00", "Yubico YubiKey CCID 02 00");

    @Test
    public void testArgumentsFromOptions() {
        OptionSet options = WebEidTool.parser.parse("--nonce", NONCE, "--origin", "https://example.com", "--lang", "en");
        Assert.assertTrue(WebEidTool.requiresCard(options));
        JsonNode arguments = WebEidTool.commandArguments(options);
        Authenticate authenticate = Authenticate.fromJSON(arguments, WebEidTool.VERSION);
        Assert.assertEquals(authenticate.getArguments().getOrigin().url(), "https://example.com");
        Assert.assertEquals(authenticate.getArguments().getLang(), Optional.of("en"));
    }

    @Test
    public void testArgumentsFromJSON() {
        OptionSet options = WebEidTool.parser.parse("-a", "{\"challengeNonce\": \"" + NONCE + "\", \"origin\": \"wss://example.com\"}");
        Authenticate authenticate = Authenticate.fromJSON(WebEidTool.commandArguments(options), WebEidTool.VERSION);
        Assert.assertEquals(authenticate.getArguments().getChallengeNonce().value(), NONCE);
    }

    @Test(expectedExceptions = InputDataError.class)
    public void testBadOrigin() {
        OptionSet options = WebEidTool.parser.parse("--nonce", NONCE, "--origin", "http://example.com");
        Authenticate.fromJSON(WebEidTool.commandArguments(options), WebEidTool.VERSION);
    }

    @Test(expectedExceptions = OptionException.class)
    public void testNonceNeedsOrigin() {
        WebEidTool.parser.parse("--nonce", NONCE);
    }

    @Test
    public void testChooseReader() {
        Assert.assertEquals(WebEidTool.chooseReader(List.of("Only reader"), Optional.empty()), "Only reader");
        Assert.assertEquals(WebEidTool.chooseReader(READERS, Optional.of("acs")), "ACS ACR39U 00 00");
        Assert.assertEquals(WebEidTool.chooseReader(READERS, Optional.of("yubikey ccid")), "Yubico YubiKey CCID 02 00");
        Assert.assertEquals(WebEidTool.chooseReader(READERS, Optional.of("ACS ACR39U 00 00")), "ACS ACR39U 00 00");

        Assert.expectThrows(IllegalArgumentException.class, () -> WebEidTool.chooseReader(READERS, Optional.empty()));
        Assert.expectThrows(IllegalArgumentException.class, () -> WebEidTool.chooseReader(READERS, Optional.of("yubico")));
        Assert.expectThrows(IllegalArgumentException.class, () -> WebEidTool.chooseReader(READERS, Optional.of("gemalto")));
        Assert.expectThrows(IllegalArgumentException.class, () -> WebEidTool.chooseReader(List.of(), Optional.empty()));
    }

    // Rejects the first PIN with two retries left, accepts the next one
    static class WrongPinOnceElectronicID implements ElectronicID {
        int signCalls = 0;

        @Override
        public String name() {
            return "Stub";
        }

        @Override
        public JsonWebSignatureAlgorithm authSignatureAlgorithm() {
            return JsonWebSignatureAlgorithm.ES256;
        }

        @Override
        public byte[] getAuthCertificate() {
            return new byte[]{0x30, 0x00};
        }

        @Override
        public PinInfo authPinInfo() {
            return new PinInfo(4, 12, false);
        }

        @Override
        public int authPinRetriesLeft() {
            return signCalls == 1 ? 2 : 3;
        }

        @Override
        public byte[] signWithAuthKey(PinBuffer pin, byte[] hash) {
            if (signCalls++ == 0)
                throw new VerifyPinFailed(VerifyPinFailed.Status.RETRY_ALLOWED, 2);
            return new byte[64];
        }
    }

    static class RecordingUI implements AuthenticationUI {
        final List<String> events = new ArrayList<>();

        @Override
        public void onVerifyPinFailed(VerifyPinFailed.Status status, int retriesLeft) {
            events.add(status + ":" + retriesLeft);
        }

        @Override
        public void onVerificationDisabled() {
            events.add("DISABLED");
        }
    }

    static Authenticate authenticate() {
        return new Authenticate(AuthenticateArguments.of(NONCE, "https://example.com"), WebEidTool.VERSION);
    }

    @Test
    public void testInteractivePinIsAskedAgain() throws Exception {
        WrongPinOnceElectronicID eid = new WrongPinOnceElectronicID();
        RecordingUI ui = new RecordingUI();
        List<Integer> prompts = new ArrayList<>();
        PinProvider provider = (pin, token) -> {
            prompts.add(prompts.size());
            pin.append("1234".toCharArray());
        };

        Optional<AuthenticationToken> token = WebEidTool.authenticate(authenticate(), eid, provider, ui, true);
        Assert.assertTrue(token.isPresent());
        Assert.assertEquals(token.get().getAlgorithm(), "ES256");
        Assert.assertEquals(eid.signCalls, 2);
        Assert.assertEquals(prompts.size(), 2);
        Assert.assertEquals(ui.events, List.of("RETRY_ALLOWED:2"));
    }

    @Test
    public void testFixedPinIsNotRetried() {
        WrongPinOnceElectronicID eid = new WrongPinOnceElectronicID();
        RecordingUI ui = new RecordingUI();

        RecoverableAuthError e = Assert.expectThrows(RecoverableAuthError.class,
                () -> WebEidTool.authenticate(authenticate(), eid, WebEidTool.fixedPin("1234"), ui, false));
        Assert.assertEquals(e.getFailure().status(), VerifyPinFailed.Status.RETRY_ALLOWED);
        Assert.assertEquals(e.getFailure().retries(), 2);
        Assert.assertEquals(eid.signCalls, 1);
        Assert.assertEquals(ui.events, List.of("RETRY_ALLOWED:2"));
    }
}
