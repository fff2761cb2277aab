package pro.javacard.webeid.common;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import javax.security.auth.callback.Callback;
import javax.security.auth.callback.PasswordCallback;
import javax.security.auth.callback.TextOutputCallback;
import javax.security.auth.callback.UnsupportedCallbackException;
import java.util.ArrayList;
import java.util.List;

public class CallbackHandlerUITests {
    TestElectronicID eid;
    List<String> messages;
    String prompt;

    @BeforeMethod
    public void setUp() throws Exception {
        eid = new TestElectronicID();
        messages = new ArrayList<>();
    }

    CallbackHandlerUI ui(String pin) {
        return new CallbackHandlerUI(callbacks -> {
            for (Callback c : callbacks) {
                if (c instanceof PasswordCallback) {
                    PasswordCallback pc = (PasswordCallback) c;
                    prompt = pc.getPrompt();
                    pc.setPassword(pin == null ? null : pin.toCharArray());
                } else if (c instanceof TextOutputCallback) {
                    TextOutputCallback toc = (TextOutputCallback) c;
                    messages.add(toc.getMessageType() + ":" + toc.getMessage());
                } else throw new UnsupportedCallbackException(c);
            }
        });
    }

    @Test
    public void testPin() throws Exception {
        try (PinBuffer pin = new PinBuffer()) {
            ui("12345").getPin(pin, eid);
            Assert.assertEquals(pin.length(), 5);
            Assert.assertEquals(prompt, "Test authentication PIN (4-12 digits)");
        }
    }

    @Test
    public void testCancel() throws Exception {
        eid.retries = 2;
        try (PinBuffer pin = new PinBuffer()) {
            VerifyPinFailed e = Assert.expectThrows(VerifyPinFailed.class, () -> ui(null).getPin(pin, eid));
            Assert.assertEquals(e.status(), VerifyPinFailed.Status.PIN_ENTRY_CANCEL);
            Assert.assertEquals(e.retries(), 2);
            Assert.assertTrue(pin.isEmpty());
        }
    }

    @Test
    public void testLength() throws Exception {
        try (PinBuffer pin = new PinBuffer()) {
            VerifyPinFailed e = Assert.expectThrows(VerifyPinFailed.class, () -> ui("123").getPin(pin, eid));
            Assert.assertEquals(e.status(), VerifyPinFailed.Status.INVALID_PIN_LENGTH);
            Assert.assertEquals(e.retries(), 3);
            Assert.assertTrue(pin.isEmpty());
        }
    }

    @Test
    public void testMessages() {
        CallbackHandlerUI ui = ui(null);
        ui.onVerifyPinFailed(VerifyPinFailed.Status.RETRY_ALLOWED, 2);
        ui.onVerifyPinFailed(VerifyPinFailed.Status.RETRY_ALLOWED, 0);
        ui.onVerifyPinFailed(VerifyPinFailed.Status.PIN_BLOCKED, 0);
        ui.onVerificationDisabled();
        Assert.assertEquals(messages, List.of(
                TextOutputCallback.WARNING + ":Wrong PIN, 2 attempts left",
                TextOutputCallback.ERROR + ":Wrong PIN, no attempts left",
                TextOutputCallback.ERROR + ":PIN is blocked",
                TextOutputCallback.WARNING + ":PIN verification is disabled on this card"));
    }
}
