package pro.javacard.webeid.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.security.auth.callback.*;
import java.io.Console;
import java.io.IOException;

public class CLICallbacks implements CallbackHandler {
    private static final Logger logger = LoggerFactory.getLogger(CLICallbacks.class);

    static final String ENV_WEBEID_PIN = "WEBEID_PIN";

    @Override
    public void handle(Callback[] callbacks) throws IOException, UnsupportedCallbackException {
        if (callbacks.length != 1)
            throw new IOException("Only one callback allowed");
        if (callbacks[0] instanceof PasswordCallback) {
            PasswordCallback pwc = (PasswordCallback) callbacks[0];
            if (System.getenv().containsKey(ENV_WEBEID_PIN)) {
                logger.warn("Using ${} for PIN", ENV_WEBEID_PIN);
                pwc.setPassword(System.getenv(ENV_WEBEID_PIN).toCharArray());
            } else {
                Console console = System.console();
                if (console == null)
                    throw new IOException("No console for PIN entry, use $" + ENV_WEBEID_PIN);
                // null on end of input, which cancels PIN entry
                pwc.setPassword(console.readPassword("%s: ", pwc.getPrompt()));
            }
        } else if (callbacks[0] instanceof TextOutputCallback) {
            TextOutputCallback toc = (TextOutputCallback) callbacks[0];
            String prefix = toc.getMessageType() == TextOutputCallback.ERROR ? "Error: " : toc.getMessageType() == TextOutputCallback.WARNING ? "Warning: " : "";
            System.err.printf("%s%s%n", prefix, toc.getMessage());
        } else throw new UnsupportedCallbackException(callbacks[0]);
    }

    public static boolean hasPIN() {
        return System.getenv().containsKey(ENV_WEBEID_PIN);
    }
}
