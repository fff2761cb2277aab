package pro.javacard.webeid.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import joptsimple.OptionSet;
import pro.javacard.webeid.common.AuthenticateArguments;
import pro.javacard.webeid.common.Authenticate;
import pro.javacard.webeid.common.AuthenticationToken;
import pro.javacard.webeid.common.AuthenticationUI;
import pro.javacard.webeid.common.CallbackHandlerUI;
import pro.javacard.webeid.common.ElectronicID;
import pro.javacard.webeid.common.PinProvider;
import pro.javacard.webeid.common.RecoverableAuthError;
import pro.javacard.webeid.tokens.PCSCTransport;
import pro.javacard.webeid.tokens.PIVElectronicID;

import javax.security.auth.callback.CallbackHandler;
import javax.security.auth.callback.TextOutputCallback;
import javax.security.auth.callback.UnsupportedCallbackException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.stream.Collectors;

public final class WebEidTool extends CommandLineInterface {
    static final String ENV_WEBEID_READER = "WEBEID_READER";

    static CallbackHandler handler; // We initialize this after logging options

    static final ObjectMapper mapper = new ObjectMapper();

    static void setupLogging(OptionSet args) {
        // Set up slf4j simple in a way that pleases us. NB! No logging before this call
        System.setProperty("org.slf4j.simpleLogger.showThreadName", "false");
        System.setProperty("org.slf4j.simpleLogger.levelInBrackets", "true");
        System.setProperty("org.slf4j.simpleLogger.showShortLogName", "true");
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "warn");

        if (args.has(OPT_VERBOSE)) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "info");
        }
        if (args.has(OPT_DEBUG)) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
            System.setProperty("org.slf4j.simpleLogger.showDateTime", "true");
            System.setProperty("org.slf4j.simpleLogger.dateTimeFormat", "HH:mm:ss:SSS");
        }

        if (args.has(OPT_DEBUG) && System.getenv().containsKey("WEBEID_TRACE")) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "trace");
        }
    }

    static Optional<String> logAndUseEnvironment(CallbackHandler handler, String env) {
        return Optional.ofNullable(System.getenv(env)).map(s -> {
            try {
                TextOutputCallback toc = new TextOutputCallback(TextOutputCallback.INFORMATION, String.format("Using $%s", env));
                handler.handle(new TextOutputCallback[]{toc});
                return s;
            } catch (UnsupportedCallbackException e) {
                throw new IllegalStateException("Invalid codebase");
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    static JsonNode commandArguments(OptionSet options) {
        if (options.has(OPT_AUTHENTICATE))
            return ArgumentsParser.parsePathOrString(options.valueOf(OPT_AUTHENTICATE));
        ObjectNode arguments = JsonNodeFactory.instance.objectNode();
        arguments.put(AuthenticateArguments.CHALLENGE_NONCE, options.valueOf(OPT_NONCE));
        arguments.put(AuthenticateArguments.ORIGIN, options.valueOf(OPT_ORIGIN));
        optional(options, OPT_LANG).ifPresent(lang -> arguments.put(AuthenticateArguments.LANG, lang));
        return arguments;
    }

    static String chooseReader(List<String> readers, Optional<String> readerName) {
        if (readers.size() == 0)
            throw new IllegalArgumentException("No PC/SC readers available!");
        if (readerName.isEmpty()) {
            if (readers.size() == 1)
                return readers.get(0);
            throw new IllegalArgumentException("More than one reader, specify one with " + OPT_READER);
        }
        String q = readerName.get().toLowerCase(Locale.ROOT);
        List<String> filtered = readers.stream().filter(r -> r.equalsIgnoreCase(q)).collect(Collectors.toList());
        if (filtered.size() != 1) // No uniq match, try "search"
            filtered = readers.stream().filter(r -> q.length() > 2 && r.toLowerCase(Locale.ROOT).contains(q)).collect(Collectors.toList());
        if (filtered.size() == 0)
            throw new IllegalArgumentException("Reader not found: " + readerName.get() + " in " + readers);
        else if (filtered.size() > 1)
            throw new IllegalArgumentException("Name not unique: " + readerName.get());
        return filtered.get(0);
    }

    // PIN given on the command line
    static PinProvider fixedPin(String value) {
        return (pin, eid) -> pin.append(value.toCharArray());
    }

    public static void main(String[] args) {
        try {
            OptionSet options = parseArguments(args);
            setupLogging(options);

            handler = new CLICallbacks(); // contains logger

            if (options.has(OPT_VERBOSE) || options.has(OPT_VERSION)) {
                System.out.println("# web-eid utility v" + VERSION);
                if (options.has(OPT_VERBOSE)) {
                    System.out.printf("# Running on %s %s %s", System.getProperty("os.name"), System.getProperty("os.version"), System.getProperty("os.arch"));
                    System.out.printf(", Java %s by %s%n", System.getProperty("java.version"), System.getProperty("java.vendor"));
                }
            }

            // -r without parameter - list readers
            if (options.has(OPT_READER) && !options.hasArgument(OPT_READER)) {
                System.out.println("PC/SC readers:");
                for (String reader : PCSCTransport.list()) {
                    System.out.printf("- %s%n", reader);
                }
                exitWith(0);
            }

            if (!requiresCard(options)) {
                if (!options.has(OPT_VERSION))
                    System.err.println("Nothing to do! Use --authenticate or --nonce with --origin");
                exitWith(options.has(OPT_VERSION) ? 0 : 1);
            }

            // Arguments are checked before the card is touched
            Authenticate authenticate = Authenticate.fromJSON(commandArguments(options), VERSION);

            Optional<String> readerName = optional(options, OPT_READER).or(() -> logAndUseEnvironment(handler, ENV_WEBEID_READER));
            String reader = chooseReader(PCSCTransport.list(), readerName);
            if (options.has(OPT_VERBOSE)) {
                System.out.printf("# Using reader: %s%n", reader);
            }

            CallbackHandlerUI ui = new CallbackHandlerUI(handler);
            boolean interactive = !options.hasArgument(OPT_PIN) && !CLICallbacks.hasPIN();
            PinProvider pinProvider = options.hasArgument(OPT_PIN) ? fixedPin(options.valueOf(OPT_PIN)) : ui;

            final Optional<AuthenticationToken> token;
            try (PCSCTransport transport = PCSCTransport.getInstance(reader)) {
                PIVElectronicID eid = PIVElectronicID.getInstance(transport);
                token = authenticate(authenticate, eid, pinProvider, ui, interactive);
            }

            if (token.isEmpty()) {
                System.err.println("Authentication cancelled");
                exitWith(1);
                return;
            }
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(token.get().toJSON()));
        } catch (Throwable e) {
            System.err.printf("%s: %s%n", e.getClass().getSimpleName(), e.getMessage());
            if (Boolean.parseBoolean(System.getenv().getOrDefault("WEBEID_TRACE", "false"))) {
                e.printStackTrace(System.err);
            }
            exitWith(2);
        }
        exitWith(0);
    }

    // Repeats PIN entry while the card allows, if the PIN comes from the user
    static Optional<AuthenticationToken> authenticate(Authenticate authenticate, ElectronicID eid, PinProvider pinProvider, AuthenticationUI ui, boolean interactive) throws IOException {
        while (true) {
            try {
                return authenticate.authenticate(eid, pinProvider, ui);
            } catch (RecoverableAuthError e) {
                if (!interactive)
                    throw e;
            }
        }
    }
}
