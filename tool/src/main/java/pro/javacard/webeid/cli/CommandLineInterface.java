package pro.javacard.webeid.cli;

import joptsimple.BuiltinHelpFormatter;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

abstract class CommandLineInterface {
    static final String VERSION = "0.1";
    protected static OptionParser parser = new OptionParser();

    // Generic options
    protected static OptionSpec<Void> OPT_VERSION = parser.acceptsAll(Arrays.asList("V", "version"), "Show program version");
    protected static OptionSpec<Void> OPT_HELP = parser.acceptsAll(Arrays.asList("h", "help"), "Show information about the program").forHelp();
    protected static OptionSpec<Void> OPT_DEBUG = parser.acceptsAll(Arrays.asList("debug"), "Show APDU traces");
    protected static OptionSpec<Void> OPT_VERBOSE = parser.acceptsAll(Arrays.asList("v", "verbose"), "Be verbose");

    // Reader options
    protected static OptionSpec<String> OPT_READER = parser.acceptsAll(Arrays.asList("r", "reader"), "Use specific PC/SC reader (list without argument)").withOptionalArg().describedAs("reader");

    // PIN options
    protected static OptionSpec<String> OPT_PIN = parser.acceptsAll(Arrays.asList("p", "pin"), "Use PIN").withOptionalArg().describedAs("PIN");

    // Authentication
    protected static OptionSpec<String> OPT_AUTHENTICATE = parser.acceptsAll(Arrays.asList("a", "authenticate"), "Authenticate with arguments").withRequiredArg().describedAs("json/file/-");
    protected static OptionSpec<String> OPT_NONCE = parser.acceptsAll(Arrays.asList("nonce"), "Challenge nonce").availableUnless(OPT_AUTHENTICATE).withRequiredArg().describedAs("base64");
    protected static OptionSpec<String> OPT_ORIGIN = parser.acceptsAll(Arrays.asList("origin"), "Origin").availableUnless(OPT_AUTHENTICATE).requiredIf(OPT_NONCE).withRequiredArg().describedAs("https://host[:port]");
    protected static OptionSpec<String> OPT_LANG = parser.acceptsAll(Arrays.asList("lang"), "Language code").availableUnless(OPT_AUTHENTICATE).withRequiredArg().describedAs("code");

    protected static <V> Optional<V> optional(OptionSet args, OptionSpec<V> v) {
        return args.hasArgument(v) ? Optional.ofNullable(args.valueOf(v)) : Optional.empty();
    }

    protected static OptionSet parseArguments(String[] argv) throws IOException {
        OptionSet args = null;

        parser.formatHelpWith(new BuiltinHelpFormatter(100, 3));
        // Parse arguments
        try {
            args = parser.parse(argv);
        } catch (OptionException e) {
            parser.printHelpOn(System.err);
            System.err.println();
            if (e.getCause() != null) {
                System.err.println(e.getMessage() + ": " + e.getCause().getMessage());
            } else {
                System.err.println(e.getMessage());
            }
            exitWith(1);
            throw new IllegalStateException("Not reached");
        }

        if (args.nonOptionArguments().size() > 0) {
            System.err.println();
            System.err.println("Invalid non-option arguments: " + args.nonOptionArguments().stream().map(e -> e.toString()).collect(Collectors.joining(" ")));
            System.err.println("Try web-eid --help");
            exitWith(1);
        }

        if (args.has(OPT_HELP) || args.specs().size() == 0) {
            parser.printHelpOn(System.out);
            exitWith(0);
        }

        return args;
    }

    static void exitWith(int code) {
        System.exit(code);
    }

    static boolean requiresCard(OptionSet options) {
        return options.has(OPT_AUTHENTICATE) || options.has(OPT_NONCE);
    }
}
