package pro.javacard.webeid.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

// Validated arguments of the "authenticate" command
public final class AuthenticateArguments {
    public static final String CHALLENGE_NONCE = "challengeNonce";
    public static final String ORIGIN = "origin";
    public static final String LANG = "lang";

    static final String EXPECTED = "\"challengeNonce\": \"<challenge nonce>\", \"origin\": \"<origin URL>\"";

    private final ChallengeNonce challengeNonce;
    private final Origin origin;
    private final String lang;

    private AuthenticateArguments(ChallengeNonce challengeNonce, Origin origin, String lang) {
        this.challengeNonce = challengeNonce;
        this.origin = origin;
        this.lang = lang;
    }

    public static AuthenticateArguments fromJSON(JsonNode arguments) {
        requireArgumentsAndOptionalLang(List.of(CHALLENGE_NONCE, ORIGIN), arguments, EXPECTED);

        ChallengeNonce nonce = ChallengeNonce.valueOf(stringArgument(CHALLENGE_NONCE, arguments));
        Origin origin = Origin.valueOf(stringArgument(ORIGIN, arguments));
        String lang = arguments.has(LANG) ? stringArgument(LANG, arguments) : null;
        return new AuthenticateArguments(nonce, origin, lang);
    }

    public static AuthenticateArguments of(String challengeNonce, String origin) {
        ObjectNode arguments = JsonNodeFactory.instance.objectNode();
        arguments.put(CHALLENGE_NONCE, challengeNonce);
        arguments.put(ORIGIN, origin);
        return fromJSON(arguments);
    }

    static void requireArgumentsAndOptionalLang(Collection<String> required, JsonNode arguments, String expected) {
        String shape = String.format("{%s, \"lang\": \"<language code>\" (optional)}", expected);
        if (arguments == null || !arguments.isObject())
            throw new InputDataError("Arguments must be an object: " + shape);

        Set<String> present = new HashSet<>();
        arguments.fieldNames().forEachRemaining(present::add);
        Set<String> allowed = new HashSet<>(required);
        allowed.add(LANG);

        if (!present.containsAll(required) || !allowed.containsAll(present))
            throw new InputDataError("Arguments must be " + shape + ", got " + present);
    }

    static String stringArgument(String name, JsonNode arguments) {
        JsonNode value = arguments.get(name);
        if (value == null || !value.isTextual() || value.asText().isEmpty())
            throw new InputDataError(String.format("Argument '%s' must be a non-empty string", name));
        return value.asText();
    }

    public ChallengeNonce getChallengeNonce() {
        return challengeNonce;
    }

    public Origin getOrigin() {
        return origin;
    }

    public Optional<String> getLang() {
        return Optional.ofNullable(lang);
    }
}
