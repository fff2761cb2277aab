package pro.javacard.webeid.cli;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

// Command arguments from inline JSON, standard input or a JSON/YAML/properties file
public class ArgumentsParser {

    private static final ObjectMapper json;
    private static final ObjectMapper yaml;
    private static final ObjectMapper props;

    static {
        json = new ObjectMapper();
        json.enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES.mappedFeature());
        json.enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature());
        json.enable(JsonReadFeature.ALLOW_YAML_COMMENTS.mappedFeature());
        json.enable(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature());

        props = new ObjectMapper(new JavaPropsFactory());
        yaml = new ObjectMapper(new YAMLFactory());
    }

    public static JsonNode parsePathOrString(String s) {
        try {
            if (s.equals("-"))
                return parse(System.in);
            if (s.trim().startsWith("{"))
                return parseString(s);
            Path path = Paths.get(s);
            if (Files.isRegularFile(path)) {
                String payload = Files.readString(path).trim();
                if (s.endsWith(".yaml") || s.endsWith(".yml")) {
                    return yaml.readTree(payload);
                } else if (s.endsWith(".properties")) {
                    return props.readTree(payload);
                } else {
                    return json.readTree(payload);
                }
            }
            return parseString(s);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode parseString(String s) throws IOException {
        s = s.trim();
        if (s.startsWith("{"))
            return json.readTree(s);
        throw new IllegalArgumentException("Not a JSON object or file: " + s);
    }

    static JsonNode parse(InputStream in) throws IOException {
        return parseString(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }
}
