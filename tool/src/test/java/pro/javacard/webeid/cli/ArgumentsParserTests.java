package pro.javacard.webeid.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;

public class ArgumentsParserTests {
    static final String NONCE = "12345678901234567890123456789012345678901234";

    @Test
    public void testInline() {
        JsonNode node = ArgumentsParser.parsePathOrString("{challengeNonce: '" + NONCE + "', origin: 'https://example.com'}");
        Assert.assertEquals(node.get("challengeNonce").asText(), NONCE);
        Assert.assertEquals(node.get("origin").asText(), "https://example.com");
    }

    @Test
    public void testYaml() throws Exception {
        Path file = Files.createTempFile("authenticate", ".yaml");
        try {
            Files.writeString(file, "challengeNonce: \"" + NONCE + "\"\norigin: https://example.com\nlang: et\n");
            JsonNode node = ArgumentsParser.parsePathOrString(file.toString());
            Assert.assertEquals(node.get("challengeNonce").asText(), NONCE);
            Assert.assertEquals(node.get("lang").asText(), "et");
        } finally {
            Files.delete(file);
        }
    }

    @Test
    public void testProperties() throws Exception {
        Path file = Files.createTempFile("authenticate", ".properties");
        try {
            Files.writeString(file, "challengeNonce=" + NONCE + "\norigin=https://example.com\n");
            JsonNode node = ArgumentsParser.parsePathOrString(file.toString());
            Assert.assertEquals(node.get("origin").asText(), "https://example.com");
        } finally {
            Files.delete(file);
        }
    }

    @Test
    public void testJsonFile() throws Exception {
        Path file = Files.createTempFile("authenticate", ".json");
        try {
            Files.writeString(file, "{\"challengeNonce\": \"" + NONCE + "\", \"origin\": \"https://example.com\"}");
            Assert.assertEquals(ArgumentsParser.parsePathOrString(file.toString()).size(), 2);
        } finally {
            Files.delete(file);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNotJson() {
        ArgumentsParser.parsePathOrString("no-such-file.json");
    }
}
