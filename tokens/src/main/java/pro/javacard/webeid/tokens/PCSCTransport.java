package pro.javacard.webeid.tokens;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.smartcardio.Card;
import javax.smartcardio.CardChannel;
import javax.smartcardio.CardException;
import javax.smartcardio.CardTerminal;
import javax.smartcardio.CommandAPDU;
import javax.smartcardio.TerminalFactory;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

public class PCSCTransport extends ISO7816Transport {
    private static final Logger logger = LoggerFactory.getLogger(PCSCTransport.class);

    private final Card card;
    private final CardChannel channel;
    private final String terminalName;

    private PCSCTransport(Card card, String terminalName) {
        this.card = card;
        this.channel = card.getBasicChannel();
        this.terminalName = terminalName;
    }

    public static PCSCTransport getInstance(String readerName) {
        CardTerminal terminal = TerminalFactory.getDefault().terminals().getTerminal(readerName);
        if (terminal == null)
            throw new IllegalArgumentException("Reader not found: " + readerName);
        return getInstance(terminal);
    }

    public static PCSCTransport getInstance(CardTerminal terminal) {
        try {
            Card card = terminal.connect("*");
            logger.info("Connected to {} in {}", card.getProtocol(), terminal.getName());
            return new PCSCTransport(card, terminal.getName());
        } catch (CardException e) {
            throw new RuntimeException("Could not connect: " + e.getMessage(), e);
        }
    }

    public static List<String> list() {
        try {
            return TerminalFactory.getDefault().terminals().list().stream().map(CardTerminal::getName).collect(Collectors.toList());
        } catch (CardException e) {
            logger.error("Failed to list readers: " + e.getMessage());
            throw new RuntimeException("Failed to list readers: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] transmit(byte[] apdu) throws IOException {
        try {
            byte[] response = channel.transmit(new CommandAPDU(apdu)).getBytes();
            trace(apdu, response);
            return response;
        } catch (CardException e) {
            throw new IOException("Failed to transmit to " + terminalName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getDeviceName() {
        return terminalName;
    }

    @Override
    public void beginExclusive() throws IOException {
        try {
            card.beginExclusive();
        } catch (CardException e) {
            throw new IOException("Could not get exclusive access to " + terminalName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void endExclusive() throws IOException {
        try {
            card.endExclusive();
        } catch (CardException e) {
            throw new IOException("Could not release exclusive access to " + terminalName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            card.disconnect(false);
        } catch (CardException e) {
            throw new IOException("Could not disconnect from " + terminalName + ": " + e.getMessage(), e);
        }
    }
}
