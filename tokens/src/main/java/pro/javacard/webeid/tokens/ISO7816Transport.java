package pro.javacard.webeid.tokens;

import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.smartcardio.CommandAPDU;
import javax.smartcardio.ResponseAPDU;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public abstract class ISO7816Transport implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ISO7816Transport.class);

    static final int INS_VERIFY = 0x20;

    public abstract byte[] transmit(byte[] apdu) throws IOException;

    public abstract String getDeviceName();

    // Keep other applications away from the card between begin and end
    public void beginExclusive() throws IOException {
    }

    public void endExclusive() throws IOException {
    }

    // Sends a command, using command chaining for more than 255 bytes of data
    // and collecting 61XX continuations of the response
    public ResponseAPDU transceive(CommandAPDU command) throws IOException {
        ResponseAPDU response;
        byte[] data = command.getData();
        if (data.length > 255) {
            List<byte[]> chunks = split(data, 255);
            response = null;
            for (int i = 0; i < chunks.size(); i++) {
                boolean last = i == chunks.size() - 1;
                int cla = last ? command.getCLA() : command.getCLA() | 0x10;
                CommandAPDU chunk = last
                        ? new CommandAPDU(cla, command.getINS(), command.getP1(), command.getP2(), chunks.get(i), 256)
                        : new CommandAPDU(cla, command.getINS(), command.getP1(), command.getP2(), chunks.get(i));
                response = new ResponseAPDU(transmit(chunk.getBytes()));
                if (!last)
                    check(response, 0x9000);
            }
        } else {
            response = new ResponseAPDU(transmit(command.getBytes()));
        }

        ByteArrayOutputStream result = new ByteArrayOutputStream();
        // Avoid endless loop from bad/broken/buggy card by limited for
        for (int i = 0; i < 32; i++) {
            result.write(response.getData());
            if (response.getSW1() == 0x61)
                response = new ResponseAPDU(transmit(new CommandAPDU(0x00, 0xC0, 0x00, 0x00, response.getSW2() == 0 ? 256 : response.getSW2()).getBytes()));
            else break;
        }
        if (response.getSW1() == 0x61)
            throw new IOException("Response too long from " + getDeviceName());
        result.write(response.getSW1());
        result.write(response.getSW2());
        return new ResponseAPDU(result.toByteArray());
    }

    public ResponseAPDU check(ResponseAPDU apdu, int expected) throws IOException {
        if (apdu.getSW() != expected)
            throw new IOException(String.format("Unexpected response from %s: 0x%04X", getDeviceName(), apdu.getSW()));
        return apdu;
    }

    public static List<byte[]> split(byte[] array, int blockSize) {
        List<byte[]> result = new ArrayList<>();
        int offset = 0;
        while (offset < array.length) {
            int currentLen = Math.min(array.length - offset, blockSize);
            result.add(Arrays.copyOfRange(array, offset, offset + currentLen));
            offset += currentLen;
        }
        return result;
    }

    // APDU for logs, with VERIFY data left out
    static String redacted(byte[] apdu) {
        if (apdu.length > 5 && (apdu[1] & 0xFF) == INS_VERIFY)
            return Hex.toHexString(apdu, 0, 5) + " <PIN>";
        return Hex.toHexString(apdu);
    }

    protected void trace(byte[] command, byte[] response) {
        if (logger.isTraceEnabled()) {
            logger.trace(">> {}", redacted(command));
            logger.trace("<< {}", Hex.toHexString(response));
        }
    }
}
