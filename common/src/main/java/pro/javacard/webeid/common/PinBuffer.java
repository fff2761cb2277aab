package pro.javacard.webeid.common;

import java.util.Arrays;

/**
 * Holds the PIN for exactly one signing attempt.
 * <p>
 * The storage is allocated once with room for the APDU header and the longest padded PIN of the
 * supported tokens, so the PIN is never reallocated or copied by the buffer itself. Closing the
 * buffer zeroes it; closing is idempotent.
 */
public final class PinBuffer implements AutoCloseable {
    // APDU header (5 bytes) + PIN padding (16 bytes), the longest PIN is 12 bytes
    public static final int CAPACITY = 5 + 16;

    private final byte[] buffer = new byte[CAPACITY];
    private int length = 0;

    public void append(byte b) {
        if (length == buffer.length)
            throw new IllegalStateException("PIN does not fit into " + CAPACITY + " bytes");
        buffer[length++] = b;
    }

    // PIN characters are sent to the card as ASCII
    public void append(char[] chars) {
        for (char c : chars) {
            if (c > 0x7F)
                throw new IllegalArgumentException("PIN must consist of ASCII characters");
        }
        for (char c : chars) {
            append((byte) c);
        }
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public void copyTo(byte[] destination, int offset) {
        System.arraycopy(buffer, 0, destination, offset, length);
    }

    public void clear() {
        Arrays.fill(buffer, (byte) 0x00);
        length = 0;
    }

    @Override
    public void close() {
        clear();
    }

    // For tests
    byte[] storage() {
        return buffer;
    }

    @Override
    public String toString() {
        return "PinBuffer[" + (isEmpty() ? "empty" : "set") + "]";
    }
}
