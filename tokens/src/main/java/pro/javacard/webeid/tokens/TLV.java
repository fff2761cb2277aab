package pro.javacard.webeid.tokens;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

// Minimal BER-TLV as used by PIV data objects and templates
final class TLV {
    final int tag;
    final byte[] value;

    TLV(int tag, byte[] value) {
        this.tag = tag;
        this.value = value.clone();
    }

    static List<TLV> parse(byte[] data) throws IOException {
        List<TLV> result = new ArrayList<>();
        int pos = 0;
        while (pos < data.length) {
            // 0x00 and 0xFF are padding between objects
            if (data[pos] == 0x00 || data[pos] == (byte) 0xFF) {
                pos++;
                continue;
            }
            int tag = data[pos++] & 0xFF;
            if ((tag & 0x1F) == 0x1F) {
                do {
                    if (pos >= data.length)
                        throw new IOException("Truncated tag");
                    tag = (tag << 8) | (data[pos] & 0xFF);
                } while ((data[pos++] & 0x80) == 0x80);
            }
            if (pos >= data.length)
                throw new IOException(String.format("Missing length for tag %X", tag));
            int len = data[pos++] & 0xFF;
            if (len > 0x80) {
                int bytes = len & 0x7F;
                if (bytes > 3 || pos + bytes > data.length)
                    throw new IOException(String.format("Invalid length for tag %X", tag));
                len = 0;
                for (int i = 0; i < bytes; i++)
                    len = (len << 8) | (data[pos++] & 0xFF);
            } else if (len == 0x80) {
                throw new IOException("Indefinite length not supported");
            }
            if (pos + len > data.length)
                throw new IOException(String.format("Value of tag %X overflows by %d bytes", tag, pos + len - data.length));
            result.add(new TLV(tag, Arrays.copyOfRange(data, pos, pos + len)));
            pos += len;
        }
        return result;
    }

    static Optional<byte[]> find(byte[] data, int tag) throws IOException {
        return parse(data).stream().filter(t -> t.tag == tag).map(t -> t.value).findFirst();
    }

    static byte[] get(byte[] data, int tag) throws IOException {
        return find(data, tag).orElseThrow(() -> new IOException(String.format("Tag %X not present", tag)));
    }

    static byte[] encode(int tag, byte[] value) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        if (tag > 0xFFFF)
            bos.write(tag >> 16);
        if (tag > 0xFF)
            bos.write(tag >> 8);
        bos.write(tag);
        int len = value.length;
        if (len < 0x80) {
            bos.write(len);
        } else if (len <= 0xFF) {
            bos.write(0x81);
            bos.write(len);
        } else if (len <= 0xFFFF) {
            bos.write(0x82);
            bos.write(len >> 8);
            bos.write(len);
        } else {
            throw new IllegalArgumentException("Value too long: " + len);
        }
        bos.write(value, 0, value.length);
        return bos.toByteArray();
    }
}
