package dev.tmcp.channel;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Writes and reads sections that start with a four-byte big-endian length. Used for the header
 * section of an envelope.
 */
final class LengthPrefixedCodec {

    private LengthPrefixedCodec() {
    }

    static void writeFrame(ByteArrayOutputStream out, byte[] payload) {
        byte[] header = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.writeBytes(header);
        out.writeBytes(payload);
    }

    /**
     * @param maxLength largest section accepted
     * @throws EnvelopeDecodeException when the section is truncated or longer than {@code maxLength}
     */
    static byte[] readFrame(ByteArrayInputStream in, int maxLength) {
        byte[] header = readFully(in, 4);
        int length = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt();
        if (length < 0 || length > maxLength) {
            throw new EnvelopeDecodeException("Invalid envelope section length: " + length);
        }
        return readFully(in, length);
    }

    static byte[] readFully(ByteArrayInputStream in, int length) {
        byte[] buffer = new byte[length];
        int read = in.readNBytes(buffer, 0, length);
        if (read != length) {
            throw new EnvelopeDecodeException("Envelope truncated after " + read + " of " + length + " bytes");
        }
        return buffer;
    }
}
