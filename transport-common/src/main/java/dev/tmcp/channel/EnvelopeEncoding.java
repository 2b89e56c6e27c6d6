package dev.tmcp.channel;

import java.util.Base64;

/**
 * Text form of envelopes on the wire: URL-safe base64. Padding is written and optional on read.
 */
public final class EnvelopeEncoding {

    private EnvelopeEncoding() {
    }

    public static String encode(byte[] envelope) {
        return Base64.getUrlEncoder().encodeToString(envelope);
    }

    /**
     * @throws EnvelopeDecodeException when the text is not URL-safe base64
     */
    public static byte[] decode(String text) {
        try {
            return Base64.getUrlDecoder().decode(text.trim());
        }
        catch (IllegalArgumentException ex) {
            throw new EnvelopeDecodeException("Envelope is not URL-safe base64", ex);
        }
    }
}
