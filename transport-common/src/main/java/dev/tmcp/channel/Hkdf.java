package dev.tmcp.channel;

import java.security.GeneralSecurityException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HKDF with HMAC-SHA256 (RFC 5869).
 */
final class Hkdf {

    private static final String HMAC = "HmacSHA256";

    private static final int HASH_LENGTH = 32;

    private Hkdf() {
    }

    static byte[] extract(byte[] salt, byte[] inputKeyMaterial) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC);
        mac.init(new SecretKeySpec(salt, HMAC));
        return mac.doFinal(inputKeyMaterial);
    }

    static byte[] expand(byte[] prk, byte[] context, int outputSizeBytes) throws GeneralSecurityException {
        int rounds = (outputSizeBytes + HASH_LENGTH - 1) / HASH_LENGTH;
        if (rounds > 255) {
            throw new IllegalArgumentException("output size exceeds limit");
        }
        Mac mac = Mac.getInstance(HMAC);
        mac.init(new SecretKeySpec(prk, HMAC));
        byte[] out = new byte[outputSizeBytes];
        byte[] lastBlock = new byte[0];
        for (int counter = 1, offset = 0; offset < outputSizeBytes; counter++) {
            mac.update(lastBlock);
            mac.update(context);
            mac.update((byte) counter);
            lastBlock = mac.doFinal();
            int length = Math.min(HASH_LENGTH, outputSizeBytes - offset);
            System.arraycopy(lastBlock, 0, out, offset, length);
            offset += length;
        }
        return out;
    }
}
