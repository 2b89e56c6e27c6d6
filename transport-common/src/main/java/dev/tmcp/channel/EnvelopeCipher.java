package dev.tmcp.channel;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.tmcp.identity.Identity;
import dev.tmcp.identity.IdentityDocument;

/**
 * Authenticated encryption of envelopes between two X25519 identities.
 * <p>
 * Layout: a length-prefixed JSON header {@code {"v":1,"sender":..,"receiver":..}}, a 12 byte nonce,
 * then the AES-256-GCM ciphertext of the payload with the header bytes as associated data. The key
 * is HKDF-SHA256 over the X25519 shared secret, with both DIDs as context.
 */
public final class EnvelopeCipher {

    private static final String KEY_ALGORITHM = "X25519";

    private static final String CIPHER = "AES/GCM/NoPadding";

    private static final byte[] SALT = "tmcp-envelope-v1".getBytes(StandardCharsets.UTF_8);

    private static final int VERSION = 1;

    private static final int NONCE_LENGTH = 12;

    private static final int TAG_BITS = 128;

    private static final int KEY_LENGTH = 32;

    private static final int MAX_HEADER_LENGTH = 8192;

    private final ObjectMapper mapper;

    private final SecureRandom random = new SecureRandom();

    public EnvelopeCipher(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(KEY_ALGORITHM).generateKeyPair();
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("X25519 not supported", e);
        }
    }

    public static String encodeKey(Key key) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(key.getEncoded());
    }

    public byte[] seal(Identity sender, IdentityDocument receiver, byte[] payload) {
        byte[] header = header(sender.did(), receiver.id());
        byte[] nonce = new byte[NONCE_LENGTH];
        this.random.nextBytes(nonce);
        try {
            byte[] key = deriveKey(privateKey(sender.privateKey()), publicKey(receiver.publicKey()), sender.did(),
                    receiver.id());
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
            Arrays.fill(key, (byte) 0);
            cipher.updateAAD(header);
            byte[] ciphertext = cipher.doFinal(payload);
            ByteArrayOutputStream out = new ByteArrayOutputStream(4 + header.length + NONCE_LENGTH + ciphertext.length);
            LengthPrefixedCodec.writeFrame(out, header);
            out.writeBytes(nonce);
            out.writeBytes(ciphertext);
            return out.toByteArray();
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to seal envelope for " + receiver.id(), e);
        }
    }

    /**
     * Read the addressing header without decrypting.
     * @throws EnvelopeDecodeException when the bytes are not an envelope
     */
    public EnvelopeAddress peek(byte[] envelope) {
        return parse(envelope).address();
    }

    /**
     * @param receiver private identity the envelope is addressed to
     * @param sender published document of the sealing identity
     * @throws EnvelopeDecodeException when the envelope is malformed or fails authentication
     */
    public OpenedEnvelope open(byte[] envelope, Identity receiver, IdentityDocument sender) {
        Parsed parsed = parse(envelope);
        EnvelopeAddress address = parsed.address();
        try {
            byte[] key = deriveKey(privateKey(receiver.privateKey()), publicKey(sender.publicKey()), address.sender(),
                    address.receiver());
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_BITS, parsed.nonce()));
            Arrays.fill(key, (byte) 0);
            cipher.updateAAD(parsed.header());
            byte[] payload = cipher.doFinal(parsed.ciphertext());
            return new OpenedEnvelope(address.sender(), address.receiver(), payload);
        }
        catch (AEADBadTagException e) {
            throw new EnvelopeDecodeException("Envelope authentication failed", e);
        }
        catch (GeneralSecurityException e) {
            throw new EnvelopeDecodeException("Could not open envelope from " + address.sender(), e);
        }
    }

    private byte[] header(String sender, String receiver) {
        ObjectNode node = this.mapper.createObjectNode();
        node.put("v", VERSION);
        node.put("sender", sender);
        node.put("receiver", receiver);
        return node.toString().getBytes(StandardCharsets.UTF_8);
    }

    private Parsed parse(byte[] envelope) {
        ByteArrayInputStream in = new ByteArrayInputStream(envelope);
        byte[] header = LengthPrefixedCodec.readFrame(in, MAX_HEADER_LENGTH);
        JsonNode node;
        try {
            node = this.mapper.readTree(header);
        }
        catch (IOException e) {
            throw new EnvelopeDecodeException("Malformed envelope header", e);
        }
        if (node == null || node.path("v").asInt() != VERSION || !node.path("sender").isTextual()
                || !node.path("receiver").isTextual()) {
            throw new EnvelopeDecodeException("Unsupported envelope header");
        }
        byte[] nonce = LengthPrefixedCodec.readFully(in, NONCE_LENGTH);
        byte[] ciphertext = in.readAllBytes();
        if (ciphertext.length < TAG_BITS / 8) {
            throw new EnvelopeDecodeException("Envelope ciphertext too short");
        }
        return new Parsed(header, new EnvelopeAddress(node.get("sender").asText(), node.get("receiver").asText()),
                nonce, ciphertext);
    }

    private static byte[] deriveKey(PrivateKey local, PublicKey remote, String sender, String receiver)
            throws GeneralSecurityException {
        KeyAgreement agreement = KeyAgreement.getInstance(KEY_ALGORITHM);
        agreement.init(local);
        agreement.doPhase(remote, true);
        byte[] shared = agreement.generateSecret();
        try {
            byte[] prk = Hkdf.extract(SALT, shared);
            byte[] context = (sender + "\n" + receiver).getBytes(StandardCharsets.UTF_8);
            return Hkdf.expand(prk, context, KEY_LENGTH);
        }
        finally {
            Arrays.fill(shared, (byte) 0);
        }
    }

    private static PublicKey publicKey(String encoded) throws GeneralSecurityException {
        return KeyFactory.getInstance(KEY_ALGORITHM)
            .generatePublic(new X509EncodedKeySpec(decodeKey(encoded)));
    }

    private static PrivateKey privateKey(String encoded) throws GeneralSecurityException {
        return KeyFactory.getInstance(KEY_ALGORITHM)
            .generatePrivate(new PKCS8EncodedKeySpec(decodeKey(encoded)));
    }

    private static byte[] decodeKey(String encoded) throws GeneralSecurityException {
        try {
            return Base64.getUrlDecoder().decode(encoded);
        }
        catch (IllegalArgumentException e) {
            throw new InvalidKeyException("Key is not URL-safe base64", e);
        }
    }

    private record Parsed(byte[] header, EnvelopeAddress address, byte[] nonce, byte[] ciphertext) {
    }
}
