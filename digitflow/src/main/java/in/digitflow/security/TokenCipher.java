package in.digitflow.security;

import in.digitflow.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * AES-256-GCM codec for stored venue API tokens.
 *
 * Stored format is {@code hex(iv):hex(authTag):hex(ciphertext)} with a 16-byte IV and a 128-bit tag.
 * A value without ':' is a legacy plaintext token and is returned unchanged.
 * Tokens are never logged.
 *
 * Usage:
 * <pre>
 * TokenCipher cipher = TokenCipher.fromEnv();        // ENCRYPTION_KEY, 64 hex chars
 * String token = cipher.decrypt(row.get("deriv_token"));
 * </pre>
 */
public final class TokenCipher {
    private static final Logger log = LoggerFactory.getLogger(TokenCipher.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 16;
    private static final int TAG_BITS = 128;
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public TokenCipher(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != 32) {
            throw new IllegalArgumentException("Encryption key must be 32 bytes (64 hex chars)");
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    public static TokenCipher fromHexKey(String keyHex) {
        if (keyHex == null || keyHex.isBlank()) {
            throw new IllegalArgumentException("Encryption key is required");
        }
        return new TokenCipher(HEX.parseHex(keyHex.trim()));
    }

    /**
     * Cipher keyed from ENCRYPTION_KEY, or null when the variable is unset (plaintext tokens only).
     */
    public static TokenCipher fromEnv() {
        String keyHex = Env.get("ENCRYPTION_KEY", null);
        if (keyHex == null || keyHex.isBlank()) {
            log.warn("[TokenCipher] ENCRYPTION_KEY not set, only plaintext tokens can be used");
            return null;
        }
        return fromHexKey(keyHex);
    }

    public static boolean isEncrypted(String stored) {
        if (stored == null) {
            return false;
        }
        String[] parts = stored.split(":");
        return parts.length == 3 && parts[0].length() == IV_BYTES * 2;
    }

    /**
     * @throws IllegalArgumentException the value has ':' but not three parts
     * @throws IllegalStateException    authentication or decryption failed
     */
    public String decrypt(String stored) {
        if (stored == null || stored.isEmpty()) {
            throw new IllegalArgumentException("Encrypted token is required");
        }
        if (!stored.contains(":")) {
            log.debug("[TokenCipher] Token is not encrypted, using as-is");
            return stored;
        }
        String[] parts = stored.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid encrypted token format");
        }

        try {
            byte[] iv = HEX.parseHex(parts[0]);
            byte[] tag = HEX.parseHex(parts[1]);
            byte[] data = HEX.parseHex(parts[2]);

            // JCE expects the tag appended to the ciphertext
            byte[] sealed = new byte[data.length + tag.length];
            System.arraycopy(data, 0, sealed, 0, data.length);
            System.arraycopy(tag, 0, sealed, data.length, tag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to decrypt API token", e);
        }
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Token is required for encryption");
        }
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            int dataLength = sealed.length - TAG_BITS / 8;
            byte[] data = new byte[dataLength];
            byte[] tag = new byte[TAG_BITS / 8];
            System.arraycopy(sealed, 0, data, 0, dataLength);
            System.arraycopy(sealed, dataLength, tag, 0, tag.length);
            return HEX.formatHex(iv) + ":" + HEX.formatHex(tag) + ":" + HEX.formatHex(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt API token", e);
        }
    }
}
