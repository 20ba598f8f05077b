package in.digitflow.domain.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * A decrypted venue API token and the stable reference it is pooled under.
 * The token itself never appears in logs; {@link #toString()} masks it.
 */
public record Credential(String ref, String token) {

    public Credential {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token is required");
        }
    }

    /**
     * Reference derived from a digest of the token, so accounts sharing a token share one connection.
     */
    public static Credential of(String token) {
        return new Credential(fingerprint(token), token);
    }

    public static String fingerprint(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return "cred-" + HexFormat.of().formatHex(hash, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public String toString() {
        return "Credential[" + ref + "]";
    }
}
