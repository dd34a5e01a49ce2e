package tw.gc.auto.equity.research.registry;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hashes of artifact payloads.
 */
public final class ContentHashes {

    public static final String ALGORITHM = "SHA-256";

    private ContentHashes() {
        // Utility class
    }

    /**
     * Lower-case hex SHA-256 of the payload, prefixed with {@code sha256:}.
     */
    public static String sha256(byte[] payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return "sha256:" + HexFormat.of().formatHex(digest.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
