package ai.pipestream.edge.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hex digests used for dataset checksums and physical table names.
 */
public final class Checksums {

    private Checksums() {}

    public static String sha256Hex(String text) {
        return digestHex("SHA-256", text);
    }

    public static String sha1Hex(String text) {
        return digestHex("SHA-1", text);
    }

    private static String digestHex(String algorithm, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Both algorithms are mandatory on every JDK
            throw new IllegalStateException("Missing digest algorithm " + algorithm, e);
        }
    }
}
