package dev.pagestack.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Hex digests for structure fingerprints.
 * MD5 here is an equality oracle for normalized page snapshots, not a security control.
 */
public final class DigestUtils {

    private static final HexFormat HEX = HexFormat.of();

    private DigestUtils() {
        // utility class
    }

    /**
     * MD5 of the UTF-8 bytes of {@code input}, lowercase hex.
     */
    public static String md5Hex(String input) {
        Objects.requireNonNull(input, "Input must not be null");
        return HEX.formatHex(digest("MD5", input.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] digest(String algorithm, byte[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            // MD5 is mandatory for every JDK
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
