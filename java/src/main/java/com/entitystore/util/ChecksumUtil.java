package com.entitystore.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Utility class for content hashing.
 */
public final class ChecksumUtil {

    private ChecksumUtil() {
    }

    /**
     * Compute the MD5 checksum of a string (UTF-8).
     *
     * @param content Content to hash
     * @return Lower-case hex digest
     */
    public static String md5Checksum(String content) {
        return md5Checksum(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Compute the MD5 checksum of raw bytes.
     *
     * @param content Content to hash
     * @return Lower-case hex digest
     */
    public static String md5Checksum(byte[] content) {
        return bytesToHex(digest("MD5", content));
    }

    static byte[] sha256(String content) {
        return digest("SHA-256", content.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] digest(String algorithm, byte[] content) {
        try {
            return MessageDigest.getInstance(algorithm).digest(content);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not found", e);
        }
    }

    /**
     * Convert byte array to hex string.
     */
    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
