/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.detector.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing for cache keys.
 *
 * <p>
 * Uses UTF-8 encoding and returns a lowercase hex string. Used for result cache fingerprints and for keying
 * caller-supplied model credentials without holding them in plain text as map keys.
 */
public final class ContentHasher {

    private ContentHasher() {
    }

    /**
     * Generates SHA-256 hash of content.
     *
     * @param content
     *            the content to hash
     * @return 64-character lowercase hex string
     * @throws HashingException
     *             if SHA-256 algorithm is unavailable
     */
    public static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new HashingException("SHA-256 algorithm not available", e);
        }
    }

    private static String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }

    /**
     * Exception thrown when hashing fails.
     */
    public static class HashingException extends RuntimeException {

        public HashingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
