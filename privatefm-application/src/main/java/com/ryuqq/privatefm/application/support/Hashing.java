package com.ryuqq.privatefm.application.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hex 헬퍼.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Hashing {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashing() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * UTF-8 문자열의 SHA-256 소문자 hex (64자).
     */
    public static String sha256Hex(String input) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
        char[] out = new char[hash.length * 2];
        for (int i = 0; i < hash.length; i++) {
            out[i * 2] = HEX[(hash[i] >> 4) & 0x0f];
            out[i * 2 + 1] = HEX[hash[i] & 0x0f];
        }
        return new String(out);
    }
}
