package com.creditintel.backend.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashUtils {

    private HashUtils() {
    }

    public static String sha256Hex(String payload) {
        return HexFormat.of().formatHex(sha256(payload));
    }

    /**
     * First eight bytes of the SHA-256 digest, for seeding pseudo-random generators.
     */
    public static long seedOf(String payload) {
        return ByteBuffer.wrap(sha256(payload), 0, Long.BYTES).getLong();
    }

    private static byte[] sha256(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(payload.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
