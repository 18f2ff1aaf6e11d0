package com.querytrace.engine.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Stable statement identifier: the first 64 bits of the SHA-256 of the statement text,
 * as 16 lowercase hex digits. Identical text always yields the same value, across sessions
 * and processes.
 */
public final class Fingerprint {

    public static final String NONE = "0000000000000000";

    private Fingerprint() {}

    public static String of(String statementText) {
        if (statementText == null) return NONE;
        byte[] digest = sha256().digest(statementText.getBytes(StandardCharsets.UTF_8));
        long v = 0;
        for (int i = 0; i < 8; i++) {
            v = (v << 8) | (digest[i] & 0xffL);
        }
        return String.format("%016x", v);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to provide SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
