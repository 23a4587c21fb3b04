package com.tradepilot.oms;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Derives the client idempotency key for a signal.
 *
 * <p>The key is the first 16 hex characters of {@code SHA-256(instrumentId|signalSequence)}.
 * It depends only on the signal, so every retry of the same submission, and any
 * repeated submission of the same signal, carries the same key.
 */
@Component
public class IdempotencyKeyGenerator {

    private static final int KEY_LENGTH = 16;

    public String generate(String instrumentId, long signalSequence) {
        return sha256(instrumentId + "|" + signalSequence);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, KEY_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
