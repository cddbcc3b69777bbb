package com.z254.vigil.warden.validation;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for fingerprints and derived identifiers.
 */
public final class Fingerprints {

    private static final int SHORT_ID_LENGTH = 16;

    private Fingerprints() {
    }

    public static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Prefix followed by the first 16 hex chars of the SHA-256 of {@code input}.
     */
    public static String shortId(String prefix, String input) {
        return prefix + sha256Hex(input).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Locale-independent number encoding; {@code 320}, {@code 320.0} and {@code 320.00} encode alike.
     */
    public static String canonicalNumber(Double value) {
        if (value == null) {
            return "-";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
