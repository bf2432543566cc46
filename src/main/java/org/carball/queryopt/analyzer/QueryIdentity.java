package org.carball.queryopt.analyzer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * Derives the 8-character identity used as the key for all per-statement state.
 */
public final class QueryIdentity {

    public static final int LENGTH = 8;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryIdentity() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the identity of the given statement. Literals are part of the identity.
     */
    public static String of(String sql) {
        return sha256Hex(normalize(sql)).substring(0, LENGTH);
    }

    /**
     * Trims the statement and collapses whitespace runs to a single space.
     */
    public static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        return WHITESPACE.matcher(sql.trim()).replaceAll(" ");
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(Character.forDigit((b >> 4) & 0xf, 16));
                hex.append(Character.forDigit(b & 0xf, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest unavailable", e);
        }
    }
}
