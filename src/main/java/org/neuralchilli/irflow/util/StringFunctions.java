package org.neuralchilli.irflow.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * String helpers for the code generators.
 */
public final class StringFunctions {

    private static final Pattern WORD_SEPARATORS = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern IDENTIFIER_INVALID = Pattern.compile("[^A-Za-z0-9_]");

    private StringFunctions() {
    }

    /**
     * Convert to PascalCase.
     * Example: "order-processing flow" -> "OrderProcessingFlow"
     */
    public static String toPascalCase(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }

        StringBuilder result = new StringBuilder();
        for (String part : WORD_SEPARATORS.split(input.trim())) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0)));
                result.append(part.substring(1));
            }
        }

        if (result.length() > 0 && Character.isDigit(result.charAt(0))) {
            result.insert(0, '_');
        }
        return result.toString();
    }

    /**
     * Convert to snake_case
     */
    public static String toSnakeCase(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }

        // Insert underscore before uppercase letters
        String result = input.replaceAll("([a-z])([A-Z])", "$1_$2");
        result = result.replaceAll("[\\s.-]+", "_");
        result = IDENTIFIER_INVALID.matcher(result).replaceAll("");
        return result.toLowerCase();
    }

    public static int utf8Length(String input) {
        return input.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * SHA-256 of the UTF-8 bytes, lowercase hex.
     */
    public static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
