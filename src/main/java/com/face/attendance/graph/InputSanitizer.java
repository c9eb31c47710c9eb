package com.face.attendance.graph;

/**
 * Validation for identifiers and values that end up inlined in Cypher text.
 */
public final class InputSanitizer {

    /** Maximum allowed length for class and identity identifiers. */
    public static final int MAX_IDENTIFIER_LENGTH = 256;

    /** Maximum allowed length for Cypher string values. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    private InputSanitizer() {
    }

    /**
     * Validates a class or identity identifier.
     *
     * @param kind  what the identifier names, for the error message
     * @param value the identifier
     * @throws IllegalArgumentException if blank, too long, or containing control characters
     */
    public static void validateIdentifier(String kind, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(kind + " must not be null or blank");
        }
        if (value.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(kind + " exceeds maximum length of "
                    + MAX_IDENTIFIER_LENGTH + " characters (was " + value.length() + ")");
        }
        if (containsControlCharacters(value)) {
            throw new IllegalArgumentException(kind + " must not contain control characters");
        }
    }

    /**
     * Map keys are inlined unquoted, so only identifier characters are allowed.
     */
    public static void validatePropertyKey(String key) {
        if (key == null || !key.matches("^[A-Za-z_][A-Za-z0-9_]*$")) {
            throw new IllegalArgumentException("Invalid property key: '" + key + "'");
        }
    }

    public static void sanitizeForCypher(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
