package com.knowledge.store.graph;

/**
 * Input validation for values that end up inside graph names, record keys
 * or connection credentials.
 */
public final class InputSanitizer {

    /** Maximum allowed length for namespace and database identifiers. */
    public static final int MAX_IDENTIFIER_LENGTH = 64;

    /** Minimum length for graph database user names and passwords. */
    public static final int MIN_CREDENTIAL_LENGTH = 12;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a namespace or database identifier.
     * Only alphanumeric characters, underscores and hyphens are allowed.
     *
     * @param field the configuration field being validated, used in the message
     * @param value the identifier
     * @throws IllegalArgumentException if the identifier is invalid
     */
    public static void validateIdentifier(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        if (value.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(field + " exceeds maximum length of "
                    + MAX_IDENTIFIER_LENGTH + " characters (was " + value.length() + ")");
        }
        if (!value.matches("^[A-Za-z0-9_-]+$")) {
            throw new IllegalArgumentException(field + " must contain only alphanumeric characters, "
                    + "underscores and hyphens, got: '" + value + "'");
        }
    }

    /**
     * Validates a credential against the complexity policy: at least
     * {@value #MIN_CREDENTIAL_LENGTH} characters with an upper-case letter, a
     * lower-case letter, a digit and a non-alphanumeric character.
     * The offending value is never included in the message.
     *
     * @param field the configuration field being validated
     * @param value the credential
     * @throws IllegalArgumentException if the credential does not satisfy the policy
     */
    public static void validateCredential(String field, String value) {
        if (value == null || value.length() < MIN_CREDENTIAL_LENGTH) {
            throw new IllegalArgumentException(field + " must be at least "
                    + MIN_CREDENTIAL_LENGTH + " characters");
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                upper = true;
            } else if (c >= 'a' && c <= 'z') {
                lower = true;
            } else if (c >= '0' && c <= '9') {
                digit = true;
            } else {
                special = true;
            }
        }
        if (!(upper && lower && digit && special)) {
            throw new IllegalArgumentException(field + " must contain upper-case, lower-case, "
                    + "digit and special characters");
        }
    }
}
