package io.envvault.vault.client;

/**
 * Argument checks shared by the client classes.
 */
final class Preconditions {

    private Preconditions() {
    }

    /**
     * Rejects a null or blank string.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @throws IllegalArgumentException if the value is null or blank
     */
    static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    /**
     * Rejects a null reference.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @param <T>   the value type
     * @return the value
     * @throws IllegalArgumentException if the value is null
     */
    static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }
}
