package io.envvault.secrets;

import java.util.Objects;

/**
 * Address of one secret value: a Vault storage path and a field inside the
 * document stored there.
 *
 * <p>Written as {@code <storagePath>} or {@code <storagePath>:<fieldKey>}. Only the
 * first colon separates the two parts, so {@code "a/b:c:d"} reads field
 * {@code "c:d"} of {@code "a/b"}. Without a colon the field is {@code "value"}.
 */
public final class PathReference {

    /** Field read when the reference names only a path. */
    public static final String DEFAULT_FIELD = "value";

    private static final char SEPARATOR = ':';

    private final String storagePath;
    private final String fieldKey;

    private PathReference(String storagePath, String fieldKey) {
        this.storagePath = storagePath;
        this.fieldKey = fieldKey;
    }

    /**
     * Parses a reference.
     *
     * @param reference the reference text
     * @return the parsed reference
     * @throws IllegalArgumentException if the reference is null
     */
    public static PathReference parse(String reference) {
        if (reference == null) {
            throw new IllegalArgumentException("Path reference cannot be null");
        }

        int separator = reference.indexOf(SEPARATOR);
        if (separator < 0) {
            return new PathReference(reference, DEFAULT_FIELD);
        }
        return new PathReference(reference.substring(0, separator), reference.substring(separator + 1));
    }

    public String getStoragePath() {
        return storagePath;
    }

    public String getFieldKey() {
        return fieldKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathReference)) {
            return false;
        }
        PathReference that = (PathReference) o;
        return storagePath.equals(that.storagePath) && fieldKey.equals(that.fieldKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(storagePath, fieldKey);
    }

    @Override
    public String toString() {
        return storagePath + SEPARATOR + fieldKey;
    }
}
