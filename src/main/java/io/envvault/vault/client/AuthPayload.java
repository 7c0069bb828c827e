package io.envvault.vault.client;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Body of an AppRole login request: a JSON object carrying {@code role_id} and
 * {@code secret_id}.
 *
 * <p>The bytes are kept as given so a canonical credential file is sent to Vault
 * exactly as it was stored. {@link #toString()} never reveals the content.
 */
public final class AuthPayload {

    private final byte[] bytes;

    private AuthPayload(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps login body bytes.
     *
     * @param bytes the JSON body; copied
     * @return the payload
     */
    public static AuthPayload of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Auth payload cannot be null");
        }
        return new AuthPayload(bytes.clone());
    }

    /**
     * Wraps a login body given as text.
     *
     * @param json the JSON body, encoded as UTF-8
     * @return the payload
     */
    public static AuthPayload of(String json) {
        if (json == null) {
            throw new IllegalArgumentException("Auth payload cannot be null");
        }
        return new AuthPayload(json.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    public String asString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuthPayload)) {
            return false;
        }
        return Arrays.equals(bytes, ((AuthPayload) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "AuthPayload{" + bytes.length + " bytes}";
    }
}
