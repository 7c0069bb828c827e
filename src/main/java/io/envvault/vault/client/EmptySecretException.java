package io.envvault.vault.client;

/**
 * Thrown when the requested field exists but holds the empty string.
 *
 * <p>An empty secret is treated as a configuration error rather than a value.
 */
public class EmptySecretException extends VaultException {

    private final String reference;

    public EmptySecretException(String reference) {
        super("empty secret at path '" + reference + "'", 0);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
