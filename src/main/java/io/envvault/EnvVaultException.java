package io.envvault;

/**
 * Thrown when a run cannot export every requested secret.
 *
 * <p>The cause is the typed failure of the step that stopped the run: a
 * {@code CredentialSourceException}, a {@code MalformedCredentialException} or one
 * of the {@code VaultException} subclasses.
 */
public class EnvVaultException extends Exception {

    public EnvVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
