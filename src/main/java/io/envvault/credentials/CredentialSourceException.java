package io.envvault.credentials;

/**
 * Thrown when the AppRole credential file cannot be downloaded.
 */
public class CredentialSourceException extends Exception {

    public CredentialSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
