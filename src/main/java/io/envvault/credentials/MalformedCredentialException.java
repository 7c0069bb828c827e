package io.envvault.credentials;

/**
 * Thrown when a credential file in the legacy AppRole format cannot be read.
 */
public class MalformedCredentialException extends Exception {

    public MalformedCredentialException(String message) {
        super(message);
    }

    public MalformedCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
