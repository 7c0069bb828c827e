package io.envvault.vault.client;

/**
 * Thrown when a Vault response body is not valid JSON or does not have the
 * expected shape (for example a secret whose {@code data} values are not strings).
 */
public class ResponseParseException extends VaultException {

    public ResponseParseException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    public ResponseParseException(String message, int httpStatusCode, Throwable cause) {
        super(message, httpStatusCode, cause);
    }
}
