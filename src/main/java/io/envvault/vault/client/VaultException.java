package io.envvault.vault.client;

/**
 * Exception thrown when a Vault API operation fails.
 *
 * <p>Base type of the client's error taxonomy. Each subclass names one way a
 * login or secret read can fail, so callers can tell a connection problem from
 * a rejected request or a badly shaped secret. The HTTP status code is kept
 * when the failure is tied to a response; status code 0 indicates that no
 * response was received (connection refused, timeout, etc.) or that the failure
 * was found in an already cached secret.
 *
 * @see TransportException
 * @see ResponseParseException
 * @see MissingTokenException
 * @see UpstreamStatusException
 * @see FieldNotFoundException
 * @see EmptySecretException
 */
public class VaultException extends Exception {

    private static final int MAX_BODY_LENGTH = 200;

    private final int httpStatusCode;

    /**
     * Creates a new VaultException.
     *
     * @param message        the error message
     * @param httpStatusCode the HTTP status code (0 for connection errors)
     */
    public VaultException(String message, int httpStatusCode) {
        super(message);
        this.httpStatusCode = httpStatusCode;
    }

    /**
     * Creates a new VaultException with a cause.
     *
     * @param message        the error message
     * @param httpStatusCode the HTTP status code
     * @param cause          the underlying cause
     */
    public VaultException(String message, int httpStatusCode, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = httpStatusCode;
    }

    /**
     * Gets the HTTP status code from the Vault response.
     *
     * @return the status code, or 0 if no response is involved
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Shortens a response body for inclusion in an error message.
     *
     * @param body the raw response body, may be null
     * @return the body, truncated to 200 characters
     */
    static String snippet(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH) + "..." : body;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                '}';
    }
}
