package io.envvault.vault.client;

/**
 * Thrown when a request to Vault cannot be sent or no response arrives: connection
 * refused, DNS failure, TLS failure or the request timeout elapsing.
 *
 * <p>Always carries status code 0.
 */
public class TransportException extends VaultException {

    public TransportException(String message, Throwable cause) {
        super(message, 0, cause);
    }
}
