package io.envvault.vault.client;

/**
 * Thrown when an AppRole login response parses but carries no client token.
 *
 * <p>Vault answers a rejected login with an {@code errors} body and no {@code auth}
 * block, so this is also what a wrong role id or secret id looks like. The
 * response body is kept for diagnosis.
 */
public class MissingTokenException extends VaultException {

    private final String responseBody;

    public MissingTokenException(int httpStatusCode, String responseBody) {
        super("cannot find token in Vault response: status=" + httpStatusCode
                + ", body=" + snippet(responseBody), httpStatusCode);
        this.responseBody = responseBody;
    }

    /**
     * Returns the full login response body.
     *
     * @return the body as received, or null if the response had none
     */
    public String getResponseBody() {
        return responseBody;
    }
}
