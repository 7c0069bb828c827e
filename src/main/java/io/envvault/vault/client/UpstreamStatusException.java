package io.envvault.vault.client;

import java.util.List;

/**
 * Thrown when Vault answers a secret read with a status outside the 2xx class.
 *
 * <p>The message names the secret reference, the Vault address and the status, and
 * appends Vault's own error messages when the body carries them:
 * <pre>{@code
 * cannot get secret 'secret/app:db' from Vault at https://vault:8200: 403 (permission denied)
 * }</pre>
 */
public class UpstreamStatusException extends VaultException {

    public UpstreamStatusException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    /**
     * Creates an UpstreamStatusException from an HTTP error response.
     *
     * @param reference  the secret reference or path being read
     * @param baseUrl    the Vault address
     * @param statusCode the HTTP status code
     * @param body       the response body (may contain JSON error details)
     * @return a new exception with a descriptive message
     */
    public static UpstreamStatusException fromResponse(String reference, String baseUrl,
                                                       int statusCode, String body) {
        String message = "cannot get secret '" + reference + "' from Vault at " + baseUrl + ": "
                + statusCode + describeBody(body);
        return new UpstreamStatusException(message, statusCode);
    }

    private static String describeBody(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }

        // Vault error responses have format: {"errors": ["message1", "message2"]}
        List<String> errors = VaultResponse.parseErrors(body);
        if (!errors.isEmpty()) {
            return " (" + String.join("; ", errors) + ")";
        }

        return " (" + snippet(body.strip()) + ")";
    }
}
