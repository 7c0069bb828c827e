package io.envvault.vault.client;

/**
 * Interface for Vault authentication strategies.
 *
 * <p>An authenticator exchanges machine credentials for a Vault token. envvault
 * authenticates exactly once per run: the token is not renewed, and a run that
 * outlives its token fails on the next secret read.
 *
 * @see AppRoleAuthenticator
 */
public interface VaultAuthenticator {

    /**
     * Performs authentication and returns the resulting token.
     *
     * @param payload the login body
     * @return the Vault client token, never empty
     * @throws VaultException if the login request fails or the response has no token
     */
    String authenticate(AuthPayload payload) throws VaultException;
}
