package io.envvault.vault.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticator implementation for Vault AppRole authentication.
 *
 * <p>AppRole is a machine-oriented auth method that uses a role ID and secret ID
 * to authenticate. The role ID and secret ID arrive together as a canonical
 * {@link AuthPayload} (see {@code CredentialNormalizer}), which is posted to
 * {@code /v1/auth/approle/login} as is.
 *
 * <p>One login is performed per call. There is no re-authentication: the
 * secret ID is typically single-use or limited-use and envvault is a
 * short-lived process.
 *
 * @see VaultAuthenticator
 */
public class AppRoleAuthenticator implements VaultAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(AppRoleAuthenticator.class);

    private final VaultHttpClient client;

    /**
     * Creates an AppRoleAuthenticator logging in through the given client.
     *
     * @param client the Vault HTTP client
     */
    public AppRoleAuthenticator(VaultHttpClient client) {
        this.client = Preconditions.requireNonNull(client, "Vault client");
    }

    @Override
    public String authenticate(AuthPayload payload) throws VaultException {
        Preconditions.requireNonNull(payload, "Auth payload");

        logger.info("Authenticating to Vault at {}", client.getBaseUrl());
        String token = client.loginAppRole(payload);
        logger.debug("AppRole authentication successful");
        return token;
    }
}
