package io.envvault;

import io.envvault.credentials.CredentialNormalizer;
import io.envvault.credentials.CredentialSource;
import io.envvault.credentials.CredentialSourceException;
import io.envvault.credentials.MalformedCredentialException;
import io.envvault.env.Environment;
import io.envvault.env.ExportFormatter;
import io.envvault.env.VaultReferences;
import io.envvault.secrets.SecretResolver;
import io.envvault.vault.client.AuthPayload;
import io.envvault.vault.client.VaultAuthenticator;
import io.envvault.vault.client.VaultException;
import java.io.PrintStream;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports the Vault secrets requested by the environment.
 *
 * <p>A run:
 * <ol>
 *   <li>downloads the AppRole credential file,</li>
 *   <li>normalizes it into a login body,</li>
 *   <li>logs in to Vault,</li>
 *   <li>resolves every {@code *_VAULT} variable of the environment,</li>
 *   <li>prints one {@code export} line per secret.</li>
 * </ol>
 *
 * <p>The first failure ends the run and nothing is printed, so a shell evaluating the
 * output never sees a partial set of secrets.
 */
public class EnvVault {

    private static final Logger logger = LoggerFactory.getLogger(EnvVault.class);

    private final EnvVaultConfig config;
    private final CredentialSource credentialSource;
    private final CredentialNormalizer normalizer;
    private final VaultAuthenticator authenticator;
    private final SecretResolver resolver;
    private final Environment environment;

    public EnvVault(EnvVaultConfig config, CredentialSource credentialSource,
                    CredentialNormalizer normalizer, VaultAuthenticator authenticator,
                    SecretResolver resolver, Environment environment) {
        this.config = config;
        this.credentialSource = credentialSource;
        this.normalizer = normalizer;
        this.authenticator = authenticator;
        this.resolver = resolver;
        this.environment = environment;
    }

    /**
     * Performs a run.
     *
     * @param out where the export lines are printed
     * @throws EnvVaultException if any step fails; nothing has been printed then
     */
    public void run(PrintStream out) throws EnvVaultException {
        AuthPayload payload = loadCredentials();

        Map<String, String> secrets;
        try {
            String token = authenticator.authenticate(payload);
            Map<String, String> references = VaultReferences.fromEnvironment(environment);
            logger.debug("Found {} variables ending with {}", references.size(), VaultReferences.SUFFIX);
            secrets = resolver.resolveAll(token, references);
        } catch (VaultException e) {
            throw new EnvVaultException(e.getMessage(), e);
        }

        for (String line : ExportFormatter.format(secrets)) {
            out.println(line);
        }
        out.flush();
    }

    private AuthPayload loadCredentials() throws EnvVaultException {
        try {
            byte[] raw = credentialSource.fetch(config.getBucket(), config.getKey());
            return normalizer.normalize(raw);
        } catch (CredentialSourceException | MalformedCredentialException e) {
            throw new EnvVaultException(e.getMessage(), e);
        }
    }
}
