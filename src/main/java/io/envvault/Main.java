package io.envvault;

import io.envvault.credentials.CredentialNormalizer;
import io.envvault.credentials.S3CredentialSource;
import io.envvault.env.Environment;
import io.envvault.env.SystemEnvironment;
import io.envvault.secrets.SecretResolver;
import io.envvault.vault.client.AppRoleAuthenticator;
import io.envvault.vault.client.VaultHttpClient;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code eval "$(java -jar envvault.jar)"}. Secrets go to standard output,
 * logs to standard error. Exits with status 1 on any failure.
 */
public final class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(new SystemEnvironment(), System.out));
    }

    /**
     * Runs envvault against the given environment.
     *
     * @param environment the process variables
     * @param out         where export lines are printed
     * @return the process exit status
     */
    static int run(Environment environment, PrintStream out) {
        EnvVaultConfig config;
        try {
            config = EnvVaultConfig.fromEnvironment(environment);
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            return EXIT_FAILURE;
        }

        try (S3CredentialSource credentialSource =
                     S3CredentialSource.create(config.getAwsRegion(), config.getS3Endpoint())) {
            VaultHttpClient client = new VaultHttpClient(
                    config.getVaultEndpoint(), config.getNamespace(), config.getRequestTimeout());

            EnvVault envVault = new EnvVault(config, credentialSource, new CredentialNormalizer(),
                    new AppRoleAuthenticator(client), new SecretResolver(client), environment);
            envVault.run(out);
            return EXIT_OK;

        } catch (EnvVaultException e) {
            logger.error(e.getMessage());
            logger.debug("Run failed", e);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            // client construction rejected a configuration value
            logger.error("Invalid configuration: {}", e.getMessage());
            logger.debug("Run failed", e);
            return EXIT_FAILURE;
        }
    }
}
