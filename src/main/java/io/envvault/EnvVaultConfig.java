package io.envvault;

import io.envvault.env.Environment;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Run configuration, read from environment variables.
 *
 * <ul>
 *   <li>{@code VAULT_ENDPOINT} - Vault server address (required)</li>
 *   <li>{@code VAULT_BUCKET} - S3 bucket holding the AppRole file (required)</li>
 *   <li>{@code VAULT_KEY} - S3 key of the AppRole file (required)</li>
 *   <li>{@code VAULT_NAMESPACE} - Vault namespace (Vault Enterprise only)</li>
 *   <li>{@code VAULT_TIMEOUT_SECONDS} - timeout of each Vault request, default 60</li>
 *   <li>{@code AWS_REGION} - region of the bucket, default eu-west-1</li>
 *   <li>{@code AWS_S3_ENDPOINT} - S3 endpoint override (LocalStack)</li>
 * </ul>
 */
public final class EnvVaultConfig {

    static final String ENV_VAULT_ENDPOINT = "VAULT_ENDPOINT";
    static final String ENV_VAULT_BUCKET = "VAULT_BUCKET";
    static final String ENV_VAULT_KEY = "VAULT_KEY";
    static final String ENV_VAULT_NAMESPACE = "VAULT_NAMESPACE";
    static final String ENV_VAULT_TIMEOUT_SECONDS = "VAULT_TIMEOUT_SECONDS";
    static final String ENV_AWS_REGION = "AWS_REGION";
    static final String ENV_AWS_S3_ENDPOINT = "AWS_S3_ENDPOINT";

    static final String DEFAULT_AWS_REGION = "eu-west-1";
    static final int DEFAULT_TIMEOUT_SECONDS = 60;

    private final String vaultEndpoint;
    private final String bucket;
    private final String key;
    private final String namespace;
    private final Duration requestTimeout;
    private final String awsRegion;
    private final String s3Endpoint;

    private EnvVaultConfig(String vaultEndpoint, String bucket, String key, String namespace,
                           Duration requestTimeout, String awsRegion, String s3Endpoint) {
        this.vaultEndpoint = vaultEndpoint;
        this.bucket = bucket;
        this.key = key;
        this.namespace = namespace;
        this.requestTimeout = requestTimeout;
        this.awsRegion = awsRegion;
        this.s3Endpoint = s3Endpoint;
    }

    /**
     * Reads the configuration.
     *
     * @param environment the variables to read
     * @return the configuration
     * @throws IllegalArgumentException if a required variable is missing or a value is invalid
     */
    public static EnvVaultConfig fromEnvironment(Environment environment) {
        String vaultEndpoint = required(environment, ENV_VAULT_ENDPOINT);
        String bucket = required(environment, ENV_VAULT_BUCKET);
        String key = required(environment, ENV_VAULT_KEY);

        String timeoutStr = getConfig(environment, ENV_VAULT_TIMEOUT_SECONDS,
                String.valueOf(DEFAULT_TIMEOUT_SECONDS));
        int timeoutSeconds;
        try {
            timeoutSeconds = Integer.parseInt(timeoutStr.trim());
            if (timeoutSeconds <= 0) {
                throw new NumberFormatException("non-positive value");
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid " + ENV_VAULT_TIMEOUT_SECONDS + " value: '" + timeoutStr
                            + "'. Must be a positive integer.");
        }

        return new EnvVaultConfig(
                vaultEndpoint,
                bucket,
                key,
                namespace(environment),
                Duration.ofSeconds(timeoutSeconds),
                getConfig(environment, ENV_AWS_REGION, DEFAULT_AWS_REGION),
                s3Endpoint(environment));
    }

    private static String namespace(Environment environment) {
        String namespace = getConfig(environment, ENV_VAULT_NAMESPACE, null);
        // sent as an HTTP header value
        if (namespace != null && namespace.chars().anyMatch(c -> c != '\t' && Character.isISOControl(c))) {
            throw new IllegalArgumentException(
                    "Invalid " + ENV_VAULT_NAMESPACE + " value: must not contain control characters.");
        }
        return namespace;
    }

    private static String s3Endpoint(Environment environment) {
        String endpoint = getConfig(environment, ENV_AWS_S3_ENDPOINT, null);
        if (endpoint == null) {
            return null;
        }
        try {
            URI uri = new URI(endpoint.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new URISyntaxException(endpoint, "scheme and host are required");
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(
                    "Invalid " + ENV_AWS_S3_ENDPOINT + " value: '" + endpoint + "'. Must be an absolute URL.");
        }
        return endpoint.trim();
    }

    private static String required(Environment environment, String name) {
        String value = getConfig(environment, name, null);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Missing required configuration: environment variable " + name + " not found");
        }
        return value;
    }

    private static String getConfig(Environment environment, String name, String defaultValue) {
        String value = environment.get(name);
        if (value != null && !value.isBlank()) {
            return value;
        }
        return defaultValue;
    }

    public String getVaultEndpoint() {
        return vaultEndpoint;
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }

    /** Vault namespace, or null for the root namespace. */
    public String getNamespace() {
        return namespace;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    /** S3 endpoint override, or null for the AWS default. */
    public String getS3Endpoint() {
        return s3Endpoint;
    }
}
