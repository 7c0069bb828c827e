package io.envvault;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.envvault.env.Environment;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EnvVaultConfig.
 */
class EnvVaultConfigTest {

    private Map<String, String> variables;
    private Environment environment;

    @BeforeEach
    void setUp() {
        variables = new HashMap<>();
        variables.put("VAULT_ENDPOINT", "http://vault:8200");
        variables.put("VAULT_BUCKET", "my-bucket");
        variables.put("VAULT_KEY", "approle.json");
        environment = () -> variables;
    }

    @Test
    void fromEnvironment_withRequiredVariables_appliesDefaults() {
        EnvVaultConfig config = EnvVaultConfig.fromEnvironment(environment);

        assertThat(config.getVaultEndpoint()).isEqualTo("http://vault:8200");
        assertThat(config.getBucket()).isEqualTo("my-bucket");
        assertThat(config.getKey()).isEqualTo("approle.json");
        assertThat(config.getNamespace()).isNull();
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getAwsRegion()).isEqualTo("eu-west-1");
        assertThat(config.getS3Endpoint()).isNull();
    }

    @Test
    void fromEnvironment_withOptionalVariables_usesThem() {
        variables.put("VAULT_NAMESPACE", "team-a");
        variables.put("VAULT_TIMEOUT_SECONDS", " 15 ");
        variables.put("AWS_REGION", "us-east-1");
        variables.put("AWS_S3_ENDPOINT", "http://localstack:4566");

        EnvVaultConfig config = EnvVaultConfig.fromEnvironment(environment);

        assertThat(config.getNamespace()).isEqualTo("team-a");
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.getAwsRegion()).isEqualTo("us-east-1");
        assertThat(config.getS3Endpoint()).isEqualTo("http://localstack:4566");
    }

    @Test
    void fromEnvironment_withoutEndpoint_throwsException() {
        variables.remove("VAULT_ENDPOINT");

        assertThatThrownBy(() -> EnvVaultConfig.fromEnvironment(environment))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required configuration: environment variable VAULT_ENDPOINT not found");
    }

    @Test
    void fromEnvironment_withBlankBucket_throwsException() {
        variables.put("VAULT_BUCKET", "  ");

        assertThatThrownBy(() -> EnvVaultConfig.fromEnvironment(environment))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("VAULT_BUCKET");
    }

    @Test
    void fromEnvironment_withNonNumericTimeout_throwsException() {
        variables.put("VAULT_TIMEOUT_SECONDS", "ten");

        assertThatThrownBy(() -> EnvVaultConfig.fromEnvironment(environment))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid VAULT_TIMEOUT_SECONDS value: 'ten'. Must be a positive integer.");
    }

    @Test
    void fromEnvironment_withS3EndpointWithoutScheme_throwsException() {
        variables.put("AWS_S3_ENDPOINT", "localstack:4566/path");

        assertThatThrownBy(() -> EnvVaultConfig.fromEnvironment(environment))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid AWS_S3_ENDPOINT value: 'localstack:4566/path'. Must be an absolute URL.");
    }

    @Test
    void fromEnvironment_withS3EndpointContainingSpace_throwsException() {
        variables.put("AWS_S3_ENDPOINT", "http://bad host");

        assertThatThrownBy(() -> EnvVaultConfig.fromEnvironment(environment))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("AWS_S3_ENDPOINT");
    }

    @Test
    void fromEnvironment_withControlCharacterInNamespace_throwsException() {
        variables.put("VAULT_NAMESPACE", "team-a\r\n");

        assertThatThrownBy(() -> EnvVaultConfig.fromEnvironment(environment))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("VAULT_NAMESPACE");
    }

    @Test
    void fromEnvironment_withZeroTimeout_throwsException() {
        variables.put("VAULT_TIMEOUT_SECONDS", "0");

        assertThatThrownBy(() -> EnvVaultConfig.fromEnvironment(environment))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive integer");
    }
}
