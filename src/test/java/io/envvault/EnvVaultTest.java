package io.envvault;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.envvault.credentials.CredentialNormalizer;
import io.envvault.credentials.CredentialSource;
import io.envvault.credentials.CredentialSourceException;
import io.envvault.env.Environment;
import io.envvault.secrets.SecretResolver;
import io.envvault.vault.client.AuthPayload;
import io.envvault.vault.client.MissingTokenException;
import io.envvault.vault.client.UpstreamStatusException;
import io.envvault.vault.client.VaultAuthenticator;
import io.envvault.vault.client.VaultHttpClient;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EnvVault with mocked Vault and S3 access.
 */
class EnvVaultTest {

    private static final String TOKEN = "hvs.token";
    private static final byte[] LEGACY_FILE =
            "{\"role_id\":\"R\",\"secret_role_id\":\"S\"}".getBytes(StandardCharsets.UTF_8);

    private final Map<String, String> variables = new HashMap<>();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private CredentialSource credentialSource;
    private VaultAuthenticator authenticator;
    private VaultHttpClient client;
    private EnvVault envVault;

    @BeforeEach
    void setUp() {
        variables.put("VAULT_ENDPOINT", "http://vault:8200");
        variables.put("VAULT_BUCKET", "my-bucket");
        variables.put("VAULT_KEY", "approle.json");
        Environment environment = () -> variables;

        credentialSource = mock(CredentialSource.class);
        authenticator = mock(VaultAuthenticator.class);
        client = mock(VaultHttpClient.class);
        envVault = new EnvVault(EnvVaultConfig.fromEnvironment(environment), credentialSource,
                new CredentialNormalizer(), authenticator, new SecretResolver(client), environment);
    }

    @Test
    void run_printsSortedExportLines() throws Exception {
        variables.put("DB_USER_VAULT", "secret/db:user");
        variables.put("DB_PASSWORD_VAULT", "secret/db:password");
        variables.put("API_KEY_VAULT", "secret/api");
        when(credentialSource.fetch("my-bucket", "approle.json")).thenReturn(LEGACY_FILE);
        when(authenticator.authenticate(any(AuthPayload.class))).thenReturn(TOKEN);
        when(client.readSecret(TOKEN, "secret/db")).thenReturn(Map.of("user", "app", "password", "pw"));
        when(client.readSecret(TOKEN, "secret/api")).thenReturn(Map.of("value", "key"));

        envVault.run(printStream());

        assertThat(output()).isEqualTo(
                "export \"API_KEY\"=\"key\"" + System.lineSeparator()
                        + "export \"DB_PASSWORD\"=\"pw\"" + System.lineSeparator()
                        + "export \"DB_USER\"=\"app\"" + System.lineSeparator());
        verify(authenticator).authenticate(AuthPayload.of("{\"role_id\": \"R\", \"secret_id\": \"S\"}"));
    }

    @Test
    void run_withoutReferences_logsInAndPrintsNothing() throws Exception {
        when(credentialSource.fetch(anyString(), anyString())).thenReturn(LEGACY_FILE);
        when(authenticator.authenticate(any(AuthPayload.class))).thenReturn(TOKEN);

        envVault.run(printStream());

        assertThat(output()).isEmpty();
        verify(authenticator).authenticate(any(AuthPayload.class));
        verifyNoInteractions(client);
    }

    @Test
    void run_withS3Failure_doesNotLogIn() throws Exception {
        when(credentialSource.fetch(anyString(), anyString()))
                .thenThrow(new CredentialSourceException("cannot download approle credentials file from S3", null));

        assertThatThrownBy(() -> envVault.run(printStream()))
                .isInstanceOf(EnvVaultException.class)
                .hasCauseInstanceOf(CredentialSourceException.class);
        verify(authenticator, never()).authenticate(any(AuthPayload.class));
    }

    @Test
    void run_withMalformedLegacyFile_fails() throws Exception {
        when(credentialSource.fetch(anyString(), anyString()))
                .thenReturn("{\"secret_role_id\":\"S\"}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> envVault.run(printStream()))
                .isInstanceOf(EnvVaultException.class)
                .hasMessageContaining("cannot parse approle credentials");
    }

    @Test
    void run_withLoginFailure_printsNothing() throws Exception {
        variables.put("API_KEY_VAULT", "secret/api");
        when(credentialSource.fetch(anyString(), anyString())).thenReturn(LEGACY_FILE);
        when(authenticator.authenticate(any(AuthPayload.class)))
                .thenThrow(new MissingTokenException(400, "{\"errors\":[\"invalid role ID\"]}"));

        assertThatThrownBy(() -> envVault.run(printStream()))
                .isInstanceOf(EnvVaultException.class)
                .hasMessageContaining("cannot find token in Vault response");
        assertThat(output()).isEmpty();
        verifyNoInteractions(client);
    }

    @Test
    void run_withOneFailingSecret_printsNothing() throws Exception {
        variables.put("A_VAULT", "secret/a");
        variables.put("B_VAULT", "secret/b");
        when(credentialSource.fetch(anyString(), anyString())).thenReturn(LEGACY_FILE);
        when(authenticator.authenticate(any(AuthPayload.class))).thenReturn(TOKEN);
        when(client.readSecret(TOKEN, "secret/a")).thenReturn(Map.of("value", "a"));
        when(client.readSecret(TOKEN, "secret/b"))
                .thenThrow(UpstreamStatusException.fromResponse("secret/b", "http://vault:8200", 403, ""));

        assertThatThrownBy(() -> envVault.run(printStream()))
                .isInstanceOf(EnvVaultException.class)
                .hasMessage("cannot get secret 'secret/b' from Vault at http://vault:8200: 403");
        assertThat(output()).isEmpty();
    }

    private PrintStream printStream() {
        return new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
