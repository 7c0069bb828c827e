package io.envvault.vault.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lightweight HTTP client wrapper for the HashiCorp Vault REST API.
 *
 * <p>This class provides a thin wrapper around {@link HttpClient} for the two calls
 * envvault needs:
 * <ul>
 *   <li>AppRole login ({@code POST /v1/auth/approle/login})</li>
 *   <li>Secret reads ({@code GET /v1/<path>}) authenticated via the X-Vault-Token header</li>
 * </ul>
 *
 * <p>Namespace support via the X-Vault-Namespace header (Vault Enterprise) applies to
 * both. There is no retry; every request is bounded by a fixed timeout and a timeout
 * surfaces as a {@link TransportException}.
 *
 * <p>The client is designed to be injectable/mockable for unit testing.
 */
public class VaultHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(VaultHttpClient.class);

    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
    static final String LOGIN_PATH = "/v1/auth/approle/login";
    private static final String HEADER_VAULT_TOKEN = "X-Vault-Token";
    private static final String HEADER_VAULT_NAMESPACE = "X-Vault-Namespace";
    private static final String CONTENT_TYPE_JSON = "application/json";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String namespace;
    private final Duration requestTimeout;

    /**
     * Creates a new VaultHttpClient with default settings.
     *
     * @param baseUrl the Vault server URL (e.g., "https://vault:8200")
     */
    public VaultHttpClient(String baseUrl) {
        this(baseUrl, null, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Creates a new VaultHttpClient.
     *
     * @param baseUrl        the Vault server URL
     * @param namespace      Vault namespace (Enterprise), or null for root namespace
     * @param requestTimeout timeout for individual requests, or null for the default of 60 seconds
     */
    public VaultHttpClient(String baseUrl, String namespace, Duration requestTimeout) {
        this(buildHttpClient(), baseUrl, namespace, requestTimeout);
    }

    /**
     * Creates a new VaultHttpClient with an injected HttpClient (for testing).
     *
     * @param httpClient     the HTTP client to use
     * @param baseUrl        the Vault server URL
     * @param namespace      Vault namespace, or null
     * @param requestTimeout timeout for individual requests
     */
    public VaultHttpClient(HttpClient httpClient, String baseUrl, String namespace,
                           Duration requestTimeout) {
        Preconditions.requireNonBlank(baseUrl, "Vault base URL");
        this.httpClient = httpClient;
        this.baseUrl = normalizeUrl(baseUrl);
        this.namespace = namespace;
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    private static HttpClient buildHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    private static String normalizeUrl(String url) {
        // Remove trailing slash for consistent URL building
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Authenticates using AppRole and returns the client token.
     *
     * <p>The payload is sent as the request body without modification. The HTTP status is
     * not checked: a rejected login has no {@code auth} block and is reported as a
     * {@link MissingTokenException} carrying Vault's answer.
     *
     * @param payload the canonical login body
     * @return the client token
     * @throws TransportException     if the request cannot be sent or times out
     * @throws ResponseParseException if the body is not JSON or {@code auth} is malformed
     * @throws MissingTokenException  if the response has no or an empty {@code client_token}
     */
    public String loginAppRole(AuthPayload payload) throws VaultException {
        String url = baseUrl + LOGIN_PATH;
        HttpRequest request = newRequest(url, "cannot do POST to get token from Vault")
                .header("Content-Type", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload.toByteArray()))
                .build();

        HttpResponse<String> response = execute(request, "cannot do POST to get token from Vault: url=" + url);

        VaultResponse vaultResponse = VaultResponse.fromJson(response.statusCode(), response.body());
        String clientToken = vaultResponse.getAuthString("client_token");
        if (clientToken == null || clientToken.isEmpty()) {
            throw new MissingTokenException(response.statusCode(), response.body());
        }

        return clientToken;
    }

    /**
     * Reads the secret document stored at a path.
     *
     * @param token the Vault token
     * @param path  the storage path, relative to {@code /v1/} (e.g., "secret/myapp")
     * @return the {@code data} block of the response, possibly empty
     * @throws TransportException       if the request cannot be sent or times out
     * @throws UpstreamStatusException  if Vault answers with a non-2xx status
     * @throws ResponseParseException   if the body does not match {@code {data: {string: string}}}
     */
    public Map<String, String> readSecret(String token, String path) throws VaultException {
        String failure = "cannot get secret '" + path + "' from Vault at " + baseUrl;
        HttpRequest request = newRequest(baseUrl + "/v1/" + path, failure)
                .header(HEADER_VAULT_TOKEN, token)
                .GET()
                .build();

        HttpResponse<String> response = execute(request, failure);

        int status = response.statusCode();
        if (status / 100 != 2) {
            throw UpstreamStatusException.fromResponse(path, baseUrl, status, response.body());
        }

        return VaultResponse.fromJson(status, response.body()).getSecretData(path);
    }

    private HttpRequest.Builder newRequest(String url, String failure) throws TransportException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout);
        } catch (IllegalArgumentException e) {
            throw new TransportException(failure + ": invalid URL " + url, e);
        }

        if (namespace != null && !namespace.isBlank()) {
            try {
                builder.header(HEADER_VAULT_NAMESPACE, namespace);
            } catch (IllegalArgumentException e) {
                throw new TransportException(failure + ": invalid namespace header value", e);
            }
        }

        return builder;
    }

    private HttpResponse<String> execute(HttpRequest request, String failure) throws TransportException {
        logger.debug("Vault request: {} {}", request.method(), request.uri());

        try {
            HttpResponse<String> response = httpClient.send(
                    request, HttpResponse.BodyHandlers.ofString());

            String body = response.body();
            logger.debug("Vault response: {} ({})", response.statusCode(),
                    body != null ? body.length() + " bytes" : "empty");

            return response;

        } catch (IOException e) {
            // Timeouts arrive here as HttpTimeoutException
            throw new TransportException(failure + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(failure + ": request interrupted", e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getNamespace() {
        return namespace;
    }
}
