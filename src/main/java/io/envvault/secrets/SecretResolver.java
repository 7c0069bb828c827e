package io.envvault.secrets;

import io.envvault.vault.client.EmptySecretException;
import io.envvault.vault.client.FieldNotFoundException;
import io.envvault.vault.client.VaultException;
import io.envvault.vault.client.VaultHttpClient;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves path references to secret values.
 *
 * <p>Each storage path is read from Vault at most once per resolver: the first
 * read caches the whole document, and later references to other fields of the same
 * document are answered from the cache. Several variables can therefore share one
 * Vault secret for the cost of a single request. Only successful reads are cached,
 * including documents with no fields. Entries are never evicted or refreshed.
 *
 * <p>Not thread-safe. Resolution is sequential; resolving concurrently would need a
 * per-path guard so the same path is not fetched twice.
 */
public class SecretResolver {

    private static final Logger logger = LoggerFactory.getLogger(SecretResolver.class);

    private final VaultHttpClient client;
    private final Map<String, Map<String, String>> cache = new HashMap<>();

    public SecretResolver(VaultHttpClient client) {
        if (client == null) {
            throw new IllegalArgumentException("Vault client cannot be null");
        }
        this.client = client;
    }

    /**
     * Resolves one reference.
     *
     * @param token     the Vault token
     * @param name      the variable the secret is for, used for logging
     * @param reference the path reference, {@code path} or {@code path:field}
     * @return the secret value, never empty
     * @throws FieldNotFoundException if the document has no such field
     * @throws EmptySecretException   if the field holds the empty string
     * @throws VaultException         if the document cannot be read
     */
    public String getSecret(String token, String name, String reference) throws VaultException {
        logger.info("Getting secret {} at {}", name, reference);

        PathReference parsed = PathReference.parse(reference);
        Map<String, String> document = document(token, parsed.getStoragePath());

        String secret = document.get(parsed.getFieldKey());
        if (secret == null) {
            throw new FieldNotFoundException(parsed.getStoragePath(), parsed.getFieldKey());
        }
        if (secret.isEmpty()) {
            throw new EmptySecretException(reference);
        }
        return secret;
    }

    /**
     * Resolves every reference of a mapping, in its iteration order.
     *
     * <p>Stops at the first failure; nothing is returned for the entries resolved
     * before it.
     *
     * @param token      the Vault token
     * @param references variable name to path reference
     * @return variable name to secret value, in the same order
     * @throws VaultException the first failure met
     */
    public Map<String, String> resolveAll(String token, Map<String, String> references)
            throws VaultException {
        Map<String, String> secrets = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : references.entrySet()) {
            secrets.put(entry.getKey(), getSecret(token, entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableMap(secrets);
    }

    private Map<String, String> document(String token, String storagePath) throws VaultException {
        Map<String, String> cached = cache.get(storagePath);
        if (cached != null) {
            logger.debug("Secret document {} served from cache", storagePath);
            return cached;
        }

        Map<String, String> fetched = client.readSecret(token, storagePath);
        cache.put(storagePath, fetched);
        return fetched;
    }

    /**
     * Returns the number of cached documents.
     *
     * @return the cache size
     */
    int cachedDocuments() {
        return cache.size();
    }
}
