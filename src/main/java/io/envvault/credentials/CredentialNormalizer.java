package io.envvault.credentials;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.envvault.vault.client.AuthPayload;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a downloaded AppRole credential file into the body of an AppRole login.
 *
 * <p>Two file formats exist:
 * <pre>{@code
 * {"role_id": "...", "secret_id": "..."}        // canonical, sent as is
 * {"role_id": "...", "secret_role_id": "..."}   // legacy, rewritten
 * }</pre>
 *
 * <p>The canonical shape is checked first, so a file carrying {@code secret_id} is
 * never rewritten even if it also mentions {@code secret_role_id}. Content that is
 * neither canonical nor legacy is passed through untouched: the bucket is trusted
 * and Vault rejects a bad login body on its own.
 */
public class CredentialNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(CredentialNormalizer.class);

    static final String ROLE_ID = "role_id";
    static final String SECRET_ID = "secret_id";
    static final String LEGACY_SECRET_ID = "secret_role_id";

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /**
     * Normalizes a credential file.
     *
     * @param raw the file content
     * @return the login body; the same bytes unless the file is in the legacy format
     * @throws MalformedCredentialException if the file is in the legacy format but cannot be parsed
     */
    public AuthPayload normalize(byte[] raw) throws MalformedCredentialException {
        if (raw == null) {
            throw new IllegalArgumentException("Credential content cannot be null");
        }

        JsonNode root = parse(raw);

        if (hasText(root, ROLE_ID) && hasText(root, SECRET_ID)) {
            return AuthPayload.of(raw);
        }

        if (root != null && root.has(LEGACY_SECRET_ID)) {
            logger.warn("Old version of app role detected (it contains \"{}\" key)", LEGACY_SECRET_ID);
            if (!hasText(root, ROLE_ID) || !hasText(root, LEGACY_SECRET_ID)) {
                throw new MalformedCredentialException("cannot parse approle credentials: '"
                        + ROLE_ID + "' and '" + LEGACY_SECRET_ID + "' must both be strings");
            }
            return AuthPayload.of(canonical(root.get(ROLE_ID).textValue(),
                    root.get(LEGACY_SECRET_ID).textValue()));
        }

        if (new String(raw, StandardCharsets.UTF_8).contains(LEGACY_SECRET_ID)) {
            throw new MalformedCredentialException(
                    "cannot parse approle credentials: content mentions '" + LEGACY_SECRET_ID
                            + "' but is not a JSON object");
        }

        logger.warn("AppRole credentials do not contain '{}' and '{}', sending them unchanged",
                ROLE_ID, SECRET_ID);
        return AuthPayload.of(raw);
    }

    private JsonNode parse(byte[] raw) {
        try {
            JsonNode root = mapper.readTree(raw);
            return root != null && root.isObject() ? root : null;
        } catch (IOException e) {
            logger.debug("AppRole credentials are not valid JSON: {}", e.getMessage());
            return null;
        }
    }

    private static boolean hasText(JsonNode root, String field) {
        return root != null && root.path(field).isTextual();
    }

    private String canonical(String roleId, String secretId) throws MalformedCredentialException {
        try {
            return "{\"" + ROLE_ID + "\": " + mapper.writeValueAsString(roleId)
                    + ", \"" + SECRET_ID + "\": " + mapper.writeValueAsString(secretId) + "}";
        } catch (JsonProcessingException e) {
            throw new MalformedCredentialException("cannot serialize approle credentials", e);
        }
    }
}
