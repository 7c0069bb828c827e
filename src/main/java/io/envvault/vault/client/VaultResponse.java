package io.envvault.vault.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a response from the Vault API.
 *
 * <p>Vault responses typically have this structure:
 * <pre>{@code
 * {
 *   "data": { ... },       // For secret reads
 *   "auth": { ... },       // For authentication operations
 *   "errors": [ ... ]      // For failed requests
 * }
 * }</pre>
 *
 * <p>Accessors validate the shape of the block they read and raise
 * {@link ResponseParseException} when it does not match.
 */
public class VaultResponse {

    // A body is one JSON value; anything after it is a parse error
    static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final int status;
    private final String body;
    private final JsonNode root;

    private VaultResponse(int status, String body, JsonNode root) {
        this.status = status;
        this.body = body;
        this.root = root;
    }

    /**
     * Parses a JSON response body into a VaultResponse.
     *
     * @param status the HTTP status code
     * @param json   the JSON response body
     * @return the parsed response
     * @throws ResponseParseException if the body is not a JSON object
     */
    public static VaultResponse fromJson(int status, String json) throws ResponseParseException {
        if (json == null || json.isBlank()) {
            throw new ResponseParseException("cannot parse Vault response body: body is empty", status);
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(
                    "cannot parse Vault response body: body=" + VaultException.snippet(json), status, e);
        }

        if (root == null || !root.isObject()) {
            throw new ResponseParseException(
                    "cannot parse Vault response body: expected a JSON object, body="
                            + VaultException.snippet(json), status);
        }

        return new VaultResponse(status, json, root);
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    /**
     * Reads a string field of the {@code auth} block.
     *
     * @param key the field name, e.g. {@code client_token}
     * @return the value, or null if the block or the field is absent or null
     * @throws ResponseParseException if {@code auth} is not an object or the field is not a string
     */
    public String getAuthString(String key) throws ResponseParseException {
        JsonNode auth = root.get("auth");
        if (auth == null || auth.isNull()) {
            return null;
        }
        if (!auth.isObject()) {
            throw new ResponseParseException(
                    "cannot parse Vault response body: 'auth' is not an object, body="
                            + VaultException.snippet(body), status);
        }

        JsonNode value = auth.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ResponseParseException(
                    "cannot parse Vault response body: 'auth." + key + "' is not a string, body="
                            + VaultException.snippet(body), status);
        }
        return value.textValue();
    }

    /**
     * Reads the {@code data} block as a secret document.
     *
     * @param path the path the response was read from, used in error messages
     * @return the fields of the document, in response order; empty if {@code data} is {@code {}}
     * @throws ResponseParseException if {@code data} is missing, not an object, or has non-string values
     */
    public Map<String, String> getSecretData(String path) throws ResponseParseException {
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            throw new ResponseParseException(
                    "cannot parse Vault response body: secret=" + path
                            + ", 'data' is missing or not an object, body=" + VaultException.snippet(body), status);
        }

        Map<String, String> document = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new ResponseParseException(
                        "cannot parse Vault response body: secret=" + path
                                + ", field '" + field.getKey() + "' is not a string", status);
            }
            document.put(field.getKey(), field.getValue().textValue());
        }
        return Collections.unmodifiableMap(document);
    }

    /**
     * Parses the "errors" field from a Vault error response.
     *
     * @param json the JSON response body
     * @return list of error messages, empty if the body has none or is not JSON
     */
    static List<String> parseErrors(String json) {
        List<String> result = new ArrayList<>();
        try {
            JsonNode errors = MAPPER.readTree(json).path("errors");
            for (JsonNode item : errors) {
                if (!item.isNull()) {
                    result.add(item.asText().strip());
                }
            }
        } catch (JsonProcessingException e) {
            return Collections.emptyList();
        }
        return result;
    }
}
