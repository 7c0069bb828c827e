package io.envvault.vault.client;

/**
 * Thrown when a secret document was read but does not contain the requested field.
 */
public class FieldNotFoundException extends VaultException {

    private final String storagePath;
    private final String fieldKey;

    public FieldNotFoundException(String storagePath, String fieldKey) {
        super("cannot find key '" + fieldKey + "' in json of path '" + storagePath + "'", 0);
        this.storagePath = storagePath;
        this.fieldKey = fieldKey;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public String getFieldKey() {
        return fieldKey;
    }
}
