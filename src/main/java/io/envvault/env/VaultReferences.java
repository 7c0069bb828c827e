package io.envvault.env;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Picks the variables that ask for a Vault secret.
 *
 * <p>A variable {@code DB_PASSWORD_VAULT=secret/db:password} asks for the secret
 * at {@code secret/db:password} to be exported as {@code DB_PASSWORD}. The value is
 * kept whole, including any {@code =} or {@code :} it contains.
 */
public final class VaultReferences {

    /** Suffix marking a variable whose value is a path reference. */
    public static final String SUFFIX = "_VAULT";

    private VaultReferences() {
    }

    /**
     * Collects the references of an environment.
     *
     * @param environment the variables to scan
     * @return exported name to path reference, sorted by name
     */
    public static SortedMap<String, String> fromEnvironment(Environment environment) {
        SortedMap<String, String> references = new TreeMap<>();
        for (Map.Entry<String, String> variable : environment.variables().entrySet()) {
            String name = variable.getKey();
            if (!name.endsWith(SUFFIX) || name.length() == SUFFIX.length()) {
                continue;
            }
            references.put(name.substring(0, name.length() - SUFFIX.length()), variable.getValue());
        }
        return Collections.unmodifiableSortedMap(references);
    }
}
