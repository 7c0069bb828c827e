package io.envvault.env;

import java.util.Map;

/**
 * Read access to a set of environment variables.
 *
 * <p>Lets the variable filtering and configuration code run against fabricated
 * variables instead of the real process environment.
 *
 * @see SystemEnvironment
 */
public interface Environment {

    /**
     * Lists the variables.
     *
     * @return variable name to value
     */
    Map<String, String> variables();

    /**
     * Looks up one variable.
     *
     * @param name the variable name
     * @return the value, or null if unset
     */
    default String get(String name) {
        return variables().get(name);
    }
}
