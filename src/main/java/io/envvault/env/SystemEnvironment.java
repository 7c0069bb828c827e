package io.envvault.env;

import java.util.Map;

/**
 * The environment of the running process.
 */
public class SystemEnvironment implements Environment {

    @Override
    public Map<String, String> variables() {
        return System.getenv();
    }

    @Override
    public String get(String name) {
        return System.getenv(name);
    }
}
