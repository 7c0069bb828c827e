package io.envvault.env;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Formats resolved secrets as shell {@code export} statements.
 *
 * <p>Values are wrapped in double quotes and otherwise written verbatim. A value
 * containing {@code "}, {@code $} or a backtick is interpreted by the shell that
 * evaluates the output.
 */
public final class ExportFormatter {

    private ExportFormatter() {
    }

    /**
     * Formats one line per secret.
     *
     * @param secrets variable name to value
     * @return lines of the form {@code export "NAME"="value"}, in the map's order
     */
    public static List<String> format(Map<String, String> secrets) {
        List<String> lines = new ArrayList<>(secrets.size());
        for (Map.Entry<String, String> secret : secrets.entrySet()) {
            lines.add(String.format("export \"%s\"=\"%s\"", secret.getKey(), secret.getValue()));
        }
        return lines;
    }
}
