package org.urbanscope.datapipeline.utils;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${NAME}} placeholders in configured paths.
 * <p>
 * A placeholder is looked up as a system property first, then as an environment variable.
 * HOCON substitutions already cover most cases; this handles values that arrive as plain
 * strings, e.g. from CLI options such as {@code --data-dir ${HOME}/urbanscope}.
 */
public final class PathExpansion {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]*)}");

    private PathExpansion() {
    }

    /**
     * Replaces every placeholder in {@code path}.
     *
     * @param path the raw path, may be {@code null}
     * @return the expanded path, or {@code null} if {@code path} was {@code null}
     * @throws IllegalArgumentException if a placeholder is unclosed, empty or undefined
     */
    public static String expand(String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }
        Matcher matcher = PLACEHOLDER.matcher(path);
        StringBuilder out = new StringBuilder();
        int tail = 0;
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty variable in path: " + path);
            }
            String value = lookup(name);
            if (value == null) {
                throw new IllegalArgumentException(
                    "Undefined variable '${" + name + "}' in path: " + path
                        + ". Define it as a system property or environment variable.");
            }
            out.append(path, tail, matcher.start()).append(value);
            tail = matcher.end();
        }
        String rest = path.substring(tail);
        if (rest.contains("${")) {
            throw new IllegalArgumentException("Unclosed variable in path: " + path);
        }
        return out.append(rest).toString();
    }

    /**
     * Expands placeholders and converts the result to an absolute, normalized path.
     */
    public static Path expandToPath(String path) {
        return Path.of(expand(path)).toAbsolutePath().normalize();
    }

    private static String lookup(String name) {
        String value = System.getProperty(name);
        return value != null ? value : System.getenv(name);
    }
}
