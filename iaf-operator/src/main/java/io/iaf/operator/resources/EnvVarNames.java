package io.iaf.operator.resources;

import java.util.regex.Pattern;

/**
 * POSIX environment variable name check: a letter or underscore, then letters, digits or
 * underscores.
 */
public final class EnvVarNames {
    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private EnvVarNames() {
    }

    public static boolean isValid(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }
}
