package com.deepansh.gateway.tool;

import java.util.regex.Pattern;

/**
 * Provider-safe tool names. Every provider accepts {@code [A-Za-z0-9_.-]}
 * starting with a letter or underscore, at most 64 characters.
 */
public final class ToolNames {

    public static final int MAX_LENGTH = 64;

    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_.-]");
    private static final Pattern VALID = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.-]{0,63}$");

    private ToolNames() {
    }

    public static boolean isValid(String name) {
        return name != null && VALID.matcher(name).matches();
    }

    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "_";
        }
        String normalized = INVALID_CHARS.matcher(name).replaceAll("_");
        char first = normalized.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            normalized = "_" + normalized;
        }
        return normalized.length() > MAX_LENGTH ? normalized.substring(0, MAX_LENGTH) : normalized;
    }
}
