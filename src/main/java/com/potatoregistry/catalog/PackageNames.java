package com.potatoregistry.catalog;

import java.util.Locale;
import java.util.regex.Pattern;

/** Package name normalization: lower case, runs of {@code -_.} collapsed to a single {@code -}. */
public final class PackageNames {

    public static final int MAX_LENGTH = 255;

    private static final Pattern SEPARATORS = Pattern.compile("[-_.]+");
    private static final Pattern VALID = Pattern.compile("[a-z0-9]([a-z0-9-]*[a-z0-9])?");

    private PackageNames() {}

    public static String normalize(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name required");
        String n = SEPARATORS.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        if (n.length() > MAX_LENGTH) throw new IllegalArgumentException("name longer than " + MAX_LENGTH + ": " + name);
        if (!VALID.matcher(n).matches()) throw new IllegalArgumentException("invalid package name: " + name);
        return n;
    }
}
