package ai.gently.util;

import java.util.Locale;

public final class Slugs {
    private Slugs() {}

    /** Trims and lowercases {@code name}, replacing each inner run of whitespace with a single hyphen. */
    public static String slugify(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }
}
