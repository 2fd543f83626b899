package io.github.drompincen.taskbridge.runtime.resolve;

import org.springframework.web.util.HtmlUtils;

import java.util.Locale;

/**
 * Name normalization shared by the resolvers and the dedup/classification code.
 */
public final class Names {

    private Names() {
    }

    /** Trims, collapses inner whitespace and lower-cases. Null becomes the empty string. */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Decodes HTML entities (the destination returns titles like {@code R&amp;D}) and trims. */
    public static String unescape(String value) {
        if (value == null) {
            return "";
        }
        return HtmlUtils.htmlUnescape(value).trim();
    }
}
