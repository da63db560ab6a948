package io.quarkiverse.stickyheader;

import java.util.List;
import java.util.Map;

/**
 * Reads and writes the small subset of {@code Set-Cookie} syntax needed here: the leading {@code name=value} pair
 * and a {@code Path} attribute. Trailing attributes are ignored when reading.
 */
public final class SetCookies {

    static final String EPOCH = "Thu, 01 Jan 1970 00:00:00 GMT";

    private SetCookies() {
    }

    /**
     * Finds the first {@code Set-Cookie} entry called {@code name}.
     *
     * @param setCookies raw header values, in the order they were added
     * @return the value of the first entry with that name, possibly empty, or {@code null} if there is none
     */
    public static String findValue(List<String> setCookies, String name) {
        for (String setCookie : setCookies) {
            Map.Entry<String, String> pair = nameValue(setCookie);
            if (pair != null && pair.getKey().equals(name)) {
                return pair.getValue();
            }
        }
        return null;
    }

    /**
     * Splits the leading pair of a {@code Set-Cookie} value on its first {@code '='}. The value keeps any further
     * {@code '='} characters.
     *
     * @return name and value, or {@code null} if the text has no pair
     */
    public static Map.Entry<String, String> nameValue(String setCookie) {
        if (setCookie == null) {
            return null;
        }
        String first = setCookie.trim();
        int semi = first.indexOf(';');
        if (semi >= 0) {
            first = first.substring(0, semi).trim();
        }
        if (first.isEmpty()) {
            return null;
        }
        int eq = first.indexOf('=');
        if (eq < 0) {
            return null;
        }
        return Map.entry(first.substring(0, eq), first.substring(eq + 1));
    }

    public static String format(String name, String value, String path) {
        StringBuilder sb = new StringBuilder(name).append('=').append(sanitizeValue(value));
        if (path != null && !path.isEmpty()) {
            sb.append("; Path=").append(path);
        }
        return sb.toString();
    }

    /**
     * @return a {@code Set-Cookie} value telling the client to drop the cookie stored under {@code path}
     */
    public static String expired(String name, String path) {
        return format(name, "", path) + "; Expires=" + EPOCH + "; Max-Age=0";
    }

    /**
     * Drops characters that may not appear in a cookie value and quotes values holding a space or comma.
     */
    public static String sanitizeValue(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 0x20 && c < 0x7f && c != '"' && c != ';' && c != '\\') {
                sb.append(c);
            }
        }
        String clean = sb.toString();
        if (clean.indexOf(' ') >= 0 || clean.indexOf(',') >= 0) {
            return '"' + clean + '"';
        }
        return clean;
    }
}
