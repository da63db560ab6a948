package io.quarkiverse.stickyheader;

/**
 * Tuning for {@link StickyHeader}. The cookie and header names are fixed and not part of the options.
 */
public class StickyHeaderOptions {
    public static final String DEFAULT_COOKIE_PATH = "/";

    private String cookiePath = DEFAULT_COOKIE_PATH;
    private String legacyCookiePath;

    public String getCookiePath() {
        return cookiePath;
    }

    /**
     * Path attribute of the cookie written when the backend comes from the query string.
     */
    public StickyHeaderOptions setCookiePath(String cookiePath) {
        this.cookiePath = cookiePath;
        return this;
    }

    public String getLegacyCookiePath() {
        return legacyCookiePath;
    }

    /**
     * When set, a sticky response also expires the affinity cookie stored under this path. Clients that picked up a
     * cookie under an older, narrower path would otherwise send two cookies of the same name.
     */
    public StickyHeaderOptions setLegacyCookiePath(String legacyCookiePath) {
        this.legacyCookiePath = legacyCookiePath;
        return this;
    }

    public boolean isExpireLegacyCookie() {
        return legacyCookiePath != null && !legacyCookiePath.isEmpty();
    }
}
