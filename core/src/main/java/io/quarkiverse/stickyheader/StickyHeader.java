package io.quarkiverse.stickyheader;

import org.jboss.logging.Logger;

import io.vertx.core.http.Cookie;

/**
 * Keeps the backend a client is pinned to visible in both the {@value #COOKIE_NAME} cookie, used by cookie based
 * sticky load balancing, and the {@value #HEADER_NAME} response header.
 * <p>
 * A client without the cookie can pick a backend with the {@value #QUERY_NAME} query parameter. The next handler then
 * sees the value as a request cookie, and unless it sets the cookie itself the response gets the matching
 * {@code Set-Cookie}.
 */
public class StickyHeader implements ExchangeHandler {
    protected static final Logger log = Logger.getLogger(StickyHeader.class);

    public static final String HEADER_NAME = "X-Traefik-Backend";
    public static final String QUERY_NAME = "X-Traefik-Backend";
    public static final String COOKIE_NAME = "_TRAEFIK_BACKEND";
    public static final String EXPOSE_HEADERS = "Access-Control-Expose-Headers";

    private final ExchangeHandler next;
    private final StickyHeaderOptions options;

    public StickyHeader(ExchangeHandler next) {
        this(next, new StickyHeaderOptions());
    }

    public StickyHeader(ExchangeHandler next, StickyHeaderOptions options) {
        this.next = next;
        this.options = options;
    }

    @Override
    public void handle(ExchangeRequest request, ResponseSink response) {
        String backendFromQueryString = null;
        ExchangeRequest forwarded = request;

        Cookie cookie = request.getCookie(COOKIE_NAME);
        if (cookie == null) {
            String backend = request.getQueryParam(QUERY_NAME);
            if (backend != null && !backend.isEmpty()) {
                log.debugv("Backend {0} requested by query string for {1}", backend, request);
                backendFromQueryString = backend;
                forwarded = request.withCookie(COOKIE_NAME, backend);
            }
        }

        next.handle(forwarded, new BackendHeaderResponse(response, backendFromQueryString, options));
    }

    public ExchangeHandler getNext() {
        return next;
    }

    public StickyHeaderOptions getOptions() {
        return options;
    }
}
