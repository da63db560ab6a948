package io.quarkiverse.stickyheader;

import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.streams.ReadStream;

/**
 * Read-only view of an inbound request. Layers that need to change what the next handler sees create a new request,
 * see {@link #withCookie(String, String)}.
 */
public interface ExchangeRequest {

    HttpMethod method();

    /**
     * @return the request target as received, path plus query string
     */
    String uri();

    String path();

    /**
     * @return a copy of the request headers, changes are not seen by this request
     */
    MultiMap headers();

    /**
     * @return the first decoded value of the query parameter or {@code null}
     */
    String getQueryParam(String name);

    /**
     * @return the first cookie of that name sent with the request or {@code null}
     */
    Cookie getCookie(String name);

    /**
     * @return the body stream, {@code null} for requests that were not received over a connection
     */
    ReadStream<Buffer> body();

    /**
     * @return a request that behaves as if the client had also sent the cookie {@code name=value}
     */
    default ExchangeRequest withCookie(String name, String value) {
        return new CookieOverlayRequest(this, name, value);
    }

    static ExchangeRequest create(HttpMethod method, String uri, MultiMap headers) {
        return new BasicExchangeRequest(method, uri, headers, null);
    }

    static ExchangeRequest create(HttpMethod method, String uri) {
        return create(method, uri, MultiMap.caseInsensitiveMultiMap());
    }
}
