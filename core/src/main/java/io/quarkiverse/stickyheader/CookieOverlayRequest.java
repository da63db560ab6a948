package io.quarkiverse.stickyheader;

import java.util.StringJoiner;

import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.streams.ReadStream;

/**
 * A request that adds one cookie on top of another request. The cookie shadows any cookie of the same name and is
 * appended to the {@code Cookie} header so it travels on when the request is forwarded.
 */
class CookieOverlayRequest implements ExchangeRequest {
    private final ExchangeRequest delegate;
    private final String name;
    private final String wireValue;
    private final String value;

    CookieOverlayRequest(ExchangeRequest delegate, String name, String value) {
        this.delegate = delegate;
        this.name = name;
        this.wireValue = SetCookies.sanitizeValue(value);
        this.value = unquote(wireValue);
    }

    @Override
    public HttpMethod method() {
        return delegate.method();
    }

    @Override
    public String uri() {
        return delegate.uri();
    }

    @Override
    public String path() {
        return delegate.path();
    }

    @Override
    public MultiMap headers() {
        MultiMap headers = delegate.headers();
        String pair = name + "=" + wireValue;
        StringJoiner cookies = new StringJoiner("; ");
        for (String current : headers.getAll(HttpHeaders.COOKIE)) {
            if (!current.isBlank()) {
                cookies.add(current.trim());
            }
        }
        cookies.add(pair);
        headers.set(HttpHeaders.COOKIE, cookies.toString());
        return headers;
    }

    @Override
    public String getQueryParam(String name) {
        return delegate.getQueryParam(name);
    }

    @Override
    public Cookie getCookie(String name) {
        if (this.name.equals(name)) {
            return Cookie.cookie(this.name, value);
        }
        return delegate.getCookie(name);
    }

    @Override
    public ReadStream<Buffer> body() {
        return delegate.body();
    }

    // the value as a cookie parser reads it back from the header
    private static String unquote(String value) {
        if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    @Override
    public String toString() {
        return delegate + " +cookie " + name;
    }
}
