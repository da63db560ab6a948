package io.quarkiverse.stickyheader;

import java.util.List;

import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.streams.ReadStream;

public class BasicExchangeRequest implements ExchangeRequest {
    private final HttpMethod method;
    private final String uri;
    private final MultiMap headers;
    private final ReadStream<Buffer> body;
    private QueryStringDecoder query;

    public BasicExchangeRequest(HttpMethod method, String uri, MultiMap headers, ReadStream<Buffer> body) {
        this.method = method;
        this.uri = uri;
        this.headers = MultiMap.caseInsensitiveMultiMap().addAll(headers);
        this.body = body;
    }

    @Override
    public HttpMethod method() {
        return method;
    }

    @Override
    public String uri() {
        return uri;
    }

    @Override
    public String path() {
        return query().path();
    }

    @Override
    public MultiMap headers() {
        return MultiMap.caseInsensitiveMultiMap().addAll(headers);
    }

    @Override
    public String getQueryParam(String name) {
        List<String> values = query().parameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    @Override
    public Cookie getCookie(String name) {
        for (String header : headers.getAll(HttpHeaders.COOKIE)) {
            for (io.netty.handler.codec.http.cookie.Cookie cookie : ServerCookieDecoder.LAX.decodeAll(header)) {
                if (cookie.name().equals(name)) {
                    return Cookie.cookie(cookie.name(), cookie.value());
                }
            }
        }
        return null;
    }

    @Override
    public ReadStream<Buffer> body() {
        return body;
    }

    private QueryStringDecoder query() {
        if (query == null) {
            query = new QueryStringDecoder(uri);
        }
        return query;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
