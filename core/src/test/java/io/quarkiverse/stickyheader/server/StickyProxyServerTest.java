package io.quarkiverse.stickyheader.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import io.quarkiverse.stickyheader.ProxyUtils;
import io.quarkiverse.stickyheader.StickyHeader;
import io.quarkiverse.stickyheader.StickyHeaderOptions;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.RequestOptions;

public class StickyProxyServerTest {
    static final int ORIGIN_PORT = 9181;
    static final int PROXY_PORT = 9180;
    static final int DEAD_PROXY_PORT = 9182;
    static final int UNUSED_PORT = 9189;

    static Vertx vertx;
    static HttpServer origin;
    static AutoCloseable proxy;
    static AutoCloseable deadProxy;
    static HttpClient client;

    static class Exchange {
        int status;
        MultiMap headers;
        String body;
    }

    @BeforeAll
    public static void before() {
        vertx = Vertx.vertx();
        origin = vertx.createHttpServer();
        origin.requestHandler(request -> {
            String path = request.path();
            if (path.equals("/set-cookie")) {
                request.response()
                        .setStatusCode(200)
                        .putHeader("Set-Cookie", "_TRAEFIK_BACKEND=http://1.2.3.4; Path=/path")
                        .putHeader("Content-Type", "text/plain")
                        .end("origin");
            } else if (path.equals("/echo-cookie")) {
                String cookie = request.getHeader("Cookie");
                request.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "text/plain")
                        .end(cookie == null ? "" : cookie);
            } else if (path.equals("/echo-body")) {
                request.body().onSuccess(body -> request.response()
                        .setStatusCode(201)
                        .putHeader("Content-Type", "text/plain")
                        .end(body));
            } else if (path.equals("/chunked")) {
                request.response().setStatusCode(200).setChunked(true);
                request.response().write("one,");
                request.response().write("two,");
                request.response().end("three");
            } else if (path.equals("/expose")) {
                request.response()
                        .setStatusCode(200)
                        .putHeader("Access-Control-Expose-Headers", "Foo")
                        .end();
            } else {
                request.response().setStatusCode(200).putHeader("Content-Type", "text/plain").end("origin");
            }
        });
        ProxyUtils.await(1000, origin.listen(ORIGIN_PORT));

        ServiceConfig config = new ServiceConfig("origin", "localhost", ORIGIN_PORT, false);
        proxy = StickyProxyServer.create(vertx, config, new StickyHeaderOptions(), PROXY_PORT);
        ServiceConfig dead = new ServiceConfig("dead", "localhost", UNUSED_PORT, false);
        deadProxy = StickyProxyServer.create(vertx, dead, new StickyHeaderOptions(), DEAD_PROXY_PORT);
        client = vertx.createHttpClient();
    }

    @AfterAll
    public static void after() throws Exception {
        if (client != null)
            ProxyUtils.await(1000, client.close());
        if (proxy != null)
            proxy.close();
        if (deadProxy != null)
            deadProxy.close();
        if (origin != null)
            ProxyUtils.await(1000, origin.close());
        if (vertx != null)
            ProxyUtils.await(1000, vertx.close());
    }

    static Exchange send(int port, HttpMethod method, String uri, MultiMap headers, String body) {
        RequestOptions options = new RequestOptions()
                .setMethod(method)
                .setHost("localhost")
                .setPort(port)
                .setURI(uri)
                .setHeaders(headers);
        return ProxyUtils.await(5000, client.request(options)
                .compose(request -> body == null ? request.send() : request.send(body))
                .compose(response -> response.body().map(buffer -> {
                    Exchange exchange = new Exchange();
                    exchange.status = response.statusCode();
                    exchange.headers = response.headers();
                    exchange.body = buffer.toString();
                    return exchange;
                })), method + " " + uri);
    }

    static Exchange get(String uri) {
        return send(PROXY_PORT, HttpMethod.GET, uri, MultiMap.caseInsensitiveMultiMap(), null);
    }

    @Test
    public void testNoStickiness() {
        Exchange exchange = get("/hello");
        assertEquals(200, exchange.status);
        assertEquals("origin", exchange.body);
        assertNull(exchange.headers.get(StickyHeader.HEADER_NAME));
        assertTrue(exchange.headers.getAll("Set-Cookie").isEmpty());
        assertEquals(StickyHeader.HEADER_NAME, exchange.headers.get(StickyHeader.EXPOSE_HEADERS));
    }

    @Test
    public void testOriginCookie() {
        Exchange exchange = get("/set-cookie");
        assertEquals(200, exchange.status);
        assertEquals("http://1.2.3.4", exchange.headers.get(StickyHeader.HEADER_NAME));
        assertEquals(List.of("_TRAEFIK_BACKEND=http://1.2.3.4; Path=/path"), exchange.headers.getAll("Set-Cookie"));
    }

    @Test
    public void testQueryStringReachesOriginAsCookie() {
        Exchange exchange = get("/echo-cookie?X-Traefik-Backend=http%3A%2F%2F1.2.3.4");
        assertEquals(200, exchange.status);
        assertEquals("_TRAEFIK_BACKEND=http://1.2.3.4", exchange.body);
        assertEquals("http://1.2.3.4", exchange.headers.get(StickyHeader.HEADER_NAME));
        assertEquals(List.of("_TRAEFIK_BACKEND=http://1.2.3.4; Path=/"), exchange.headers.getAll("Set-Cookie"));
    }

    @Test
    public void testRequestCookieWinsOverQueryString() {
        MultiMap headers = MultiMap.caseInsensitiveMultiMap().add("Cookie", "_TRAEFIK_BACKEND=http://0.0.0.2");
        Exchange exchange = send(PROXY_PORT, HttpMethod.GET, "/echo-cookie?X-Traefik-Backend=http://0.0.0.1", headers,
                null);
        assertEquals("_TRAEFIK_BACKEND=http://0.0.0.2", exchange.body);
        assertNull(exchange.headers.get(StickyHeader.HEADER_NAME));
        assertTrue(exchange.headers.getAll("Set-Cookie").isEmpty());
    }

    @Test
    public void testExposeHeadersFromOriginAppended() {
        Exchange exchange = get("/expose");
        assertEquals("Foo, X-Traefik-Backend", exchange.headers.get(StickyHeader.EXPOSE_HEADERS));
    }

    @Test
    public void testRequestBodyForwarded() {
        MultiMap headers = MultiMap.caseInsensitiveMultiMap().add("Content-Type", "text/plain");
        Exchange exchange = send(PROXY_PORT, HttpMethod.POST, "/echo-body?X-Traefik-Backend=b1", headers, "hello");
        assertEquals(201, exchange.status);
        assertEquals("hello", exchange.body);
        assertEquals("b1", exchange.headers.get(StickyHeader.HEADER_NAME));
    }

    @Test
    public void testChunkedResponseStreamed() {
        Exchange exchange = get("/chunked");
        assertEquals(200, exchange.status);
        assertEquals("one,two,three", exchange.body);
    }

    @Test
    public void testVersion() {
        Exchange exchange = get(StickyProxyServer.API_PATH + "/version");
        assertEquals(200, exchange.status);
        assertEquals(StickyProxyServer.VERSION, exchange.body);
        assertNull(exchange.headers.get(StickyHeader.EXPOSE_HEADERS));
    }

    @Test
    public void testBadGatewayKeepsStickiness() {
        Exchange exchange = send(DEAD_PROXY_PORT, HttpMethod.GET, "/?X-Traefik-Backend=b2", MultiMap.caseInsensitiveMultiMap(),
                null);
        assertEquals(502, exchange.status);
        assertEquals("Bad Gateway", exchange.body);
        assertEquals("b2", exchange.headers.get(StickyHeader.HEADER_NAME));
    }
}
