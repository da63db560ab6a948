package io.quarkiverse.stickyheader.server;

import org.jboss.logging.Logger;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.quarkiverse.stickyheader.ProxyUtils;
import io.quarkiverse.stickyheader.StickyHeader;
import io.quarkiverse.stickyheader.StickyHeaderOptions;
import io.quarkiverse.stickyheader.vertx.VertxExchangeRequests;
import io.quarkiverse.stickyheader.vertx.VertxResponseSink;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * Reverse proxy in front of one origin service that runs every request through {@link StickyHeader}.
 */
public class StickyProxyServer {

    public static final String VERSION = "1.0";
    public static final String API_PATH = "/_sticky/api";

    protected static final Logger log = Logger.getLogger(StickyProxyServer.class);

    protected Vertx vertx;
    protected ServiceConfig config;
    protected OriginProxyHandler origin;
    protected StickyHeader stickyHeader;

    public static AutoCloseable create(Vertx vertx, ServiceConfig config, StickyHeaderOptions options, int proxyPort) {
        HttpServer proxy = vertx.createHttpServer();
        StickyProxyServer proxyServer = new StickyProxyServer();
        Router proxyRouter = Router.router(vertx);
        proxyServer.init(vertx, proxyRouter, config, options);
        ProxyUtils.await(1000, proxy.requestHandler(proxyRouter).listen(proxyPort), "Could not listen on " + proxyPort);
        return new AutoCloseable() {

            @Override
            public void close() throws Exception {
                ProxyUtils.await(1000, proxy.close());
                ProxyUtils.await(1000, proxyServer.shutdown());
            }
        };
    }

    public void init(Vertx vertx, Router proxyRouter, ServiceConfig config, StickyHeaderOptions options) {
        this.vertx = vertx;
        this.config = config;
        proxyRouter.route().handler((context) -> {
            if (context.get("continue-sent") == null) {
                String expect = context.request().getHeader(HttpHeaderNames.EXPECT);
                if (expect != null && expect.equalsIgnoreCase("100-continue")) {
                    context.put("continue-sent", true);
                    context.response().writeContinue();
                }
            }
            context.next();
        });
        proxyRouter.route(API_PATH + "/version").method(HttpMethod.GET)
                .handler((ctx) -> ctx.response().setStatusCode(200).putHeader("Content-Type", "text/plain").end(VERSION));
        proxyRouter.route().handler(this::proxy);

        origin = new OriginProxyHandler(vertx, config);
        stickyHeader = new StickyHeader(origin, options);
        log.infov("Sticky proxy for service {0}", config);
    }

    public void proxy(RoutingContext ctx) {
        HttpServerRequest request = ctx.request();
        request.pause();
        log.debugv("Proxy {0} {1}", request.method(), request.uri());
        stickyHeader.handle(VertxExchangeRequests.from(request), new VertxResponseSink(request));
    }

    public Future<Void> shutdown() {
        if (origin == null) {
            return Future.succeededFuture();
        }
        return origin.close();
    }

    public StickyHeader getStickyHeader() {
        return stickyHeader;
    }
}
