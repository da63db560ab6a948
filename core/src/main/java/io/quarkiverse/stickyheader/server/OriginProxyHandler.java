package io.quarkiverse.stickyheader.server;

import java.util.List;
import java.util.Locale;

import org.jboss.logging.Logger;

import io.quarkiverse.stickyheader.ExchangeHandler;
import io.quarkiverse.stickyheader.ExchangeRequest;
import io.quarkiverse.stickyheader.ProxyUtils;
import io.quarkiverse.stickyheader.ResponseSink;
import io.quarkiverse.stickyheader.ResponseSinkWriteStream;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.streams.Pipe;
import io.vertx.core.streams.ReadStream;

/**
 * Forwards an exchange to a single origin service and streams the origin's answer back through the
 * {@link ResponseSink}. Whatever cookies the origin sets are copied as they are.
 */
public class OriginProxyHandler implements ExchangeHandler {
    protected static final Logger log = Logger.getLogger(OriginProxyHandler.class);

    final ServiceConfig config;
    final HttpClient client;

    public OriginProxyHandler(Vertx vertx, ServiceConfig config) {
        HttpClientOptions options = new HttpClientOptions();
        if (config.isSsl()) {
            options.setSsl(true).setTrustAll(true);
        }
        options.setDefaultHost(config.getHost());
        options.setDefaultPort(config.getPort());
        this.config = config;
        this.client = vertx.createHttpClient(options);
    }

    @Override
    public void handle(ExchangeRequest request, ResponseSink response) {
        MultiMap headers = MultiMap.caseInsensitiveMultiMap();
        ProxyUtils.copyEndToEndHeaders(request.headers(), headers);
        headers.remove(HttpHeaders.HOST);
        RequestOptions options = new RequestOptions()
                .setMethod(request.method())
                .setURI(request.uri())
                .setHeaders(headers);

        client.request(options).onComplete(event -> {
            if (event.failed()) {
                log.errorv(event.cause(), "Could not connect to service {0}", config.getName());
                ReadStream<Buffer> body = request.body();
                if (body != null) {
                    body.resume();
                }
                badGateway(response);
                return;
            }
            send(event.result(), request).onComplete(result -> {
                if (result.failed()) {
                    log.errorv(result.cause(), "Request {0} to service {1} failed", request, config.getName());
                    badGateway(response);
                    return;
                }
                forwardResponse(request, result.result(), response);
            });
        });
    }

    public Future<Void> close() {
        return client.close();
    }

    private static Future<HttpClientResponse> send(HttpClientRequest clientRequest, ExchangeRequest request) {
        ReadStream<Buffer> body = request.body();
        if (body == null) {
            return clientRequest.send();
        }
        MultiMap headers = request.headers();
        if (hasBody(headers)) {
            if (!headers.contains(HttpHeaders.CONTENT_LENGTH)) {
                clientRequest.setChunked(true);
            }
            return clientRequest.send(body);
        }
        body.resume();
        return clientRequest.send();
    }

    static boolean hasBody(MultiMap headers) {
        String contentLength = headers.get(HttpHeaders.CONTENT_LENGTH);
        if (contentLength != null) {
            try {
                return Long.parseLong(contentLength.trim()) > 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        List<String> te = headers.getAll(HttpHeaders.TRANSFER_ENCODING);
        for (String val : te) {
            if (val.toLowerCase(Locale.ROOT).contains("chunked")) {
                return true;
            }
        }
        return false;
    }

    private void forwardResponse(ExchangeRequest request, HttpClientResponse originResponse, ResponseSink response) {
        ProxyUtils.copyEndToEndHeaders(originResponse.headers(), response.headers());
        response.writeHead(originResponse.statusCode());
        Pipe<Buffer> pipe = originResponse.pipe();
        pipe.endOnComplete(true);
        pipe.endOnFailure(false);
        pipe.to(new ResponseSinkWriteStream(response), ar -> {
            if (ar.failed()) {
                log.errorv(ar.cause(), "Failed to relay response of {0} from service {1}", request, config.getName());
                response.end();
            }
        });
    }

    private static void badGateway(ResponseSink response) {
        if (response.headWritten()) {
            response.end();
            return;
        }
        Buffer body = Buffer.buffer("Bad Gateway");
        response.headers().set(HttpHeaders.CONTENT_TYPE, "text/plain");
        response.headers().set(HttpHeaders.CONTENT_LENGTH, Integer.toString(body.length()));
        response.writeHead(502);
        response.write(body);
        response.end();
    }
}
