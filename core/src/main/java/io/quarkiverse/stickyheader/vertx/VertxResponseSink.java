package io.quarkiverse.stickyheader.vertx;

import java.util.Optional;

import org.jboss.logging.Logger;

import io.quarkiverse.stickyheader.ConnectionTakeover;
import io.quarkiverse.stickyheader.ResponseCapability;
import io.quarkiverse.stickyheader.ResponseSink;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.net.NetSocket;

/**
 * {@link ResponseSink} over a Vert.x server response.
 * <p>
 * Vert.x pushes every write to the connection on its own, so there is no {@code StreamFlush} capability. Connection
 * takeover maps to {@link HttpServerRequest#toNetSocket()}.
 */
public class VertxResponseSink implements ResponseSink {
    protected static final Logger log = Logger.getLogger(VertxResponseSink.class);

    private final HttpServerRequest request;
    private final HttpServerResponse response;
    private boolean statusSet;

    public VertxResponseSink(HttpServerRequest request) {
        this.request = request;
        this.response = request.response();
    }

    @Override
    public MultiMap headers() {
        return response.headers();
    }

    @Override
    public void writeHead(int statusCode) {
        if (statusSet || response.headWritten()) {
            log.debugv("Ignoring superfluous writeHead({0}) for {1}", statusCode, request.uri());
            return;
        }
        statusSet = true;
        response.setStatusCode(statusCode);
    }

    @Override
    public boolean headWritten() {
        return statusSet || response.headWritten();
    }

    @Override
    public Future<Void> write(Buffer chunk) {
        ensureStatus();
        if (!response.isChunked() && !response.headers().contains(HttpHeaders.CONTENT_LENGTH)) {
            response.setChunked(true);
        }
        return response.write(chunk);
    }

    @Override
    public Future<Void> end() {
        if (response.ended()) {
            return Future.succeededFuture();
        }
        ensureStatus();
        return response.end();
    }

    @Override
    public <T extends ResponseCapability> Optional<T> capability(Class<T> type) {
        if (type == ConnectionTakeover.class) {
            ConnectionTakeover takeover = this::takeover;
            return Optional.of(type.cast(takeover));
        }
        return Optional.empty();
    }

    private void ensureStatus() {
        if (!statusSet) {
            writeHead(200);
        }
    }

    private Future<NetSocket> takeover() {
        return request.toNetSocket();
    }

    public HttpServerResponse getResponse() {
        return response;
    }
}
