package io.quarkiverse.stickyheader.vertx;

import io.quarkiverse.stickyheader.BasicExchangeRequest;
import io.quarkiverse.stickyheader.ExchangeRequest;
import io.vertx.core.http.HttpServerRequest;

public final class VertxExchangeRequests {

    private VertxExchangeRequests() {
    }

    /**
     * The returned request streams its body from {@code request}. Pause the server request first if the body is
     * consumed asynchronously.
     */
    public static ExchangeRequest from(HttpServerRequest request) {
        return new BasicExchangeRequest(request.method(), request.uri(), request.headers(), request);
    }
}
