package io.quarkiverse.stickyheader;

/**
 * Handles one request/response exchange. Middlewares implement this and delegate to a next {@code ExchangeHandler}.
 */
@FunctionalInterface
public interface ExchangeHandler {

    /**
     * @param request the inbound request, read only
     * @param response sink to write the status, headers and body to
     */
    void handle(ExchangeRequest request, ResponseSink response);
}
