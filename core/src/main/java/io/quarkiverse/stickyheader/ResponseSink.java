package io.quarkiverse.stickyheader;

import java.util.Optional;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;

/**
 * The writing side of an exchange. Headers may be changed until {@link #writeHead(int)} is called, either explicitly or
 * implicitly with status 200 by the first {@link #write(Buffer)} or {@link #end()}.
 */
public interface ResponseSink {

    MultiMap headers();

    /**
     * Finalizes the status code and header block. Only the first call has an effect.
     */
    void writeHead(int statusCode);

    boolean headWritten();

    Future<Void> write(Buffer chunk);

    Future<Void> end();

    /**
     * @return the capability if the sink supports it, never {@code null}
     */
    default <T extends ResponseCapability> Optional<T> capability(Class<T> type) {
        return Optional.empty();
    }

    /**
     * @throws UnsupportedCapabilityException if the sink does not offer {@code type}
     */
    default <T extends ResponseCapability> T requireCapability(Class<T> type) {
        return capability(type).orElseThrow(() -> new UnsupportedCapabilityException(type));
    }
}
