package io.quarkiverse.stickyheader;

import io.vertx.core.Future;

/**
 * Pushes the bytes written so far to the client before the response completes.
 */
public interface StreamFlush extends ResponseCapability {
    Future<Void> flush();
}
