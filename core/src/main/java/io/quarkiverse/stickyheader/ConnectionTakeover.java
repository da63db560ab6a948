package io.quarkiverse.stickyheader;

import io.vertx.core.Future;
import io.vertx.core.net.NetSocket;

/**
 * Hands the raw connection over to the caller, e.g. for protocol upgrades. The response is no longer usable afterwards.
 */
public interface ConnectionTakeover extends ResponseCapability {
    Future<NetSocket> takeover();
}
