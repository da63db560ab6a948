package io.quarkiverse.stickyheader;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpHeaders;

public class ProxyUtils {

    /**
     * Connection-scoped headers that a proxy must not forward (RFC 7230 section 6.1).
     */
    public static final Set<String> HOP_BY_HOP = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade");

    public static <T> T await(long timeout, Future<T> future) {
        return await(timeout, future, "");
    }

    public static <T> T await(long timeout, Future<T> future, String error) {
        CountDownLatch latch = new CountDownLatch(1);
        future.onComplete(event -> latch.countDown());
        try {
            if (!latch.await(timeout, TimeUnit.MILLISECONDS)) {
                throw new RuntimeException("Timed out: " + error);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(error, e);
        }
        if (future.failed()) {
            throw new RuntimeException(error, future.cause());
        }
        return future.result();
    }

    public static boolean isHopByHop(String headerName) {
        return HOP_BY_HOP.contains(headerName.toLowerCase(Locale.ROOT));
    }

    /**
     * Copies every end-to-end header from {@code source} into {@code destination}, keeping repeated entries. Headers
     * listed in {@code Connection} are dropped along with the fixed hop-by-hop set.
     */
    public static void copyEndToEndHeaders(MultiMap source, MultiMap destination) {
        Set<String> connectionScoped = connectionTokens(source);
        source.forEach((key, val) -> {
            if (isHopByHop(key) || connectionScoped.contains(key.toLowerCase(Locale.ROOT))) {
                return;
            }
            destination.add(key, val);
        });
    }

    static Set<String> connectionTokens(MultiMap headers) {
        Set<String> tokens = new HashSet<>();
        for (String value : headers.getAll(HttpHeaders.CONNECTION)) {
            for (String token : value.split(",")) {
                String trimmed = token.trim();
                if (!trimmed.isEmpty()) {
                    tokens.add(trimmed.toLowerCase(Locale.ROOT));
                }
            }
        }
        return tokens;
    }
}
