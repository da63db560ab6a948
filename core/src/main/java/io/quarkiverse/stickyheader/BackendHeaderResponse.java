package io.quarkiverse.stickyheader;

import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;

/**
 * Response decorator of {@link StickyHeader}. Right before the head is written it resolves the backend from the
 * response cookie or, failing that, from the query string, and publishes it as {@value StickyHeader#HEADER_NAME}.
 * Body bytes go straight to the wrapped sink.
 */
public class BackendHeaderResponse implements ResponseSink {
    protected static final Logger log = Logger.getLogger(BackendHeaderResponse.class);

    private final ResponseSink delegate;
    private final String backendFromQueryString;
    private final StickyHeaderOptions options;
    private boolean headApplied;

    BackendHeaderResponse(ResponseSink delegate, String backendFromQueryString, StickyHeaderOptions options) {
        this.delegate = delegate;
        this.backendFromQueryString = backendFromQueryString;
        this.options = options;
    }

    @Override
    public MultiMap headers() {
        return delegate.headers();
    }

    @Override
    public void writeHead(int statusCode) {
        if (headApplied) {
            log.debugv("Ignoring superfluous writeHead({0})", statusCode);
            return;
        }
        headApplied = true;
        applyBackendHeaders();
        delegate.writeHead(statusCode);
    }

    @Override
    public boolean headWritten() {
        return headApplied || delegate.headWritten();
    }

    @Override
    public Future<Void> write(Buffer chunk) {
        ensureHead();
        return delegate.write(chunk);
    }

    @Override
    public Future<Void> end() {
        ensureHead();
        return delegate.end();
    }

    @Override
    public <T extends ResponseCapability> Optional<T> capability(Class<T> type) {
        if (type == StreamFlush.class) {
            return delegate.capability(StreamFlush.class).map(flush -> {
                StreamFlush headFirst = () -> {
                    ensureHead();
                    return flush.flush();
                };
                return type.cast(headFirst);
            });
        }
        return delegate.capability(type);
    }

    public String getBackendFromQueryString() {
        return backendFromQueryString;
    }

    private void ensureHead() {
        if (!headApplied) {
            writeHead(200);
        }
    }

    private void applyBackendHeaders() {
        MultiMap headers = delegate.headers();
        String backend = SetCookies.findValue(headers.getAll(HttpHeaders.SET_COOKIE), StickyHeader.COOKIE_NAME);
        if (backend != null && !backend.isEmpty()) {
            log.debugv("Backend {0} set by response cookie", backend);
            expireLegacyCookie(headers);
            headers.set(StickyHeader.HEADER_NAME, headerValue(backend));
        } else if (backendFromQueryString != null) {
            // keep the cookie in sync with the header for the next request
            log.debugv("Backend {0} taken from query string", backendFromQueryString);
            expireLegacyCookie(headers);
            headers.add(HttpHeaders.SET_COOKIE,
                    SetCookies.format(StickyHeader.COOKIE_NAME, backendFromQueryString, options.getCookiePath()));
            headers.set(StickyHeader.HEADER_NAME, headerValue(backendFromQueryString));
        }
        addOrAppendHeader(headers, StickyHeader.EXPOSE_HEADERS, StickyHeader.HEADER_NAME);
    }

    private void expireLegacyCookie(MultiMap headers) {
        if (options.isExpireLegacyCookie()) {
            headers.add(HttpHeaders.SET_COOKIE, SetCookies.expired(StickyHeader.COOKIE_NAME, options.getLegacyCookiePath()));
        }
    }

    static void addOrAppendHeader(MultiMap headers, String name, String value) {
        List<String> current = headers.getAll(name);
        String joined = String.join(", ", current).trim();
        if (joined.isEmpty()) {
            headers.set(name, value);
        } else if (!listsToken(joined, value)) {
            headers.set(name, joined + ", " + value);
        }
    }

    private static boolean listsToken(String list, String token) {
        for (String element : list.split(",")) {
            if (element.trim().equalsIgnoreCase(token)) {
                return true;
            }
        }
        return false;
    }

    private static String headerValue(String value) {
        return value.replace('\r', ' ').replace('\n', ' ');
    }
}
