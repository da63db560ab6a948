package io.quarkiverse.stickyheader;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.streams.WriteStream;

/**
 * Presents a {@link ResponseSink} as a {@link WriteStream} so a source can be piped into it. A write counts as queued
 * until the future returned by the sink completes; the queue is full once {@code writeQueueMaxSize} writes are pending.
 */
public class ResponseSinkWriteStream implements WriteStream<Buffer> {
    public static final int DEFAULT_MAX_PENDING_WRITES = 8;

    private final ResponseSink sink;
    private int maxPending = DEFAULT_MAX_PENDING_WRITES;
    private int pending;
    private Handler<Void> drainHandler;
    private Handler<Throwable> exceptionHandler;

    public ResponseSinkWriteStream(ResponseSink sink) {
        this.sink = sink;
    }

    @Override
    public ResponseSinkWriteStream exceptionHandler(Handler<Throwable> handler) {
        this.exceptionHandler = handler;
        return this;
    }

    @Override
    public Future<Void> write(Buffer data) {
        pending++;
        Future<Void> written = sink.write(data);
        written.onComplete(this::writeCompleted);
        return written;
    }

    @Override
    public void write(Buffer data, Handler<AsyncResult<Void>> handler) {
        Future<Void> written = write(data);
        if (handler != null) {
            written.onComplete(handler);
        }
    }

    @Override
    public Future<Void> end() {
        return sink.end();
    }

    @Override
    public void end(Handler<AsyncResult<Void>> handler) {
        Future<Void> ended = end();
        if (handler != null) {
            ended.onComplete(handler);
        }
    }

    @Override
    public ResponseSinkWriteStream setWriteQueueMaxSize(int maxSize) {
        this.maxPending = Math.max(1, maxSize);
        return this;
    }

    @Override
    public boolean writeQueueFull() {
        return pending >= maxPending;
    }

    @Override
    public ResponseSinkWriteStream drainHandler(Handler<Void> handler) {
        this.drainHandler = handler;
        return this;
    }

    public int getPendingWrites() {
        return pending;
    }

    private void writeCompleted(AsyncResult<Void> result) {
        pending--;
        if (result.failed() && exceptionHandler != null) {
            exceptionHandler.handle(result.cause());
        }
        Handler<Void> handler = drainHandler;
        if (handler != null && pending <= maxPending / 2) {
            drainHandler = null;
            handler.handle(null);
        }
    }
}
