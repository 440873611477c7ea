package io.ctlsidecar.server;

import io.ctlsidecar.core.ReadContext;
import io.undertow.connector.PooledByteBuffer;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.protocol.http.HttpServerConnection;
import org.xnio.XnioExecutor;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cancels a request's {@link ReadContext} when the client hangs up mid-request.
 *
 * Undertow suspends reads on an HTTP/1.x connection while an exchange is dispatched
 * to a worker, so a peer close is only noticed after the handler returns. This task
 * runs on the connection's IO thread every {@link #INTERVAL_MILLIS} ms and polls the
 * raw socket: end-of-stream (or a read error) means the client is gone.
 *
 * Polling starts once the request body has been fully read and stops when the
 * response starts, the exchange completes or the context is done. Bytes of a
 * pipelined next request are handed back to the connection and end the watch.
 */
final class DisconnectWatch implements Runnable {
    static final long INTERVAL_MILLIS = 100;

    private static final Logger log = Logger.getLogger(DisconnectWatch.class.getName());

    private final HttpServerExchange exchange;
    private final HttpServerConnection connection;
    private final ReadContext ctx;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile XnioExecutor.Key pending;

    private DisconnectWatch(HttpServerExchange exchange, HttpServerConnection connection, ReadContext ctx) {
        this.exchange = exchange;
        this.connection = connection;
        this.ctx = ctx;
    }

    /** Start watching; a no-op for connections that are not plain HTTP/1.x (HTTP/2 multiplexes streams). */
    static void start(HttpServerExchange exchange, ReadContext ctx) {
        if (!(exchange.getConnection() instanceof HttpServerConnection connection)) {
            return;
        }
        DisconnectWatch watch = new DisconnectWatch(exchange, connection, ctx);
        exchange.addExchangeCompleteListener((ex, next) -> {
            watch.stop();
            next.proceed();
        });
        watch.schedule();
    }

    void stop() {
        stopped.set(true);
        XnioExecutor.Key key = pending;
        if (key != null) {
            key.remove();
        }
    }

    private void schedule() {
        if (stopped.get()) {
            return;
        }
        pending = exchange.getIoThread().executeAfter(this, INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
        if (stopped.get()) {
            pending.remove();
        }
    }

    @Override
    public void run() {
        if (stopped.get() || ctx.isDone() || exchange.isResponseStarted()) {
            return;
        }
        if (nearDeadline()) {
            // the deadline ends the work anyway; an idle read this late could trip the read timeout
            return;
        }
        if (exchange.isRequestComplete() && peerClosed()) {
            log.fine(() -> "client closed connection, cancelling " + exchange.getRequestPath());
            ctx.cancel();
            return;
        }
        schedule();
    }

    private boolean nearDeadline() {
        return ctx.remaining()
                .map(left -> left.toMillis() <= 2 * INTERVAL_MILLIS)
                .orElse(false);
    }

    private boolean peerClosed() {
        if (!connection.isOpen()) {
            return true;
        }
        if (connection.getExtraBytes() != null) {
            // next request already buffered by the parser; the client is still there
            stopped.set(true);
            return false;
        }
        PooledByteBuffer pooled = connection.getByteBufferPool().allocate();
        boolean handedBack = false;
        try {
            ByteBuffer buffer = pooled.getBuffer();
            buffer.clear();
            int read = connection.getOriginalSourceConduit().read(buffer);
            if (read > 0) {
                buffer.flip();
                connection.setExtraBytes(pooled);
                handedBack = true;
                stopped.set(true);
                return false;
            }
            return read < 0;
        } catch (IOException e) {
            log.log(Level.FINE, "connection read failed while watching for disconnect", e);
            return true;
        } finally {
            if (!handedBack) {
                pooled.close();
            }
        }
    }
}
