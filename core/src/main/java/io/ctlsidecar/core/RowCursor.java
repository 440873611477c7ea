package io.ctlsidecar.core;

/**
 * Lazy, forward-only sequence of rows produced by a prefix scan.
 *
 * A cursor holds reader resources (connections, statements) until closed.
 * Callers must close it exactly once on every path, normally via try-with-resources.
 * {@link #close()} is idempotent and never throws.
 */
public interface RowCursor extends AutoCloseable {

    /**
     * Whether another row is available. Repeated calls without an intervening
     * {@link #next()} return the same answer and do not skip rows.
     */
    boolean hasNext() throws ReaderException;

    /** Return the next row and move past it; fails when {@link #hasNext()} is false. */
    Row next() throws ReaderException;

    @Override
    void close();
}
