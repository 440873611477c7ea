package io.ctlsidecar.core;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read capability over a local replica of the control store.
 *
 * Implementations must be safe for concurrent use: the sidecar shares a single
 * instance across all request threads and does no locking of its own.
 *
 * Key arguments are positional and must follow the table's primary-key column
 * order. Values are whatever {@link KeyCodec#resolve(KeySegment)} produced
 * (byte[] for binary segments, JSON scalars otherwise).
 */
public interface Reader {

    /**
     * Point lookup on the full primary key.
     *
     * @return the row, or empty if no row matched
     */
    Optional<Row> lookupByKey(ReadContext ctx, String family, String table, List<Object> key)
            throws ReaderException;

    /**
     * All rows whose primary key starts with {@code keyPrefix}, in key order.
     * The returned cursor must be closed by the caller.
     */
    RowCursor scanByKeyPrefix(ReadContext ctx, String family, String table, List<Object> keyPrefix)
            throws ReaderException;

    /** How far the local replica lags behind the authoritative ledger. */
    Duration ledgerLatency(ReadContext ctx) throws ReaderException;
}
