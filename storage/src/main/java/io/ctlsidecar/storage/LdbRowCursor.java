package io.ctlsidecar.storage;

import io.ctlsidecar.core.ReadContext;
import io.ctlsidecar.core.ReaderException;
import io.ctlsidecar.core.Row;
import io.ctlsidecar.core.RowCursor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Cursor over an open LDB result set. Owns the connection, statement and result set;
 * {@link #close()} releases all three.
 */
final class LdbRowCursor implements RowCursor {

    private final ReadContext ctx;
    private final Connection conn;
    private final PreparedStatement st;
    private final ResultSet rs;
    private boolean closed;
    private boolean positioned; // rs has been advanced and the current row not yet returned
    private boolean onRow;

    LdbRowCursor(ReadContext ctx, Connection conn, PreparedStatement st, ResultSet rs) {
        this.ctx = ctx;
        this.conn = conn;
        this.st = st;
        this.rs = rs;
    }

    @Override
    public boolean hasNext() throws ReaderException {
        if (closed) {
            throw new ReaderException("cursor is closed");
        }
        if (positioned) {
            return onRow;
        }
        ctx.checkActive();
        try {
            onRow = rs.next();
        } catch (SQLException e) {
            throw LdbReader.failure(ctx, e);
        }
        positioned = true;
        return onRow;
    }

    @Override
    public Row next() throws ReaderException {
        if (closed) {
            throw new ReaderException("cursor is closed");
        }
        if (!hasNext()) {
            throw new ReaderException("no more rows");
        }
        positioned = false;
        try {
            return LdbReader.decodeRow(rs);
        } catch (SQLException e) {
            throw new ReaderException("decode row: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        LdbReader.closeQuietly(rs);
        LdbReader.closeQuietly(st);
        LdbReader.closeQuietly(conn);
    }

    boolean isClosed() {
        return closed;
    }
}
