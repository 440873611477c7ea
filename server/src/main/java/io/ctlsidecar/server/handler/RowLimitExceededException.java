package io.ctlsidecar.server.handler;

/** A prefix scan produced more rows than the configured ceiling allows. */
public class RowLimitExceededException extends HandlerException {
    private final int maxRows;

    public RowLimitExceededException(int maxRows) {
        super("max row count (" + maxRows + ") exceeded");
        this.maxRows = maxRows;
    }

    public int maxRows() {
        return maxRows;
    }
}
