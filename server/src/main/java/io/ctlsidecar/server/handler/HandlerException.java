package io.ctlsidecar.server.handler;

/**
 * Handler-level failure. When built with a context, the message reads
 * {@code "<context>: <cause message>"} so callers see where the failure happened.
 */
public class HandlerException extends Exception {

    public HandlerException(String message) {
        super(message);
    }

    public HandlerException(String context, Throwable cause) {
        super(context + ": " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }
}
