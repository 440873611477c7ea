package io.ctlsidecar.core;

/**
 * Failure surfaced by a {@link Reader}: store unavailable, bad key shape,
 * unknown table, cancelled request, etc. The message is shown to HTTP callers verbatim.
 */
public class ReaderException extends Exception {

    public ReaderException(String message) {
        super(message);
    }

    public ReaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
