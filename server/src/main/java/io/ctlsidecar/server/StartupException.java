package io.ctlsidecar.server;

/** The sidecar could not bind or start serving. Reported to the starter, never over HTTP. */
public class StartupException extends RuntimeException {

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
