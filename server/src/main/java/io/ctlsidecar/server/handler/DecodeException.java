package io.ctlsidecar.server.handler;

/** Request body was not a valid read request. Raised before the reader is consulted. */
public class DecodeException extends HandlerException {

    public DecodeException(Throwable cause) {
        super("decode body", cause);
    }
}
