package io.ctlsidecar.server;

import io.ctlsidecar.core.Reader;

import java.util.Objects;

/**
 * What a {@link Sidecar} needs to serve.
 *
 * @param bindAddr listen address, see {@link BindAddress#parse(String)}
 * @param reader   shared reader; must be safe for concurrent use
 * @param maxRows  ceiling on rows per prefix-scan response, 0 = unbounded
 */
public record SidecarConfig(String bindAddr, Reader reader, int maxRows) {
    public SidecarConfig {
        Objects.requireNonNull(bindAddr, "bindAddr");
        Objects.requireNonNull(reader, "reader");
        if (maxRows < 0) throw new IllegalArgumentException("maxRows must be >= 0");
    }
}
