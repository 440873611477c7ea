// file: core/src/main/java/io/ctlsidecar/core/KeyCodec.java
package io.ctlsidecar.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts wire-level key segments into the positional arguments a {@link Reader} expects.
 *
 * Nothing here validates keys: a missing value resolves to null and is forwarded
 * as such. Whether that matches a row is the reader's call.
 */
public final class KeyCodec {

    private KeyCodec() {
        // utility
    }

    /** Native value for one segment: the bytes of a binary segment, else the scalar value. */
    public static Object resolve(KeySegment segment) {
        if (segment == null) {
            return null;
        }
        if (segment instanceof KeySegment.Binary b) {
            return b.bytes();
        }
        return ((KeySegment.Scalar) segment).value();
    }

    /** Resolve every segment, preserving order. */
    public static List<Object> toPositionalArgs(List<KeySegment> segments) {
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }
        List<Object> args = new ArrayList<>(segments.size());
        for (KeySegment s : segments) {
            args.add(resolve(s));
        }
        return args;
    }
}
