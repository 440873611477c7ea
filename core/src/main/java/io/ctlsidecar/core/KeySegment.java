// file: core/src/main/java/io/ctlsidecar/core/KeySegment.java
package io.ctlsidecar.core;

import java.util.Arrays;

/**
 * One positional segment of a primary key, as sent over the wire.
 *
 * A segment is either a scalar (any JSON-typed value: string, number, bool, null)
 * or a binary payload (base64 on the wire, raw bytes here). Binary segments exist
 * because varbinary key columns cannot be expressed as JSON scalars.
 *
 * Segment order is significant and must match the table's primary-key column order.
 */
public sealed interface KeySegment permits KeySegment.Scalar, KeySegment.Binary {

    /**
     * Build a segment from the two wire fields.
     * A non-empty binary payload wins over any scalar value sent alongside it.
     */
    static KeySegment of(Object value, byte[] binary) {
        if (binary != null && binary.length > 0) {
            return new Binary(binary);
        }
        return new Scalar(value);
    }

    /** Scalar key value; {@code value} may be null. */
    record Scalar(Object value) implements KeySegment {}

    /** Raw bytes for a varbinary key column. */
    record Binary(byte[] bytes) implements KeySegment {
        public Binary {
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Binary other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Binary[" + bytes.length + " bytes]";
        }
    }
}
