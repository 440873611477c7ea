package io.ctlsidecar.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One control-store record: column name to untyped value, in column order.
 *
 * Serializes as a plain JSON object. Binary column values are byte arrays
 * and end up base64-encoded on the wire.
 */
public final class Row {

    private final Map<String, Object> columns;

    public Row(Map<String, Object> columns) {
        Objects.requireNonNull(columns, "columns");
        // LinkedHashMap rather than Map.copyOf: values may be SQL NULL.
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    @JsonValue
    public Map<String, Object> columns() {
        return columns;
    }

    public Object get(String column) {
        return columns.get(column);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + columns;
    }
}
