// file: server/src/main/java/io/ctlsidecar/server/dto/ReadRequest.java
package io.ctlsidecar.server.dto;

import io.ctlsidecar.core.KeySegment;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON body for POST /get-row-by-key/{family}/{table} and
 * POST /get-rows-by-key-prefix/{family}/{table}.
 * Example:
 *   {
 *     "key": [
 *       { "value": "acme" },
 *       { "value": 42 },
 *       { "binary": "CgsM" }
 *     ]
 *   }
 * Segment order must match the table's primary-key column order.
 * Property names are matched case-insensitively ("Key", "Value", "Binary" also work).
 */
public class ReadRequest {
    public List<Segment> key;

    public static class Segment {
        public Object value;   // any JSON scalar; used unless binary is non-empty
        public byte[] binary;  // base64 on the wire, for varbinary key columns
    }

    /** Key segments in request order; empty when the body carried no key. */
    public List<KeySegment> segments() {
        if (key == null) {
            return List.of();
        }
        List<KeySegment> out = new ArrayList<>(key.size());
        for (Segment s : key) {
            out.add(s == null ? KeySegment.of(null, null) : KeySegment.of(s.value, s.binary));
        }
        return out;
    }
}
