package io.ctlsidecar.server.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;

/**
 * JSON response for GET /get-ledger-latency.
 * Example:
 *   {
 *     "value": 1.5,
 *     "unit": "seconds"
 *   }
 */
@JsonPropertyOrder({"value", "unit"})
public class LedgerLatencyResponse {
    public double value;
    public String unit;

    public static LedgerLatencyResponse of(Duration latency) {
        var dto = new LedgerLatencyResponse();
        dto.value = latency.getSeconds() + latency.getNano() / 1_000_000_000.0;
        dto.unit = "seconds";
        return dto;
    }
}
