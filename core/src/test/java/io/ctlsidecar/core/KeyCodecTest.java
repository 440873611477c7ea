package io.ctlsidecar.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for key segment resolution.
 */
class KeyCodecTest {

    @Test
    void binary_payload_wins_over_scalar_on_same_segment() {
        byte[] raw = {0x01, 0x02, (byte) 0xff};
        KeySegment seg = KeySegment.of("ignored-scalar", raw);

        assertTrue(seg instanceof KeySegment.Binary);
        assertArrayEquals(raw, (byte[]) KeyCodec.resolve(seg));
    }

    @Test
    void empty_binary_falls_back_to_scalar() {
        KeySegment seg = KeySegment.of(42, new byte[0]);

        assertEquals(new KeySegment.Scalar(42), seg);
        assertEquals(42, KeyCodec.resolve(seg));
    }

    @Test
    void scalar_without_value_resolves_to_null() {
        assertNull(KeyCodec.resolve(KeySegment.of(null, null)));
    }

    @Test
    void positional_args_preserve_segment_order() {
        byte[] raw = "abc".getBytes();
        List<KeySegment> segs = List.of(
                KeySegment.of("tenant-1", null),
                KeySegment.of(null, raw),
                KeySegment.of(7L, null),
                KeySegment.of(null, null)
        );

        List<Object> args = KeyCodec.toPositionalArgs(segs);

        assertEquals(4, args.size());
        assertEquals("tenant-1", args.get(0));
        assertArrayEquals(raw, (byte[]) args.get(1));
        assertEquals(7L, args.get(2));
        assertNull(args.get(3));
    }

    @Test
    void no_segments_means_no_args() {
        assertTrue(KeyCodec.toPositionalArgs(null).isEmpty());
        assertTrue(KeyCodec.toPositionalArgs(List.of()).isEmpty());
    }

    @Test
    void binary_segment_is_isolated_from_caller_array() {
        byte[] raw = {1, 2, 3};
        KeySegment seg = KeySegment.of(null, raw);
        raw[0] = 9;

        byte[] resolved = (byte[]) KeyCodec.resolve(seg);
        assertEquals(1, resolved[0]);
        assertTrue(Arrays.equals(new byte[]{1, 2, 3}, resolved));
        assertEquals(seg, KeySegment.of("x", new byte[]{1, 2, 3}));
    }
}
