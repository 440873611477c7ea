package io.ctlsidecar.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SidecarConfigTest {

    @Test
    void negativeMaxRowsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new SidecarConfig("localhost:1331", new FakeReader(), -1));
    }

    @Test
    void zeroMaxRowsMeansUnbounded() {
        assertEquals(0, new SidecarConfig(":1331", new FakeReader(), 0).maxRows());
    }

    @Test
    void bindAddressForms() {
        assertEquals(new BindAddress("localhost", 1331), BindAddress.parse("localhost:1331"));
        assertEquals(new BindAddress("0.0.0.0", 1331), BindAddress.parse(":1331"));
        assertEquals(new BindAddress("::1", 8080), BindAddress.parse("[::1]:8080"));
        assertEquals("[::1]:8080", BindAddress.parse("[::1]:8080").toString());
        assertEquals(0, BindAddress.parse("127.0.0.1:0").port());
    }

    @Test
    void badBindAddressesRejected() {
        assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("localhost"));
        assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("localhost:http"));
        assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("localhost:70000"));
        assertThrows(IllegalArgumentException.class, () -> BindAddress.parse("::1:80"));
        assertThrows(IllegalArgumentException.class, () -> BindAddress.parse(""));
    }

    @Test
    void optionsDefaults() {
        SidecarOptions opts = SidecarOptions.fromArgs(new String[0]);
        assertEquals(SidecarOptions.DEFAULT_BIND_ADDR, opts.bindAddr());
        assertEquals(SidecarOptions.DEFAULT_LDB_PATH, opts.ldbPath());
        assertEquals(0, opts.maxRows());
    }

    @Test
    void optionsParsed() {
        SidecarOptions opts = SidecarOptions.fromArgs(
                new String[]{"-b", ":9000", "--ldb-path", "/tmp/ldb.db", "--max-rows", "500"});
        assertEquals(":9000", opts.bindAddr());
        assertEquals("/tmp/ldb.db", opts.ldbPath());
        assertEquals(500, opts.maxRows());
    }

    @Test
    void badOptionsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SidecarOptions.fromArgs(new String[]{"--max-rows", "-3"}));
        assertThrows(IllegalArgumentException.class, () -> SidecarOptions.fromArgs(new String[]{"--max-rows", "lots"}));
        assertThrows(IllegalArgumentException.class, () -> SidecarOptions.fromArgs(new String[]{"--bind-addr"}));
        assertThrows(IllegalArgumentException.class, () -> SidecarOptions.fromArgs(new String[]{"--verbose"}));
    }
}
