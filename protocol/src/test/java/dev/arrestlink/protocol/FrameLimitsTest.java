package dev.arrestlink.protocol;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FrameLimitsTest {

    @Test
    @DisplayName("Defaults match the deployed peers")
    void defaults() {
        FrameLimits limits = FrameLimits.defaults();
        assertEquals(10L * 1024 * 1024, limits.maxFrameBytes());
        assertEquals(Duration.ofSeconds(10), limits.headerTimeout());
        assertEquals(8 * 1024, limits.chunkSize());
        assertEquals(10_000, limits.headerTimeoutMillis());
    }

    @Test
    @DisplayName("Body timeout grows with declared length")
    void bodyTimeoutScales() {
        FrameLimits limits = FrameLimits.defaults().withBodyTimeout(Duration.ofSeconds(30), Duration.ofSeconds(10));
        assertEquals(30_000, limits.bodyTimeoutMillis(0));
        assertEquals(35_000, limits.bodyTimeoutMillis(512 * 1024));
        assertEquals(130_000, limits.bodyTimeoutMillis(10L * 1024 * 1024));
        assertTrue(limits.bodyTimeoutMillis(100) > 30_000);
    }

    @Test
    @DisplayName("Timeouts never collapse to zero, which means infinite on a socket")
    void neverZero() {
        FrameLimits limits = FrameLimits.defaults()
            .withHeaderTimeout(Duration.ofNanos(10))
            .withBodyTimeout(Duration.ofNanos(10), Duration.ZERO);
        assertEquals(1, limits.headerTimeoutMillis());
        assertEquals(1, limits.bodyTimeoutMillis(0));
    }

    @Test
    @DisplayName("Huge allowances are capped at Integer.MAX_VALUE")
    void capped() {
        FrameLimits limits = FrameLimits.defaults().withBodyTimeout(Duration.ofDays(30), Duration.ofDays(30));
        assertEquals(Integer.MAX_VALUE, limits.bodyTimeoutMillis(FrameLimits.DEFAULT_MAX_FRAME_BYTES));
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void validation() {
        FrameLimits limits = FrameLimits.defaults();
        assertThrows(IllegalArgumentException.class, () -> limits.withMaxFrameBytes(0));
        assertThrows(IllegalArgumentException.class, () -> limits.withMaxFrameBytes(0x1_0000_0000L));
        assertThrows(IllegalArgumentException.class, () -> limits.withChunkSize(0));
        assertThrows(IllegalArgumentException.class, () -> limits.withHeaderTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> limits.withBodyTimeout(Duration.ofSeconds(1), Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> limits.withHeaderTimeout(null));
    }
}
