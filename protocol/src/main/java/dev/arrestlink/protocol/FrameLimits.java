package dev.arrestlink.protocol;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds enforced by {@link FrameReader} and {@link FrameWriter}.
 *
 * @param maxFrameBytes largest accepted body length, exclusive of the four-byte prefix
 * @param headerTimeout how long to wait for the next frame to begin
 * @param bodyTimeoutFloor body read timeout for an empty or tiny body
 * @param bodyTimeoutPerMegabyte extra body read allowance per MiB of declared length
 * @param chunkSize upper bound on a single body read
 */
public record FrameLimits(
    long maxFrameBytes,
    Duration headerTimeout,
    Duration bodyTimeoutFloor,
    Duration bodyTimeoutPerMegabyte,
    int chunkSize
) {

    public static final long DEFAULT_MAX_FRAME_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_CHUNK_SIZE = 8 * 1024;

    private static final long MEGABYTE = 1024L * 1024;
    private static final long MAX_UNSIGNED_INT = 0xFFFF_FFFFL;

    public FrameLimits {
        if (maxFrameBytes <= 0 || maxFrameBytes > MAX_UNSIGNED_INT) {
            throw new IllegalArgumentException("maxFrameBytes out of range: " + maxFrameBytes);
        }
        if (maxFrameBytes > Integer.MAX_VALUE - 8) {
            // Bodies are buffered in a single byte[].
            throw new IllegalArgumentException("maxFrameBytes exceeds array capacity: " + maxFrameBytes);
        }
        requirePositive(headerTimeout, "headerTimeout");
        requirePositive(bodyTimeoutFloor, "bodyTimeoutFloor");
        Objects.requireNonNull(bodyTimeoutPerMegabyte, "bodyTimeoutPerMegabyte");
        if (bodyTimeoutPerMegabyte.isNegative()) {
            throw new IllegalArgumentException("bodyTimeoutPerMegabyte must not be negative");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
    }

    public static FrameLimits defaults() {
        return new FrameLimits(DEFAULT_MAX_FRAME_BYTES, Duration.ofSeconds(10), Duration.ofSeconds(30),
            Duration.ofSeconds(10), DEFAULT_CHUNK_SIZE);
    }

    public FrameLimits withMaxFrameBytes(long value) {
        return new FrameLimits(value, headerTimeout, bodyTimeoutFloor, bodyTimeoutPerMegabyte, chunkSize);
    }

    public FrameLimits withHeaderTimeout(Duration value) {
        return new FrameLimits(maxFrameBytes, value, bodyTimeoutFloor, bodyTimeoutPerMegabyte, chunkSize);
    }

    public FrameLimits withBodyTimeout(Duration floor, Duration perMegabyte) {
        return new FrameLimits(maxFrameBytes, headerTimeout, floor, perMegabyte, chunkSize);
    }

    public FrameLimits withChunkSize(int value) {
        return new FrameLimits(maxFrameBytes, headerTimeout, bodyTimeoutFloor, bodyTimeoutPerMegabyte, value);
    }

    /**
     * Body read timeout for a declared length: the floor plus a share of the per-MiB allowance
     * proportional to the length, capped at {@link Integer#MAX_VALUE} milliseconds. Never zero, which a socket
     * would read as "no timeout".
     */
    public int bodyTimeoutMillis(long length) {
        double megabytes = (double) length / MEGABYTE;
        double millis = bodyTimeoutFloor.toMillis() + megabytes * bodyTimeoutPerMegabyte.toMillis();
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, Math.ceil(millis)));
    }

    public int headerTimeoutMillis() {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, headerTimeout.toMillis()));
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
