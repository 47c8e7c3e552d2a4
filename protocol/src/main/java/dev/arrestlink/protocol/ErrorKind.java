package dev.arrestlink.protocol;

/**
 * Closed set of failure categories surfaced by {@link FrameReader} and {@link FrameWriter}.
 *
 * <p>End of stream is deliberately absent: a peer that closes between frames is reported as an
 * empty result by {@link FrameReader#read(java.net.Socket)}, not as a failure.
 */
public enum ErrorKind {

    /** Socket timeout in the header or body phase, or while writing. */
    TIMEOUT,

    /** Peer reset or closed the connection mid-frame, or the socket failed otherwise. */
    CONNECTION,

    /** Declared or produced frame length above the configured maximum. */
    MESSAGE_TOO_LARGE,

    /** Frame body is not valid UTF-8, not a JSON object, or lacks the envelope fields. */
    MALFORMED_PAYLOAD
}
