package dev.arrestlink.protocol;

import java.io.IOException;
import java.util.Objects;

/**
 * Typed failure of the framing layer. Callers switch on {@link #kind()} to decide between retrying
 * on the same socket and tearing the connection down; {@link #isConnectionUsable()} answers the
 * question directly.
 */
public class ProtocolException extends IOException {

    private final ErrorKind kind;
    private final boolean connectionUsable;

    public ProtocolException(ErrorKind kind, String message) {
        this(kind, message, null, defaultUsable(kind));
    }

    public ProtocolException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, defaultUsable(kind));
    }

    public ProtocolException(ErrorKind kind, String message, Throwable cause, boolean connectionUsable) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.connectionUsable = connectionUsable;
    }

    public static ProtocolException timeout(String message, Throwable cause, boolean frameStarted) {
        return new ProtocolException(ErrorKind.TIMEOUT, message, cause, !frameStarted);
    }

    public static ProtocolException connection(String message, Throwable cause) {
        return new ProtocolException(ErrorKind.CONNECTION, message, cause);
    }

    public static ProtocolException tooLarge(String message) {
        return new ProtocolException(ErrorKind.MESSAGE_TOO_LARGE, message);
    }

    public static ProtocolException malformed(String message, Throwable cause) {
        return new ProtocolException(ErrorKind.MALFORMED_PAYLOAD, message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Whether the socket may still be used for the next frame. A timeout that interrupted a
     * partially received frame leaves the stream off a frame boundary and is not usable.
     */
    public boolean isConnectionUsable() {
        return connectionUsable;
    }

    private static boolean defaultUsable(ErrorKind kind) {
        return switch (kind) {
            case TIMEOUT, MALFORMED_PAYLOAD -> true;
            case CONNECTION, MESSAGE_TOO_LARGE -> false;
        };
    }

    @Override
    public String toString() {
        return "ProtocolException[" + kind + "]: " + getMessage();
    }
}
