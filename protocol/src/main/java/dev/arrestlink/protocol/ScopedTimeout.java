package dev.arrestlink.protocol;

import java.net.Socket;
import java.net.SocketException;

/**
 * Temporarily overrides a socket's read timeout and puts the original back on {@link #close()}.
 * Use with try-with-resources so the override never leaks onto a socket shared with other code.
 */
final class ScopedTimeout implements AutoCloseable {

    private final Socket socket;
    private final int original;

    private ScopedTimeout(Socket socket, int original) {
        this.socket = socket;
        this.original = original;
    }

    static ScopedTimeout apply(Socket socket, int timeoutMillis) throws SocketException {
        int original = socket.getSoTimeout();
        socket.setSoTimeout(timeoutMillis);
        return new ScopedTimeout(socket, original);
    }

    @Override
    public void close() throws SocketException {
        // A socket closed inside the scope has no timeout left to restore.
        if (!socket.isClosed()) {
            socket.setSoTimeout(original);
        }
    }
}
