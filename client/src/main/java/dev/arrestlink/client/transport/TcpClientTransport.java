package dev.arrestlink.client.transport;

import dev.arrestlink.protocol.Envelope;
import dev.arrestlink.protocol.FrameLimits;
import dev.arrestlink.protocol.FrameReader;
import dev.arrestlink.protocol.FrameWriter;
import dev.arrestlink.protocol.ProtocolException;
import java.io.Closeable;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TcpClientTransport implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpClientTransport.class);

    private final String host;
    private final int port;
    private final FrameReader reader;
    private final FrameWriter writer;
    private final BlockingQueue<Envelope> inbound = new LinkedBlockingQueue<>();
    private final Object sendLock = new Object();

    private Socket socket;
    private Thread readerThread;
    private volatile boolean running;
    private volatile ProtocolException failure;

    public TcpClientTransport(String host, int port) {
        this(host, port, FrameLimits.defaults());
    }

    public TcpClientTransport(String host, int port, FrameLimits limits) {
        this.host = host;
        this.port = port;
        this.reader = new FrameReader(limits);
        this.writer = new FrameWriter(limits);
    }

    public void connect() throws IOException {
        socket = new Socket(host, port);
        socket.setTcpNoDelay(true);
        running = true;
        readerThread = new Thread(this::readLoop, "tcp-client-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        LOGGER.info("Connected to {}:{}", host, port);
    }

    private void readLoop() {
        try {
            while (running) {
                Optional<Envelope> next;
                try {
                    next = reader.read(socket);
                } catch (ProtocolException e) {
                    if (continueAfter(e)) {
                        continue;
                    }
                    break;
                }
                if (next.isEmpty()) {
                    LOGGER.info("Connection closed by server");
                    break;
                }
                inbound.add(next.get());
            }
        } finally {
            closeSocket();
            running = false;
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing connection to {}:{}", host, port, e);
        }
    }

    private boolean continueAfter(ProtocolException e) {
        switch (e.kind()) {
            case TIMEOUT -> {
                if (e.isConnectionUsable()) {
                    return true;
                }
                LOGGER.warn("Server stalled mid-frame: {}", e.getMessage());
            }
            case MALFORMED_PAYLOAD -> {
                LOGGER.warn("Skipping malformed frame: {}", e.getMessage());
                return true;
            }
            default -> {
                if (running) {
                    LOGGER.error("Transport error: {}", e.toString());
                }
            }
        }
        failure = e;
        return false;
    }

    /**
     * Sends one envelope. Safe to call from several threads; frames are written one at a time.
     */
    public void send(Envelope envelope) throws ProtocolException {
        Objects.requireNonNull(envelope, "envelope");
        if (socket == null) {
            throw new IllegalStateException("Not connected");
        }
        synchronized (sendLock) {
            writer.write(socket, envelope);
        }
    }

    /**
     * Next envelope received from the server, or empty when none arrived within {@code timeout}.
     */
    public Optional<Envelope> nextMessage(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Next envelope of the given type; envelopes of other types received meanwhile are discarded.
     */
    public Optional<Envelope> nextMessage(String type, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            Envelope next = inbound.poll(remaining, TimeUnit.NANOSECONDS);
            if (next == null) {
                return Optional.empty();
            }
            if (type.equals(next.type())) {
                return Optional.of(next);
            }
            LOGGER.debug("Skipping {} while waiting for {}", next.type(), type);
        }
    }

    public boolean isConnected() {
        return running && socket != null && !socket.isClosed();
    }

    /** The error that stopped the receiver, if it stopped on one. */
    public Optional<ProtocolException> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public void close() throws IOException {
        running = false;
        if (socket != null && !socket.isClosed()) {
            socket.close();
        }
        if (readerThread != null) {
            try {
                readerThread.join(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
