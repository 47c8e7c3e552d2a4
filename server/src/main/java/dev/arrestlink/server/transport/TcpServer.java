package dev.arrestlink.server.transport;

import dev.arrestlink.protocol.Envelope;
import dev.arrestlink.protocol.FrameLimits;
import dev.arrestlink.protocol.FrameReader;
import dev.arrestlink.protocol.FrameWriter;
import dev.arrestlink.protocol.MessageTypes;
import dev.arrestlink.protocol.ProtocolException;
import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts TCP clients and runs one {@link ClientSession} per connection. Each session owns its
 * socket: a reader loop feeds the {@link MessageHandler}, and a single sender thread drains the
 * session's outbound queue so that replies and broadcasts never interleave on the wire.
 */
public class TcpServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpServer.class);

    private final int port;
    private final MessageHandler handler;
    private final String welcomeMessage;
    private final FrameReader reader;
    private final FrameWriter writer;
    private final Clock clock;
    private final ExecutorService clientExecutor;
    private final Set<ClientSession> sessions = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public TcpServer(int port, FrameLimits limits, MessageHandler handler, String welcomeMessage, Clock clock) {
        this(port, limits, handler, welcomeMessage, clock, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tcp-server-client");
            t.setDaemon(true);
            return t;
        }));
    }

    TcpServer(int port, FrameLimits limits, MessageHandler handler, String welcomeMessage, Clock clock,
              ExecutorService clientExecutor) {
        this.port = port;
        this.handler = handler;
        this.welcomeMessage = welcomeMessage;
        this.clock = clock;
        this.clientExecutor = clientExecutor;
        this.reader = new FrameReader(limits);
        this.writer = new FrameWriter(limits);
    }

    public void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket(port);
        running = true;
        acceptThread = new Thread(this::acceptLoop, "tcp-server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("TCP server listening on port {}", getLocalPort());
    }

    private void acceptLoop() {
        while (running) {
            ClientSession session = null;
            try {
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                session = new ClientSession(socket);
                sessions.add(session);
                clientExecutor.submit(session::run);
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Client executor rejected connection", e);
                if (session != null) {
                    session.close();
                }
            }
        }
    }

    public int getLocalPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : -1;
    }

    public boolean isRunning() {
        return running;
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Queues a {@code SERVER_MESSAGE} for every open session.
     *
     * @return number of sessions the message was queued for
     */
    public int broadcast(String message) {
        Envelope envelope = serverMessage(message);
        int queued = 0;
        for (ClientSession session : sessions) {
            if (session.queue(envelope)) {
                queued++;
            }
        }
        LOGGER.info("Broadcast queued for {} clients: {}", queued, message);
        return queued;
    }

    public void stop() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing server socket", e);
            }
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (ClientSession session : new ArrayList<>(sessions)) {
            session.close();
        }
        clientExecutor.shutdown();
        try {
            if (!clientExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                clientExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("TCP server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private Envelope serverMessage(String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", LocalDateTime.now(clock).toString());
        data.put("message", message);
        return new Envelope(MessageTypes.SERVER_MESSAGE, data);
    }

    private final class ClientSession implements Closeable {

        private final Socket socket;
        private final String connectionId;
        private final BlockingQueue<Envelope> outbound = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final Thread sender;

        private volatile boolean open = true;

        ClientSession(Socket socket) {
            this.socket = socket;
            this.connectionId = socket.getRemoteSocketAddress().toString();
            this.sender = new Thread(this::sendLoop, "tcp-server-sender-" + connectionId);
            this.sender.setDaemon(true);
            LOGGER.info("Accepted connection {}", connectionId);
        }

        void run() {
            sender.start();
            queue(serverMessage(welcomeMessage));
            try {
                while (open) {
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
                        LOGGER.info("Client {} disconnected", connectionId);
                        break;
                    }
                    dispatch(next.get());
                }
            } finally {
                close();
            }
        }

        private boolean continueAfter(ProtocolException e) {
            switch (e.kind()) {
                case TIMEOUT -> {
                    if (e.isConnectionUsable()) {
                        LOGGER.trace("No frame from {} yet", connectionId);
                        return true;
                    }
                    LOGGER.warn("Client {} stalled mid-frame: {}", connectionId, e.getMessage());
                    return false;
                }
                case MALFORMED_PAYLOAD -> {
                    LOGGER.warn("Malformed frame from {}: {}", connectionId, e.getMessage());
                    queue(ServerMessageHandler.error("Malformed message"));
                    return true;
                }
                case MESSAGE_TOO_LARGE -> {
                    LOGGER.warn("Dropping {}: {}", connectionId, e.getMessage());
                    return false;
                }
                default -> {
                    if (open) {
                        LOGGER.warn("Connection {} lost: {}", connectionId, e.getMessage());
                    }
                    return false;
                }
            }
        }

        private void dispatch(Envelope request) {
            List<Envelope> replies;
            try {
                replies = handler.handle(connectionId, request);
            } catch (RuntimeException e) {
                LOGGER.error("Handler failed for {} from {}", request.type(), connectionId, e);
                replies = List.of(ServerMessageHandler.error("Internal error"));
            }
            for (Envelope reply : replies) {
                queue(reply);
            }
        }

        boolean queue(Envelope envelope) {
            if (!open) {
                return false;
            }
            return outbound.offer(envelope);
        }

        private void sendLoop() {
            try {
                while (open) {
                    Envelope next = outbound.poll(200, TimeUnit.MILLISECONDS);
                    if (next != null) {
                        writer.write(socket, next);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ProtocolException e) {
                if (open) {
                    LOGGER.warn("Send to {} failed: {}", connectionId, e.toString());
                }
                close();
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            open = false;
            sessions.remove(this);
            try {
                socket.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing connection {}", connectionId, e);
            }
            if (Thread.currentThread() != sender) {
                sender.interrupt();
            }
            if (!outbound.isEmpty()) {
                LOGGER.info("Discarding {} unsent messages for {}", outbound.size(), connectionId);
                outbound.clear();
            }
            LOGGER.info("Connection {} closed", connectionId);
        }
    }
}
