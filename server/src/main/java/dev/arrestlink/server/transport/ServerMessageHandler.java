package dev.arrestlink.server.transport;

import dev.arrestlink.protocol.Envelope;
import dev.arrestlink.protocol.MessageTypes;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Answers liveness probes and rejects everything else. Registration, login and query execution
 * are served by handlers outside this transport.
 */
@Component
@RequiredArgsConstructor
public class ServerMessageHandler implements MessageHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerMessageHandler.class);

    private final Clock clock;

    @Override
    public List<Envelope> handle(String connectionId, Envelope request) {
        return switch (request.type()) {
            case MessageTypes.PING -> List.of(pong(request));
            default -> {
                LOGGER.warn("Unsupported message type {} from {}", request.type(), connectionId);
                yield List.of(error("Unsupported message type: " + request.type()));
            }
        };
    }

    private Envelope pong(Envelope ping) {
        Map<String, Object> data = new LinkedHashMap<>(ping.payload());
        data.put("server_time", clock.instant().toString());
        return new Envelope(MessageTypes.PONG, data);
    }

    public static Envelope error(String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", MessageTypes.STATUS_ERROR);
        data.put("message", message);
        return new Envelope(MessageTypes.ERROR, data);
    }
}
