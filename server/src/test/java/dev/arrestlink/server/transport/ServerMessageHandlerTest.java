package dev.arrestlink.server.transport;

import static org.junit.jupiter.api.Assertions.*;

import dev.arrestlink.protocol.Envelope;
import dev.arrestlink.protocol.MessageTypes;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServerMessageHandlerTest {

    private final ServerMessageHandler handler =
        new ServerMessageHandler(Clock.fixed(Instant.parse("2024-05-06T07:08:09Z"), ZoneOffset.UTC));

    @Test
    void pingIsAnsweredWithPong() {
        List<Envelope> replies = handler.handle("/127.0.0.1:5000", new Envelope(MessageTypes.PING, Map.of("nonce", "abc")));

        assertEquals(1, replies.size());
        Envelope pong = replies.get(0);
        assertEquals(MessageTypes.PONG, pong.type());
        assertEquals("abc", pong.text("nonce"));
        assertEquals("2024-05-06T07:08:09Z", pong.text("server_time"));
    }

    @Test
    void otherTypesAreRejected() {
        List<Envelope> replies = handler.handle("/127.0.0.1:5000", new Envelope(MessageTypes.LOGIN, Map.of("email", "a@b.c")));

        Envelope error = replies.get(0);
        assertEquals(MessageTypes.ERROR, error.type());
        assertEquals(MessageTypes.STATUS_ERROR, error.text("status"));
        assertEquals("Unsupported message type: LOGIN", error.text("message"));
    }
}
