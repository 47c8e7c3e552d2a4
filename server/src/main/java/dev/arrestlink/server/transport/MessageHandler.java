package dev.arrestlink.server.transport;

import dev.arrestlink.protocol.Envelope;
import java.util.List;

/**
 * Application side of a session: turns one inbound envelope into the envelopes to send back, in
 * order. Called from the session's reader thread, one message at a time per connection.
 */
@FunctionalInterface
public interface MessageHandler {

    List<Envelope> handle(String connectionId, Envelope request);
}
