package dev.arrestlink.protocol;

import java.net.Socket;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs framed traffic in one format so that client and server logs line up. Payload values are
 * truncated since they may carry base64 datasets or figures.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");
    private static final int MAX_VALUE_CHARS = 80;

    private Wire() {
    }

    public static void rx(String connectionId, Envelope envelope, int frameBytes) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX conn={} type={} bytes={} data={}",
                connectionId, envelope.type(), frameBytes, summarize(envelope.payload()));
        }
    }

    public static void tx(String connectionId, Envelope envelope, int frameBytes) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX conn={} type={} bytes={} data={}",
                connectionId, envelope.type(), frameBytes, summarize(envelope.payload()));
        }
    }

    static String summarize(Map<String, Object> payload) {
        StringBuilder builder = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            if (!first) {
                builder.append(", ");
            }
            first = false;
            builder.append(entry.getKey()).append('=').append(truncate(String.valueOf(entry.getValue()), MAX_VALUE_CHARS));
        }
        return builder.append('}').toString();
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...(" + value.length() + " chars)";
    }

    public static String describe(Socket socket) {
        Object remote = socket.getRemoteSocketAddress();
        return remote != null ? remote.toString() : "unconnected";
    }
}
