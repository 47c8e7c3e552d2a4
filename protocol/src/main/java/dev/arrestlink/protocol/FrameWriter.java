package dev.arrestlink.protocol;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one envelope as a frame: four-byte big-endian length followed by the UTF-8 JSON body.
 * Prefix and body go out in a single write so a failed write never leaves a frame that claims to
 * be complete. Not safe for concurrent writers on one socket; callers serialize sends.
 */
public final class FrameWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrameWriter.class);

    private final FrameLimits limits;

    public FrameWriter() {
        this(FrameLimits.defaults());
    }

    public FrameWriter(FrameLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public void write(Socket socket, Envelope envelope) throws ProtocolException {
        String connectionId = Wire.describe(socket);
        byte[] frame = encode(envelope, connectionId);
        try {
            OutputStream out = socket.getOutputStream();
            out.write(frame);
            out.flush();
        } catch (SocketTimeoutException e) {
            throw ProtocolException.timeout("Timed out writing " + envelope.type() + " to " + connectionId, e, true);
        } catch (IOException e) {
            throw ProtocolException.connection("Connection lost writing " + envelope.type() + " to " + connectionId, e);
        }
        Wire.tx(connectionId, envelope, frame.length);
    }

    byte[] encode(Envelope envelope, String connectionId) throws ProtocolException {
        byte[] body = envelope.serialize().getBytes(StandardCharsets.UTF_8);
        if (body.length > limits.maxFrameBytes()) {
            LOGGER.warn("Refusing to send {} to {}: {} bytes exceeds limit of {}",
                envelope.type(), connectionId, body.length, limits.maxFrameBytes());
            throw ProtocolException.tooLarge("Frame of " + body.length + " bytes exceeds limit of "
                + limits.maxFrameBytes());
        }
        return ByteBuffer.allocate(FrameReader.HEADER_BYTES + body.length)
            .order(ByteOrder.BIG_ENDIAN)
            .putInt(body.length)
            .put(body)
            .array();
    }
}
