package dev.arrestlink.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one frame per call and turns it back into an {@link Envelope}.
 *
 * <p>The header is awaited under {@link FrameLimits#headerTimeout()}; the body under a timeout
 * that grows with its declared length. Both overrides are restored before returning. A peer that
 * closes before the first header byte yields {@link Optional#empty()}; every other abnormal
 * outcome is a {@link ProtocolException}. Declared lengths above
 * {@link FrameLimits#maxFrameBytes()} close the socket without reading the body.
 */
public final class FrameReader {

    static final int HEADER_BYTES = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger(FrameReader.class);
    private static final int INITIAL_BUFFER = 64 * 1024;

    private final FrameLimits limits;

    public FrameReader() {
        this(FrameLimits.defaults());
    }

    public FrameReader(FrameLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public Optional<Envelope> read(Socket socket) throws ProtocolException {
        String connectionId = Wire.describe(socket);
        InputStream in = inputOf(socket, connectionId);

        byte[] header = new byte[HEADER_BYTES];
        int headerRead;
        try (ScopedTimeout ignored = ScopedTimeout.apply(socket, limits.headerTimeoutMillis())) {
            headerRead = readHeader(in, header, connectionId);
        } catch (SocketException e) {
            throw ProtocolException.connection("Cannot adjust header timeout on " + connectionId, e);
        }
        if (headerRead == 0) {
            LOGGER.debug("Peer {} closed the connection between frames", connectionId);
            return Optional.empty();
        }
        if (headerRead < HEADER_BYTES) {
            throw ProtocolException.connection("Connection closed after " + headerRead + " of "
                + HEADER_BYTES + " header bytes from " + connectionId, null);
        }

        long length = Integer.toUnsignedLong(ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt());
        if (length > limits.maxFrameBytes()) {
            throw rejectOversized(socket, connectionId, length);
        }

        byte[] body;
        try (ScopedTimeout ignored = ScopedTimeout.apply(socket, limits.bodyTimeoutMillis(length))) {
            body = readBody(in, (int) length, connectionId);
        } catch (SocketException e) {
            throw ProtocolException.connection("Cannot adjust body timeout on " + connectionId, e);
        }

        Envelope envelope = Envelope.deserialize(decodeUtf8(body, connectionId));
        Wire.rx(connectionId, envelope, HEADER_BYTES + body.length);
        return Optional.of(envelope);
    }

    private static InputStream inputOf(Socket socket, String connectionId) throws ProtocolException {
        try {
            return socket.getInputStream();
        } catch (IOException e) {
            throw ProtocolException.connection("Socket " + connectionId + " is not readable", e);
        }
    }

    /** Returns the number of header bytes read before end of stream; 4 when complete. */
    private static int readHeader(InputStream in, byte[] header, String connectionId) throws ProtocolException {
        int offset = 0;
        try {
            while (offset < header.length) {
                int read = in.read(header, offset, header.length - offset);
                if (read == -1) {
                    break;
                }
                offset += read;
            }
        } catch (SocketTimeoutException e) {
            throw ProtocolException.timeout("Timed out waiting for frame header from " + connectionId
                + " after " + offset + " bytes", e, offset > 0);
        } catch (IOException e) {
            throw ProtocolException.connection("Connection lost reading frame header from " + connectionId, e);
        }
        return offset;
    }

    private byte[] readBody(InputStream in, int length, String connectionId) throws ProtocolException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.min(length, INITIAL_BUFFER));
        byte[] chunk = new byte[Math.min(Math.max(length, 1), limits.chunkSize())];
        int received = 0;
        try {
            while (received < length) {
                int read = in.read(chunk, 0, Math.min(chunk.length, length - received));
                if (read == -1) {
                    throw ProtocolException.connection("Connection closed after " + received + " of "
                        + length + " body bytes from " + connectionId, null);
                }
                buffer.write(chunk, 0, read);
                received += read;
            }
        } catch (SocketTimeoutException e) {
            throw ProtocolException.timeout("Timed out reading frame body from " + connectionId + " after "
                + received + " of " + length + " bytes", e, true);
        } catch (ProtocolException e) {
            throw e;
        } catch (IOException e) {
            throw ProtocolException.connection("Connection lost reading frame body from " + connectionId, e);
        }
        return buffer.toByteArray();
    }

    private ProtocolException rejectOversized(Socket socket, String connectionId, long length) {
        LOGGER.warn("Frame of {} bytes from {} exceeds limit of {}; closing connection",
            length, connectionId, limits.maxFrameBytes());
        ProtocolException failure = ProtocolException.tooLarge("Declared frame length " + length
            + " exceeds limit of " + limits.maxFrameBytes());
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing connection {} after oversized frame", connectionId, e);
            failure.addSuppressed(e);
        }
        return failure;
    }

    private static String decodeUtf8(byte[] body, String connectionId) throws ProtocolException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body))
                .toString();
        } catch (CharacterCodingException e) {
            throw ProtocolException.malformed("Frame body from " + connectionId + " is not valid UTF-8", e);
        }
    }
}
