package dev.arrestlink.server.config;

import dev.arrestlink.protocol.FrameLimits;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "transport.tcp")
public class TransportProperties {

    private int port = 8888;

    /**
     * Largest accepted frame body in bytes. Larger declared lengths drop the connection.
     */
    private long maxFrameBytes = FrameLimits.DEFAULT_MAX_FRAME_BYTES;

    /**
     * How long a session waits for the next frame to begin before re-checking its state.
     */
    private Duration headerTimeout = Duration.ofSeconds(10);

    private Duration bodyTimeoutFloor = Duration.ofSeconds(30);

    private Duration bodyTimeoutPerMegabyte = Duration.ofSeconds(10);

    private int chunkSize = FrameLimits.DEFAULT_CHUNK_SIZE;

    /**
     * Text of the SERVER_MESSAGE sent to every client right after it connects.
     */
    private String welcomeMessage = "Connection accepted.";

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public long getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(long maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    public Duration getHeaderTimeout() {
        return headerTimeout;
    }

    public void setHeaderTimeout(Duration headerTimeout) {
        this.headerTimeout = headerTimeout;
    }

    public Duration getBodyTimeoutFloor() {
        return bodyTimeoutFloor;
    }

    public void setBodyTimeoutFloor(Duration bodyTimeoutFloor) {
        this.bodyTimeoutFloor = bodyTimeoutFloor;
    }

    public Duration getBodyTimeoutPerMegabyte() {
        return bodyTimeoutPerMegabyte;
    }

    public void setBodyTimeoutPerMegabyte(Duration bodyTimeoutPerMegabyte) {
        this.bodyTimeoutPerMegabyte = bodyTimeoutPerMegabyte;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public String getWelcomeMessage() {
        return welcomeMessage;
    }

    public void setWelcomeMessage(String welcomeMessage) {
        this.welcomeMessage = welcomeMessage;
    }

    public FrameLimits toFrameLimits() {
        return new FrameLimits(maxFrameBytes, headerTimeout, bodyTimeoutFloor, bodyTimeoutPerMegabyte, chunkSize);
    }
}
