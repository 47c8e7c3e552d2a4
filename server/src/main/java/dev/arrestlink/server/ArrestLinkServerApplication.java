package dev.arrestlink.server;

import dev.arrestlink.server.config.TransportProperties;
import dev.arrestlink.server.transport.MessageHandler;
import dev.arrestlink.server.transport.TcpServer;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(TransportProperties.class)
public class ArrestLinkServerApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArrestLinkServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ArrestLinkServerApplication.class, args);
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    TcpServer tcpServer(TransportProperties properties, MessageHandler messageHandler, Clock clock) {
        LOGGER.info("Frame limit {} bytes, header timeout {}", properties.getMaxFrameBytes(),
            properties.getHeaderTimeout());
        return new TcpServer(properties.getPort(), properties.toFrameLimits(), messageHandler,
            properties.getWelcomeMessage(), clock);
    }
}
