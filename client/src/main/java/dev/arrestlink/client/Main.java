package dev.arrestlink.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.arrestlink.client.transport.TcpClientTransport;
import dev.arrestlink.protocol.Envelope;
import dev.arrestlink.protocol.MessageTypes;
import dev.arrestlink.protocol.Wire;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Main {

    private static final Duration REPLY_TIMEOUT = Duration.ofSeconds(10);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        String host = option(arguments, "--host", "localhost");
        int port = Integer.parseInt(option(arguments, "--port", "8888"));
        if (arguments.isEmpty()) {
            printUsage();
            return;
        }
        String command = arguments.remove(0);

        try (TcpClientTransport transport = new TcpClientTransport(host, port)) {
            transport.connect();
            switch (command) {
                case "ping" -> handlePing(transport);
                case "send" -> handleSend(transport, arguments);
                case "listen" -> handleListen(transport, arguments);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
        }
    }

    private static void handlePing(TcpClientTransport transport) throws Exception {
        Instant sent = Instant.now();
        transport.send(new Envelope(MessageTypes.PING, Map.of("sent_at", sent.toString())));
        Optional<Envelope> pong = transport.nextMessage(MessageTypes.PONG, REPLY_TIMEOUT);
        if (pong.isPresent()) {
            long millis = Duration.between(sent, Instant.now()).toMillis();
            System.out.println("PONG in " + millis + " ms, server_time=" + pong.get().text("server_time"));
        } else {
            System.out.println("No PONG within " + REPLY_TIMEOUT.toSeconds() + "s");
        }
    }

    private static void handleSend(TcpClientTransport transport, List<String> arguments) throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("send requires a message type");
        }
        String type = arguments.get(0);
        Map<String, Object> payload = arguments.size() > 1
            ? new ObjectMapper().readValue(arguments.get(1), new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        transport.send(new Envelope(type, payload));
        Optional<Envelope> reply;
        while ((reply = transport.nextMessage(REPLY_TIMEOUT)).isPresent()) {
            print(reply.get());
            if (!MessageTypes.SERVER_MESSAGE.equals(reply.get().type())) {
                return;
            }
        }
        System.out.println("No reply within " + REPLY_TIMEOUT.toSeconds() + "s");
    }

    private static void handleListen(TcpClientTransport transport, List<String> arguments) throws Exception {
        long seconds = arguments.isEmpty() ? 60 : Long.parseLong(arguments.get(0));
        long deadline = System.nanoTime() + Duration.ofSeconds(seconds).toNanos();
        while (transport.isConnected() && System.nanoTime() < deadline) {
            transport.nextMessage(Duration.ofMillis(500)).ifPresent(Main::print);
        }
        transport.failure().ifPresent(e -> System.err.println("Stopped: " + e));
    }

    private static void print(Envelope envelope) {
        StringBuilder line = new StringBuilder(envelope.type());
        envelope.payload().forEach((key, value) ->
            line.append("\n  ").append(key).append(": ").append(Wire.truncate(String.valueOf(value), 100)));
        System.out.println(line);
    }

    private static String option(List<String> arguments, String name, String defaultValue) {
        int index = arguments.indexOf(name);
        if (index < 0) {
            return defaultValue;
        }
        if (index + 1 >= arguments.size()) {
            throw new IllegalArgumentException(name + " requires a value");
        }
        arguments.remove(index);
        return arguments.remove(index);
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar arrest-link-client.jar [--host h] [--port p] <command> [args]\n" +
            "Commands:\n" +
            "  ping\n" +
            "  send <type> [json-payload]\n" +
            "  listen [seconds]");
    }
}
