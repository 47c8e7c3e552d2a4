package dev.arrestlink.protocol;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EnvelopeTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Omitted payload becomes an empty map")
        void omittedPayloadIsEmpty() {
            assertEquals(Map.of(), new Envelope("LOGOUT").payload());
            assertEquals(Map.of(), new Envelope("LOGOUT", null).payload());
        }

        @Test
        @DisplayName("Blank or missing type is rejected")
        void rejectsBlankType() {
            assertThrows(IllegalArgumentException.class, () -> new Envelope(" "));
            assertThrows(IllegalArgumentException.class, () -> new Envelope(""));
            assertThrows(NullPointerException.class, () -> new Envelope(null));
        }

        @Test
        @DisplayName("Payload is copied and read-only")
        void payloadIsImmutableCopy() {
            Map<String, Object> source = new HashMap<>();
            source.put("email", "a@b.c");
            Envelope envelope = new Envelope("LOGIN", source);
            source.put("password", "secret");

            assertEquals(Map.of("email", "a@b.c"), envelope.payload());
            assertThrows(UnsupportedOperationException.class, () -> envelope.payload().put("x", 1));
        }

        @Test
        @DisplayName("Nested maps and lists are copied and read-only")
        void nestedValuesAreImmutableCopies() {
            Map<String, Object> filters = new LinkedHashMap<>();
            filters.put("area", "Central");
            List<Object> ages = new ArrayList<>(List.of(18, 25));
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("filters", filters);
            source.put("ages", ages);
            Envelope envelope = new Envelope("QUERY", source);
            filters.put("area", "Hollywood");
            ages.add(99);

            Map<?, ?> nested = (Map<?, ?>) envelope.payload().get("filters");
            List<?> nestedAges = (List<?>) envelope.payload().get("ages");
            assertEquals("Central", nested.get("area"));
            assertEquals(List.of(18, 25), nestedAges);
            assertThrows(UnsupportedOperationException.class, () -> nestedAges.clear());
        }

        @Test
        @DisplayName("Nested values of a received envelope cannot be changed")
        @SuppressWarnings("unchecked")
        void receivedNestedValuesAreReadOnly() throws ProtocolException {
            String body = "{\"msg_type\":\"QUERY\",\"data\":{\"filters\":{\"area\":\"Central\"},\"ages\":[18,25]}}";
            Envelope received = Envelope.deserialize(body);
            Map<String, Object> filters = (Map<String, Object>) received.payload().get("filters");
            List<Object> ages = (List<Object>) received.payload().get("ages");

            assertThrows(UnsupportedOperationException.class, () -> filters.put("area", "Hollywood"));
            assertThrows(UnsupportedOperationException.class, () -> ages.add(99));
            assertEquals(body, received.serialize());
            assertEquals(Envelope.deserialize(body), received);
        }

        @Test
        @DisplayName("Null payload values are allowed")
        void allowsNullValues() {
            Map<String, Object> source = new HashMap<>();
            source.put("request_id", null);
            Envelope envelope = new Envelope("QUERY", source);
            assertTrue(envelope.payload().containsKey("request_id"));
            assertNull(envelope.text("request_id"));
        }
    }

    @Nested
    @DisplayName("Serialization")
    class Serialization {

        @Test
        @DisplayName("Body carries exactly msg_type and data")
        void wireFieldNames() throws ProtocolException {
            String json = new Envelope("PING", Map.of("n", 1)).serialize();
            assertEquals("{\"msg_type\":\"PING\",\"data\":{\"n\":1}}", json);
        }

        @Test
        @DisplayName("Nested structures survive a round trip")
        void roundTripNested() throws ProtocolException {
            Map<String, Object> filters = new LinkedHashMap<>();
            filters.put("area", "Central");
            filters.put("min_age", 18);
            filters.put("weekend", true);
            filters.put("ratio", 0.25);
            filters.put("missing", null);
            List<Object> columns = new ArrayList<>(List.of("age", "sex"));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query_type", "age_distribution");
            payload.put("filters", filters);
            payload.put("columns", columns);

            Envelope original = new Envelope("QUERY", payload);
            Envelope copy = Envelope.deserialize(original.serialize());

            assertEquals(original, copy);
            assertEquals("age_distribution", copy.text("query_type"));
        }

        @Test
        @DisplayName("Non-ASCII text is preserved")
        void unicodeText() throws ProtocolException {
            Envelope original = new Envelope("SERVER_MESSAGE", Map.of("message", "Añadido: 東京 ✓"));
            assertEquals(original, Envelope.deserialize(original.serialize()));
        }

        @Test
        @DisplayName("Unsupported payload values fail as malformed")
        void unsupportedValue() {
            Envelope envelope = new Envelope("QUERY", Map.of("handle", new Object()));
            ProtocolException e = assertThrows(ProtocolException.class, envelope::serialize);
            assertEquals(ErrorKind.MALFORMED_PAYLOAD, e.kind());
        }
    }

    @Nested
    @DisplayName("Deserialization failures")
    class DeserializationFailures {

        @Test
        void notJson() {
            assertMalformed("msg_type=PING");
        }

        @Test
        void notAnObject() {
            assertMalformed("[\"PING\", {}]");
        }

        @Test
        void emptyText() {
            assertMalformed("");
        }

        @Test
        void missingType() {
            assertMalformed("{\"data\":{}}");
        }

        @Test
        void typeNotAString() {
            assertMalformed("{\"msg_type\":7,\"data\":{}}");
        }

        @Test
        void missingData() {
            assertMalformed("{\"msg_type\":\"PING\"}");
        }

        @Test
        void dataNotAnObject() {
            assertMalformed("{\"msg_type\":\"PING\",\"data\":[1,2]}");
        }

        @Test
        @DisplayName("Null data reads as an empty payload")
        void nullData() throws ProtocolException {
            Envelope envelope = Envelope.deserialize("{\"msg_type\":\"LOGOUT\",\"data\":null}");
            assertEquals("LOGOUT", envelope.type());
            assertTrue(envelope.payload().isEmpty());
        }

        private void assertMalformed(String text) {
            ProtocolException e = assertThrows(ProtocolException.class, () -> Envelope.deserialize(text));
            assertEquals(ErrorKind.MALFORMED_PAYLOAD, e.kind());
            assertTrue(e.isConnectionUsable());
        }
    }
}
