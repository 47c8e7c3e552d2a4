package dev.arrestlink.protocol.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.arrestlink.protocol.ProtocolException;
import java.io.IOException;
import java.util.Base64;
import org.msgpack.jackson.dataformat.MessagePackFactory;

/**
 * Carries a {@link Table} inside an envelope payload: MessagePack bytes, then base64 text.
 */
public final class TabularCodec {

    private static final ObjectMapper MSGPACK = new ObjectMapper(new MessagePackFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.USE_LONG_FOR_INTS, true);

    private TabularCodec() {
    }

    public static String encode(Table table) throws ProtocolException {
        try {
            return Base64.getEncoder().encodeToString(MSGPACK.writeValueAsBytes(table));
        } catch (IOException e) {
            throw ProtocolException.malformed("Cannot serialize table with columns " + table.columns(), e);
        }
    }

    public static Table decode(String encoded) throws ProtocolException {
        if (encoded == null) {
            throw ProtocolException.malformed("No encoded table", null);
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw ProtocolException.malformed("Encoded table is not valid base64", e);
        }
        Table table;
        try {
            table = MSGPACK.readValue(bytes, Table.class);
        } catch (IOException e) {
            throw ProtocolException.malformed("Encoded table is not a MessagePack table", e);
        } catch (RuntimeException e) {
            // The MessagePack parser reports corrupt input with unchecked exceptions.
            throw ProtocolException.malformed("Encoded table is corrupt", e);
        }
        if (table == null) {
            throw ProtocolException.malformed("Encoded table is empty", null);
        }
        return table;
    }
}
