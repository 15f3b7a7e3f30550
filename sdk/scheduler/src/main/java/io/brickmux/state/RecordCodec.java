package io.brickmux.state;

import io.brickmux.config.SerializationUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Encodes the records kept in the {@link io.brickmux.storage.Persister}: brick definitions, brick runtimes and volume
 * options. Records are compact UTF-8 JSON, as they are rewritten on every brick state change.
 */
final class RecordCodec {

    private static final ObjectMapper MAPPER = SerializationUtils.registerDefaultModules(new ObjectMapper());

    private RecordCodec() {
        // do not instantiate
    }

    static byte[] encode(Object record) throws IOException {
        return MAPPER.writeValueAsBytes(record);
    }

    /**
     * @throws IOException if the bytes are empty or aren't a JSON encoding of {@code type}
     */
    static <T> T decode(byte[] bytes, Class<T> type) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException(String.format("Empty %s record", type.getSimpleName()));
        }
        return MAPPER.readValue(bytes, type);
    }
}
