package org.openebs.events.bus;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.openebs.events.model.EventMessage;

import java.io.IOException;

/**
 * JSON encoding of bus payloads.
 *
 * <p>Encoding failures are the caller's problem and raise
 * {@link SerializationException}. Decoding is lenient about unknown fields; a payload
 * that still does not decode raises {@link IOException} so subscribers can skip it.</p>
 */
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec() {
        this(defaultObjectMapper());
    }

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(EventMessage message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (Exception e) {
            throw new SerializationException(e);
        }
    }

    public <T> T decode(byte[] payload, Class<T> type) throws IOException {
        if (payload == null || payload.length == 0) {
            throw new IOException("Empty payload");
        }
        return objectMapper.readValue(payload, type);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
