package io.linedecode.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.linedecode.core.RecordDecoder;

import java.util.Objects;

/**
 * Decodes one JSON document per record into the target instance, populating it in place.
 * Works for {@link java.util.Map} targets as well as bean-style classes.
 */
public final class JacksonRecordDecoder implements RecordDecoder {
    private final ObjectMapper mapper;

    public JacksonRecordDecoder() {
        this(new ObjectMapper());
    }

    /** The mapper is shared by all workers; configure it before handing it over. */
    public JacksonRecordDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public void decode(byte[] record, Object target) throws Exception {
        Objects.requireNonNull(target, "target");
        mapper.readerForUpdating(target).readValue(record);
    }
}
