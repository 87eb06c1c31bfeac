package com.investbyyourself.etl.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.TransformedRecord;
import org.springframework.stereotype.Component;

/**
 * Canonical JSON form of records and versions: sorted keys, plain decimals, ISO dates.
 * Checksums are computed over this form, so it must not follow application-wide
 * Jackson settings.
 */
@Component
public class RecordJsonCodec {

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public String toJson(TransformedRecord record) {
        return write(record);
    }

    public TransformedRecord readRecord(String json) {
        return read(json, TransformedRecord.class);
    }

    public String toJson(DataVersion version) {
        return write(version);
    }

    public DataVersion readVersion(String json) {
        return read(json, DataVersion.class);
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EtlException(ErrorKind.LOAD_FAILED, "Cannot serialise " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EtlException(ErrorKind.LOAD_FAILED, "Stored " + type.getSimpleName() + " is not readable", e);
        }
    }
}
