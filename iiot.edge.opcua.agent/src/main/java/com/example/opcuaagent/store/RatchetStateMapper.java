package com.example.opcuaagent.store;

import java.io.IOException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of {@link DeviceRatchetState} records.
 */
final class RatchetStateMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private RatchetStateMapper() {
    }

    static byte[] write(DeviceRatchetState state) throws IOException {
        return MAPPER.writeValueAsBytes(state);
    }

    static DeviceRatchetState read(byte[] json) throws IOException {
        return MAPPER.readValue(json, DeviceRatchetState.class);
    }
}
