package com.example.proctorstream.ws;

import com.example.proctorstream.error.ProctorException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

final class Payloads {

    private Payloads() {
    }

    /**
     * Binds an event's data to its request type; a missing payload binds as an empty object.
     */
    static <T> T read(ObjectMapper objectMapper, JsonNode data, Class<T> type) {
        try {
            JsonNode node = data == null || data.isNull() ? objectMapper.createObjectNode() : data;
            return objectMapper.treeToValue(node, type);
        } catch (Exception e) {
            throw ProctorException.invalidInput("Malformed payload: " + e.getMessage());
        }
    }
}
