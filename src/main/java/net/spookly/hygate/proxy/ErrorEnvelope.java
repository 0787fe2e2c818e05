package net.spookly.hygate.proxy;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The client-facing JSON body for dispatch failures: {@code {"success":false,"error":{"code","message"}}}.
 */
public final class ErrorEnvelope {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ErrorEnvelope() {
    }

    public static Map<String, Object> of(String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        return body;
    }

    public static byte[] toJson(DispatchError error, String message) {
        return toJson(error.code(), message);
    }

    public static byte[] toJson(String code, String message) {
        try {
            return MAPPER.writeValueAsBytes(of(code, message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode error envelope", e);
        }
    }
}
