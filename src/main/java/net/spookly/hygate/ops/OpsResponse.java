package net.spookly.hygate.ops;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON envelope for operator API responses: {@code {success, data}} or {@code {success, error}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OpsResponse {
    public final boolean success;
    public final Object data;
    public final Map<String, String> error;

    public static OpsResponse ok(Object data) {
        return new OpsResponse(true, data, null);
    }

    public static OpsResponse error(String code, String message) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        return new OpsResponse(false, null, error);
    }
}
