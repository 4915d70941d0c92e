package io.herald.core.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one delivery attempt. {@code errorCode} is the destination's {@code errcode} when a
 * response body was parsed, otherwise {@code null}.
 */
public record DispatchResult(
    DispatchStatus status,
    Integer errorCode,
    String message,
    Map<String, Object> response
) {
    public DispatchResult {
        message = message == null ? "" : message;
        response = response == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(response));
    }

    public static DispatchResult sent(Map<String, Object> response) {
        return new DispatchResult(DispatchStatus.SENT, 0, "ok", response);
    }

    public static DispatchResult failed(DispatchStatus status, String message) {
        return new DispatchResult(status, null, message, Map.of());
    }

    public boolean success() {
        return status == DispatchStatus.SENT;
    }
}
