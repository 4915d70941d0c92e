package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookConfig(
    @JsonAlias({"connect_timeout_seconds"}) int connectTimeoutSeconds,
    @JsonAlias({"read_timeout_seconds"}) int readTimeoutSeconds,
    @JsonAlias({"write_timeout_seconds"}) int writeTimeoutSeconds,
    @JsonAlias({"call_timeout_seconds"}) int callTimeoutSeconds
) {

    public static WebhookConfig defaults() {
        return new WebhookConfig(10, 30, 30, 60);
    }
}
