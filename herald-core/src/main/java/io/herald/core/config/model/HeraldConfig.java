package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeraldConfig(
    SchedulerConfig scheduler,
    WebhookConfig webhook,
    StoreConfig store
) {

    public static HeraldConfig defaults() {
        return new HeraldConfig(
            SchedulerConfig.defaults(),
            WebhookConfig.defaults(),
            StoreConfig.defaults()
        );
    }
}
