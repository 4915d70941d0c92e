package io.herald.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.herald.core.config.model.HeraldConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.Objects;

/** Reads {@code config.json}, filling every missing key from {@link HeraldConfig#defaults()}. */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public HeraldConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return HeraldConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(HeraldConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        HeraldConfig config = mapper.treeToValue(merged, HeraldConfig.class);
        validate(config);
        return config;
    }

    public void save(Path configPath, HeraldConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        HeraldConfig config;
        if (created || overwrite) {
            config = HeraldConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path storePath = ConfigPaths.resolveStore(config.store().path());
        Files.createDirectories(storePath.toAbsolutePath().getParent());
        return new OnboardResult(configPath, storePath, created, overwritten);
    }

    public String toPrettyJson(HeraldConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private void validate(HeraldConfig config) throws IOException {
        if (config.scheduler().pollIntervalSeconds() <= 0) {
            throw new IOException("scheduler.pollIntervalSeconds must be > 0");
        }
        if (config.scheduler().workerThreads() <= 0) {
            throw new IOException("scheduler.workerThreads must be > 0");
        }
        try {
            config.scheduler().resolveZone();
        } catch (DateTimeException e) {
            throw new IOException("scheduler.zone is not a valid zone id: " + config.scheduler().zone(), e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
