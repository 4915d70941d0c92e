package io.herald.cli;

import io.herald.core.config.ConfigService;
import io.herald.core.service.HeraldRuntime;
import java.nio.file.Path;

public record CliContext(
    HeraldRuntime runtime,
    ConfigService configService,
    Path configPath,
    SchedulerRunner schedulerRunner
) {
    public CliContext(HeraldRuntime runtime, ConfigService configService, Path configPath) {
        this(runtime, configService, configPath, () -> {
            throw new UnsupportedOperationException("scheduler runner is not configured");
        });
    }
}
