package io.herald.app;

import io.herald.cli.CliContext;
import io.herald.cli.HeraldCli;
import io.herald.core.config.ConfigPaths;
import io.herald.core.config.ConfigService;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.poll.PollSummary;
import io.herald.core.service.HeraldRuntime;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class HeraldApplication {
    private static final Logger LOG = LoggerFactory.getLogger(HeraldApplication.class);

    private HeraldApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        HeraldConfig config = loadConfig(configService, configPath);

        HeraldRuntime runtime;
        try {
            runtime = HeraldRuntime.create(config, Clock.systemUTC());
        } catch (IOException e) {
            System.err.println("Startup failed: " + e.getMessage());
            System.exit(1);
            return;
        }

        CliContext context = new CliContext(
            runtime,
            configService,
            configPath,
            () -> runScheduler(runtime)
        );

        int exitCode;
        try {
            exitCode = HeraldCli.commandLine(context).execute(args);
        } finally {
            runtime.close();
        }
        System.exit(exitCode);
    }

    private static HeraldConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return HeraldConfig.defaults();
        }
    }

    private static int runScheduler(HeraldRuntime runtime) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.close();
            shutdown.countDown();
        }, "herald-shutdown"));

        PollSummary initial = runtime.lifecycle().start();
        System.out.println("Scheduler started; store " + runtime.storePath()
            + ", sweep every " + runtime.config().scheduler().pollIntervalSeconds() + "s");
        System.out.println("Initial sweep: " + initial.message());
        shutdown.await();
        return 0;
    }
}
