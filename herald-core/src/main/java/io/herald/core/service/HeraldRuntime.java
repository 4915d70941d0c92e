package io.herald.core.service;

import io.herald.core.config.ConfigPaths;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.SchedulerConfig;
import io.herald.core.config.model.WebhookConfig;
import io.herald.core.dispatch.MessageDispatcher;
import io.herald.core.dispatch.WebhookMessageDispatcher;
import io.herald.core.poll.DueTaskPoller;
import io.herald.core.registry.CronTriggerExecutor;
import io.herald.core.registry.ExecutorJobRegistry;
import io.herald.core.registry.JobRegistry;
import io.herald.core.schedule.NextRunCalculator;
import io.herald.core.schedule.ScheduleExpressionTranslator;
import io.herald.core.task.SqliteTaskStore;
import io.herald.core.task.TaskStore;
import io.herald.core.task.TaskValidator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/** Wires the scheduler's components from a loaded configuration. */
public final class HeraldRuntime implements AutoCloseable {
    private final HeraldConfig config;
    private final Path storePath;
    private final TaskStore store;
    private final NextRunCalculator calculator;
    private final DueTaskPoller poller;
    private final JobRegistry registry;
    private final TaskService taskService;
    private final SchedulerLifecycle lifecycle;

    private HeraldRuntime(
        HeraldConfig config,
        Path storePath,
        TaskStore store,
        NextRunCalculator calculator,
        DueTaskPoller poller,
        JobRegistry registry,
        TaskService taskService,
        SchedulerLifecycle lifecycle
    ) {
        this.config = config;
        this.storePath = storePath;
        this.store = store;
        this.calculator = calculator;
        this.poller = poller;
        this.registry = registry;
        this.taskService = taskService;
        this.lifecycle = lifecycle;
    }

    public static HeraldRuntime create(HeraldConfig config, Clock clock) throws IOException {
        return create(config, clock, dispatcherFor(config.webhook()));
    }

    public static HeraldRuntime create(HeraldConfig config, Clock clock, MessageDispatcher dispatcher) throws IOException {
        SchedulerConfig scheduler = config.scheduler();
        Path storePath = ConfigPaths.resolveStore(config.store().path());
        TaskStore store = new SqliteTaskStore(storePath);
        NextRunCalculator calculator = new NextRunCalculator(clock, scheduler.resolveZone());
        ScheduleExpressionTranslator translator = new ScheduleExpressionTranslator(scheduler.strictSchedules());
        DueTaskPoller poller = new DueTaskPoller(store, dispatcher, calculator, clock);

        CronTriggerExecutor executor = new CronTriggerExecutor(calculator, scheduler.workerThreads());
        JobRegistry registry = new ExecutorJobRegistry(
            executor,
            Duration.ofSeconds(scheduler.pollIntervalSeconds()),
            poller::runIfDue
        );
        TaskService taskService = new TaskService(
            store,
            translator,
            calculator,
            registry,
            poller,
            dispatcher,
            new TaskValidator(scheduler.strictMessageKinds()),
            clock
        );
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(store, calculator, registry, poller, clock, executor);
        return new HeraldRuntime(config, storePath, store, calculator, poller, registry, taskService, lifecycle);
    }

    private static MessageDispatcher dispatcherFor(WebhookConfig webhook) {
        return new WebhookMessageDispatcher(
            Duration.ofSeconds(webhook.connectTimeoutSeconds()),
            Duration.ofSeconds(webhook.readTimeoutSeconds()),
            Duration.ofSeconds(webhook.writeTimeoutSeconds()),
            Duration.ofSeconds(webhook.callTimeoutSeconds())
        );
    }

    public HeraldConfig config() {
        return config;
    }

    public Path storePath() {
        return storePath;
    }

    public TaskStore store() {
        return store;
    }

    public NextRunCalculator calculator() {
        return calculator;
    }

    public DueTaskPoller poller() {
        return poller;
    }

    public JobRegistry registry() {
        return registry;
    }

    public TaskService taskService() {
        return taskService;
    }

    public SchedulerLifecycle lifecycle() {
        return lifecycle;
    }

    @Override
    public void close() {
        lifecycle.close();
    }
}
