package io.herald.core.service;

import io.herald.core.dispatch.DispatchResult;
import io.herald.core.dispatch.MessageDispatcher;
import io.herald.core.dispatch.MessageKind;
import io.herald.core.dispatch.OutboundMessage;
import io.herald.core.poll.DueTaskPoller;
import io.herald.core.poll.TaskRunResult;
import io.herald.core.registry.JobRegistry;
import io.herald.core.schedule.InvalidScheduleException;
import io.herald.core.schedule.NextRunCalculator;
import io.herald.core.schedule.ScheduleExpressionTranslator;
import io.herald.core.task.RecurringTask;
import io.herald.core.task.TaskField;
import io.herald.core.task.TaskNotFoundException;
import io.herald.core.task.TaskRequest;
import io.herald.core.task.TaskStore;
import io.herald.core.task.TaskUpdate;
import io.herald.core.task.TaskValidationException;
import io.herald.core.task.TaskValidator;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Create, update and delete tasks while keeping the store and the job registry in step: a task
 * has a trigger exactly while it is active.
 */
public final class TaskService {
    private static final Logger LOG = LoggerFactory.getLogger(TaskService.class);

    private final TaskStore store;
    private final ScheduleExpressionTranslator translator;
    private final NextRunCalculator calculator;
    private final JobRegistry registry;
    private final DueTaskPoller poller;
    private final MessageDispatcher dispatcher;
    private final TaskValidator validator;
    private final Clock clock;

    public TaskService(
        TaskStore store,
        ScheduleExpressionTranslator translator,
        NextRunCalculator calculator,
        JobRegistry registry,
        DueTaskPoller poller,
        MessageDispatcher dispatcher,
        TaskValidator validator,
        Clock clock
    ) {
        this.store = store;
        this.translator = translator;
        this.calculator = calculator;
        this.registry = registry;
        this.poller = poller;
        this.dispatcher = dispatcher;
        this.validator = validator;
        this.clock = clock;
    }

    public RecurringTask create(TaskRequest request) throws IOException {
        String name = validator.requireName(request.name());
        String webhookUrl = validator.requireWebhookUrl(request.webhookUrl());
        MessageKind kind = validator.resolveKind(request.messageKind());
        String content = TaskValidator.blankToNull(request.messageContent());
        String filePath = TaskValidator.blankToNull(request.filePath());
        validator.checkPayload(kind, content, filePath);
        String expression = translate(validator.requireSchedule(request.scheduleTime()));

        Instant now = clock.instant();
        Instant nextRunAt = nextRunAfter(expression, now);
        boolean active = request.active() == null || request.active();

        RecurringTask created = store.create(new RecurringTask(
            0L, name, webhookUrl, kind, content, filePath, expression, nextRunAt, active, now, now
        ));
        if (created.active()) {
            registry.register(created);
        }
        LOG.info("Created task {} ({}) with schedule '{}', next run {}", created.id(), name, expression, nextRunAt);
        return created;
    }

    public RecurringTask update(long id, TaskUpdate update) throws IOException {
        RecurringTask existing = get(id);
        Set<TaskField> changed = EnumSet.noneOf(TaskField.class);

        String name = update.name() == null ? existing.name() : validator.requireName(update.name());
        String webhookUrl = update.webhookUrl() == null
            ? existing.webhookUrl()
            : validator.requireWebhookUrl(update.webhookUrl());
        MessageKind kind = update.messageKind() == null
            ? existing.messageKind()
            : validator.resolveKind(update.messageKind());
        String content = update.messageContent() == null
            ? existing.messageContent()
            : TaskValidator.blankToNull(update.messageContent());
        String filePath = update.filePath() == null
            ? existing.filePath()
            : TaskValidator.blankToNull(update.filePath());

        // switching between text and attachment kinds drops the field the new kind does not use
        if (kind.attachment() != existing.messageKind().attachment()) {
            if (kind.attachment() && update.messageContent() == null) {
                content = null;
            }
            if (!kind.attachment() && update.filePath() == null) {
                filePath = null;
            }
        }
        validator.checkPayload(kind, content, filePath);

        String expression = existing.scheduleExpression();
        if (update.scheduleTime() != null) {
            expression = translate(validator.requireSchedule(update.scheduleTime()));
        }
        boolean scheduleChanged = !expression.equals(existing.scheduleExpression());
        boolean active = update.active() == null ? existing.active() : update.active();
        boolean reactivated = active && !existing.active();

        Instant now = clock.instant();
        Instant nextRunAt = existing.nextRunAt();
        if (scheduleChanged || reactivated) {
            nextRunAt = nextRunAfter(expression, now);
        }

        markIfChanged(changed, TaskField.NAME, existing.name(), name);
        markIfChanged(changed, TaskField.WEBHOOK_URL, existing.webhookUrl(), webhookUrl);
        markIfChanged(changed, TaskField.MESSAGE_KIND, existing.messageKind(), kind);
        markIfChanged(changed, TaskField.MESSAGE_CONTENT, existing.messageContent(), content);
        markIfChanged(changed, TaskField.FILE_PATH, existing.filePath(), filePath);
        markIfChanged(changed, TaskField.SCHEDULE_EXPRESSION, existing.scheduleExpression(), expression);
        markIfChanged(changed, TaskField.NEXT_RUN_AT, existing.nextRunAt(), nextRunAt);
        markIfChanged(changed, TaskField.ACTIVE, existing.active(), active);
        if (changed.isEmpty()) {
            return existing;
        }

        RecurringTask updated = new RecurringTask(
            id, name, webhookUrl, kind, content, filePath, expression, nextRunAt, active, existing.createdAt(), now
        );
        if (!store.update(id, updated, changed)) {
            throw new TaskNotFoundException(id);
        }

        if (!active) {
            registry.deregister(id);
        } else if (reactivated || scheduleChanged) {
            registry.update(updated);
        }
        LOG.info("Updated task {} fields {}", id, changed);
        return updated;
    }

    public void delete(long id) throws IOException {
        get(id);
        registry.deregister(id);
        if (!store.delete(id)) {
            throw new TaskNotFoundException(id);
        }
        LOG.info("Deleted task {}", id);
    }

    public RecurringTask get(long id) throws IOException {
        return store.get(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    public List<RecurringTask> list() throws IOException {
        return store.listAll();
    }

    public List<RecurringTask> listActive() throws IOException {
        return store.listActive();
    }

    /** Tasks whose name contains {@code nameContains}, ignoring case; a blank filter matches all. */
    public List<RecurringTask> find(String nameContains, boolean activeOnly) throws IOException {
        List<RecurringTask> tasks = activeOnly ? store.listActive() : store.listAll();
        String needle = TaskValidator.blankToNull(nameContains);
        if (needle == null) {
            return tasks;
        }
        String lowered = needle.toLowerCase(Locale.ROOT);
        return tasks.stream()
            .filter(task -> task.name().toLowerCase(Locale.ROOT).contains(lowered))
            .toList();
    }

    public TaskRunResult executeNow(long id) throws IOException {
        return poller.runNow(id);
    }

    /** Sends a one-off message without storing anything. */
    public DispatchResult testSend(String webhookUrl, String messageKind, String messageContent, String filePath) {
        String url = validator.requireWebhookUrl(webhookUrl);
        MessageKind kind = validator.resolveKind(messageKind);
        String content = TaskValidator.blankToNull(messageContent);
        String path = TaskValidator.blankToNull(filePath);
        validator.checkPayload(kind, content, path);
        return dispatcher.dispatch(url, new OutboundMessage(kind, content, path));
    }

    /** Canonical cron text for raw schedule input, using the same rules as create and update. */
    public String translate(String scheduleTime) {
        try {
            return translator.translate(scheduleTime);
        } catch (InvalidScheduleException e) {
            throw new TaskValidationException(e.getMessage(), e);
        }
    }

    private Instant nextRunAfter(String expression, Instant reference) {
        return calculator.nextRunAfter(expression, reference)
            .orElseThrow(() -> new TaskValidationException("schedule '" + expression + "' has no upcoming run"));
    }

    private static void markIfChanged(Set<TaskField> changed, TaskField field, Object before, Object after) {
        if (!Objects.equals(before, after)) {
            changed.add(field);
        }
    }
}
