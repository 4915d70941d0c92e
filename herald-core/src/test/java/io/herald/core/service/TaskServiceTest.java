package io.herald.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.herald.core.dispatch.DispatchResult;
import io.herald.core.dispatch.MessageDispatcher;
import io.herald.core.dispatch.MessageKind;
import io.herald.core.dispatch.OutboundMessage;
import io.herald.core.poll.DueTaskPoller;
import io.herald.core.poll.TaskRunResult;
import io.herald.core.registry.JobRegistry;
import io.herald.core.schedule.NextRunCalculator;
import io.herald.core.schedule.ScheduleExpressionTranslator;
import io.herald.core.task.RecurringTask;
import io.herald.core.task.SqliteTaskStore;
import io.herald.core.task.TaskNotFoundException;
import io.herald.core.task.TaskRequest;
import io.herald.core.task.TaskUpdate;
import io.herald.core.task.TaskValidationException;
import io.herald.core.task.TaskValidator;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaskServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");
    private static final String WEBHOOK = "https://qyapi.weixin.qq.com/cgi-bin/webhook/send?key=k-1";

    @TempDir
    Path tempDir;

    private SqliteTaskStore store;
    private RecordingRegistry registry;
    private RecordingDispatcher dispatcher;
    private TaskService service;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteTaskStore(tempDir.resolve("tasks.db"));
        registry = new RecordingRegistry();
        dispatcher = new RecordingDispatcher();
        service = service(Clock.fixed(NOW, ZoneOffset.UTC), false);
    }

    @Test
    void shouldCreateTaskFromPhraseAndRegisterTrigger() throws Exception {
        RecurringTask task = service.create(new TaskRequest("nightly", WEBHOOK, "text", "good night", null, "每天0点", null));

        assertThat(task.id()).isPositive();
        assertThat(task.scheduleExpression()).isEqualTo("0 0 0 * * ?");
        assertThat(task.nextRunAt()).isEqualTo(Instant.parse("2026-03-03T00:00:00Z"));
        assertThat(task.active()).isTrue();
        assertThat(task.createdAt()).isEqualTo(NOW);
        assertThat(store.get(task.id())).contains(task);
        assertThat(registry.registered).containsExactly(task.id());
    }

    @Test
    void shouldNotRegisterInactiveTask() throws Exception {
        RecurringTask task = service.create(new TaskRequest("paused", WEBHOOK, "markdown", "**hi**", null, "0 9 * * *", false));

        assertThat(task.active()).isFalse();
        assertThat(task.nextRunAt()).isEqualTo(Instant.parse("2026-03-02T09:00:00Z"));
        assertThat(registry.registered).isEmpty();
    }

    @Test
    void shouldRejectInvalidRequestsWithoutStoringAnything() throws Exception {
        assertThatThrownBy(() -> service.create(new TaskRequest(" ", WEBHOOK, "text", "hi", null, "每天9点", null)))
            .isInstanceOf(TaskValidationException.class)
            .hasMessageContaining("name");
        assertThatThrownBy(() -> service.create(new TaskRequest("a", "not-a-url", "text", "hi", null, "每天9点", null)))
            .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> service.create(new TaskRequest("a", WEBHOOK, "image", null, null, "每天9点", null)))
            .isInstanceOf(TaskValidationException.class)
            .hasMessageContaining("filePath");
        assertThatThrownBy(() -> service.create(new TaskRequest("a", WEBHOOK, "text", "hi", null, "  ", null)))
            .isInstanceOf(TaskValidationException.class)
            .hasMessageContaining("scheduleTime");

        assertThat(store.listAll()).isEmpty();
        assertThat(registry.registered).isEmpty();
    }

    @Test
    void findShouldFilterByNameIgnoringCaseAndByStatus() throws Exception {
        RecurringTask standup = service.create(new TaskRequest("Daily Standup", WEBHOOK, "text", "hi", null, "每天9点", null));
        RecurringTask report = service.create(new TaskRequest("weekly report", WEBHOOK, "text", "hi", null, "每周五17点", null));
        RecurringTask pausedStandup = service.create(new TaskRequest("standup (old)", WEBHOOK, "text", "hi", null, "每天9点", false));

        assertThat(service.find("STANDUP", false)).extracting(RecurringTask::id).containsExactly(standup.id(), pausedStandup.id());
        assertThat(service.find("standup", true)).extracting(RecurringTask::id).containsExactly(standup.id());
        assertThat(service.find("  ", false)).extracting(RecurringTask::id).containsExactly(standup.id(), report.id(), pausedStandup.id());
    }

    @Test
    void unrecognizedScheduleShouldFallBackUnlessStrict() throws Exception {
        RecurringTask lenient = service.create(new TaskRequest("a", WEBHOOK, "text", "hi", null, "sometime soon", null));
        assertThat(lenient.scheduleExpression()).isEqualTo("0 0 0 * * ?");

        TaskService strict = service(Clock.fixed(NOW, ZoneOffset.UTC), true);
        assertThatThrownBy(() -> strict.create(new TaskRequest("b", WEBHOOK, "text", "hi", null, "sometime soon", null)))
            .isInstanceOf(TaskValidationException.class)
            .hasMessageContaining("sometime soon");
    }

    @Test
    void unknownKindShouldBeStoredAsText() throws Exception {
        RecurringTask task = service.create(new TaskRequest("a", WEBHOOK, "news", "hi", null, "每天9点", null));

        assertThat(task.messageKind()).isEqualTo(MessageKind.TEXT);
    }

    @Test
    void scheduleChangeShouldRetranslateRecomputeAndRearm() throws Exception {
        RecurringTask task = service.create(request("每天9点"));

        RecurringTask updated = service.update(task.id(), TaskUpdate.schedule("every monday at 8:30"));

        assertThat(updated.scheduleExpression()).isEqualTo("0 30 8 ? * 1");
        assertThat(updated.nextRunAt()).isEqualTo(Instant.parse("2026-03-02T08:30:00Z"));
        assertThat(store.get(task.id()).orElseThrow().scheduleExpression()).isEqualTo("0 30 8 ? * 1");
        assertThat(registry.updated).containsExactly(task.id());
    }

    @Test
    void deactivationShouldDeregisterAndReactivationShouldRecomputeFromNow() throws Exception {
        RecurringTask task = service.create(request("每天9点"));

        RecurringTask paused = service.update(task.id(), TaskUpdate.activation(false));
        assertThat(paused.active()).isFalse();
        assertThat(registry.deregistered).containsExactly(task.id());

        TaskService later = service(Clock.fixed(Instant.parse("2026-03-05T10:00:00Z"), ZoneOffset.UTC), false);
        RecurringTask resumed = later.update(task.id(), TaskUpdate.activation(true));

        assertThat(resumed.active()).isTrue();
        assertThat(resumed.nextRunAt()).isEqualTo(Instant.parse("2026-03-06T09:00:00Z"));
        assertThat(registry.updated).containsExactly(task.id());
    }

    @Test
    void switchingToAttachmentKindShouldDropContent() throws Exception {
        RecurringTask task = service.create(request("每天9点"));

        RecurringTask updated = service.update(
            task.id(),
            new TaskUpdate(null, null, "file", null, "/srv/report.pdf", null, null)
        );

        assertThat(updated.messageKind()).isEqualTo(MessageKind.FILE);
        assertThat(updated.messageContent()).isNull();
        assertThat(updated.filePath()).isEqualTo("/srv/report.pdf");
        assertThat(store.get(task.id()).orElseThrow().messageContent()).isNull();
        assertThat(registry.updated).isEmpty();
    }

    @Test
    void switchingToAttachmentKindWithoutPathShouldFail() throws Exception {
        RecurringTask task = service.create(request("每天9点"));

        assertThatThrownBy(() -> service.update(task.id(), new TaskUpdate(null, null, "image", null, null, null, null)))
            .isInstanceOf(TaskValidationException.class);
        assertThat(store.get(task.id()).orElseThrow().messageKind()).isEqualTo(MessageKind.TEXT);
    }

    @Test
    void updateWithoutChangesShouldNotWrite() throws Exception {
        RecurringTask task = service.create(request("每天9点"));

        RecurringTask same = service.update(task.id(), new TaskUpdate(task.name(), null, "text", null, null, "每天9点", true));

        assertThat(same).isEqualTo(task);
        assertThat(registry.updated).isEmpty();
        assertThat(registry.deregistered).isEmpty();
    }

    @Test
    void missingTaskShouldRaiseNotFound() {
        assertThatThrownBy(() -> service.update(42L, TaskUpdate.activation(false))).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> service.delete(42L)).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> service.get(42L))
            .isInstanceOf(TaskNotFoundException.class)
            .hasMessage("Task not found: 42");
    }

    @Test
    void deleteShouldDeregisterAndRemove() throws Exception {
        RecurringTask task = service.create(request("每天9点"));

        service.delete(task.id());

        assertThat(registry.deregistered).containsExactly(task.id());
        assertThat(service.list()).isEmpty();
    }

    @Test
    void executeNowShouldDispatchStoredMessage() throws Exception {
        RecurringTask task = service.create(request("每天9点"));

        TaskRunResult result = service.executeNow(task.id());

        assertThat(result.dispatch().success()).isTrue();
        assertThat(dispatcher.messages).containsExactly(OutboundMessage.text("daily update"));
    }

    @Test
    void testSendShouldValidateAndDispatchWithoutStoring() throws Exception {
        DispatchResult result = service.testSend(WEBHOOK, "markdown", "# hi", null);

        assertThat(result.success()).isTrue();
        assertThat(dispatcher.messages).containsExactly(OutboundMessage.markdown("# hi"));
        assertThat(store.listAll()).isEmpty();
        assertThatThrownBy(() -> service.testSend(WEBHOOK, "file", null, null))
            .isInstanceOf(TaskValidationException.class);
    }

    @Test
    void listActiveShouldSkipPausedTasks() throws Exception {
        RecurringTask active = service.create(request("每天9点"));
        service.create(new TaskRequest("paused", WEBHOOK, "text", "zzz", null, "每天10点", false));

        assertThat(service.listActive()).extracting(RecurringTask::id).containsExactly(active.id());
        assertThat(service.list()).hasSize(2);
    }

    private TaskService service(Clock clock, boolean strictSchedules) {
        NextRunCalculator calculator = new NextRunCalculator(clock, ZoneOffset.UTC);
        DueTaskPoller poller = new DueTaskPoller(store, dispatcher, calculator, clock);
        return new TaskService(
            store,
            new ScheduleExpressionTranslator(strictSchedules),
            calculator,
            registry,
            poller,
            dispatcher,
            new TaskValidator(false),
            clock
        );
    }

    private static TaskRequest request(String schedule) {
        return new TaskRequest("daily", WEBHOOK, "text", "daily update", null, schedule, null);
    }

    private static final class RecordingRegistry implements JobRegistry {
        private final List<Long> registered = new ArrayList<>();
        private final List<Long> updated = new ArrayList<>();
        private final List<Long> deregistered = new ArrayList<>();

        @Override
        public void register(RecurringTask task) {
            registered.add(task.id());
        }

        @Override
        public void update(RecurringTask task) {
            updated.add(task.id());
        }

        @Override
        public void deregister(long taskId) {
            deregistered.add(taskId);
        }

        @Override
        public void reconcile(Collection<RecurringTask> activeTasks) {
            throw new AssertionError("task changes must not reconcile triggers");
        }

        @Override
        public void ensurePollerRegistered(Runnable sweep) {
            throw new AssertionError("task changes must not touch the sweep");
        }
    }

    private static final class RecordingDispatcher implements MessageDispatcher {
        private final List<OutboundMessage> messages = new ArrayList<>();

        @Override
        public DispatchResult dispatch(String webhookUrl, OutboundMessage message) {
            messages.add(message);
            return DispatchResult.sent(Map.of("errcode", 0));
        }
    }
}
