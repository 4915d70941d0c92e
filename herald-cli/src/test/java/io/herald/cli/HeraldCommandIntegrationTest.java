package io.herald.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.config.ConfigService;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.SchedulerConfig;
import io.herald.core.config.model.StoreConfig;
import io.herald.core.config.model.WebhookConfig;
import io.herald.core.service.HeraldRuntime;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HeraldCommandIntegrationTest {

    private MockWebServer server;
    private HeraldRuntime runtime;
    private CliContext context;
    private String webhookUrl;
    private String originalHome;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        originalHome = System.getProperty("user.home");
        System.setProperty("user.home", tempDir.toString());
        server = new MockWebServer();
        server.start();
        webhookUrl = server.url("/cgi-bin/webhook/send?key=test").toString();

        HeraldConfig config = new HeraldConfig(
            new SchedulerConfig(60, "UTC", 1, false, false),
            WebhookConfig.defaults(),
            new StoreConfig(tempDir.resolve("data/tasks.db").toString())
        );
        runtime = HeraldRuntime.create(config, Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC));
        context = new CliContext(runtime, new ConfigService(), tempDir.resolve("config.json"));
    }

    @AfterEach
    void tearDown() throws IOException {
        runtime.close();
        server.shutdown();
        System.setProperty("user.home", originalHome);
    }

    @Test
    void shouldAddListAndRunTask() throws Exception {
        server.enqueue(json("{\"errcode\":0,\"errmsg\":\"ok\"}"));

        Result added = run("task", "add", "--name", "standup", "--webhook", webhookUrl,
            "--content", "Standup in 5 minutes", "--schedule", "每天9点");
        assertThat(added.code()).isEqualTo(0);
        assertThat(added.out()).contains("Created task 1 | standup | text | 0 0 9 * * ? | next 2026-03-02 09:00:00 UTC | active");

        Result listed = run("task", "list");
        assertThat(listed.out()).contains("1 | standup");

        Result ran = run("task", "run", "1");
        assertThat(ran.code()).isEqualTo(0);
        assertThat(ran.out()).contains("Task 1 sent");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getBody().readUtf8()).contains("Standup in 5 minutes");
    }

    @Test
    void listShouldFilterByNameAndPrintJson() {
        run("task", "add", "--name", "Daily standup", "--webhook", webhookUrl, "--content", "hi", "--schedule", "每天9点");
        run("task", "add", "--name", "weekly report", "--webhook", webhookUrl, "--content", "hi", "--schedule", "0 17 * * 5");

        Result filtered = run("task", "list", "--name", "STANDUP");
        assertThat(filtered.out()).contains("Daily standup").doesNotContain("weekly report");

        Result json = run("task", "list", "--name", "report", "--json");
        assertThat(json.code()).isEqualTo(0);
        assertThat(json.out())
            .contains("\"name\" : \"weekly report\"")
            .contains("\"messageKind\" : \"text\"")
            .contains("\"nextRunAt\" : \"2026-03-06T17:00:00Z\"")
            .doesNotContain("Daily standup");
    }

    @Test
    void shouldReportValidationErrors() {
        Result result = run("task", "add", "--name", "broken", "--webhook", webhookUrl,
            "--kind", "image", "--schedule", "每天9点");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Task add failed: image message requires a filePath");
    }

    @Test
    void shouldUpdateShowAndRemoveTask() {
        run("task", "add", "--name", "report", "--webhook", webhookUrl, "--content", "weekly", "--schedule", "0 17 * * 5");

        Result paused = run("task", "update", "1", "--no-active", "--schedule", "every friday at 18:00");
        assertThat(paused.code()).isEqualTo(0);
        assertThat(paused.out()).contains("0 0 18 ? * 5").contains("inactive");

        Result shown = run("task", "show", "1");
        assertThat(shown.out()).contains("Name: report").contains("Active: false").contains("Content: weekly");

        Result removed = run("task", "remove", "1");
        assertThat(removed.out()).contains("Removed task 1");
        assertThat(run("task", "show", "1").err()).contains("Task not found: 1");
    }

    @Test
    void shouldExplainSchedules() {
        Result result = run("schedule", "每周一8:30", "--count", "2");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out())
            .contains("Cron: 0 30 8 ? * 1")
            .contains("2026-03-02 08:30:00 UTC")
            .contains("2026-03-09 08:30:00 UTC");
    }

    @Test
    void shouldSendTestMessage() throws Exception {
        server.enqueue(json("{\"errcode\":0,\"errmsg\":\"ok\"}"));
        server.enqueue(json("{\"errcode\":93000,\"errmsg\":\"invalid webhook url\"}"));

        Result ok = run("send", "--webhook", webhookUrl, "--kind", "markdown", "--content", "# ping");
        Result rejected = run("send", "--webhook", webhookUrl, "--content", "ping");

        assertThat(ok.out()).contains("Message sent");
        assertThat(rejected.code()).isEqualTo(1);
        assertThat(rejected.err()).contains("DELIVERY_FAILED invalid webhook url");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"msgtype\":\"markdown\"");
    }

    @Test
    void shouldReportStatusAndOnboard() throws Exception {
        run("task", "add", "--name", "standup", "--webhook", webhookUrl, "--content", "hi", "--schedule", "每天9点");

        Result status = run("status");
        assertThat(status.out()).contains("Zone: UTC").contains("Tasks: 1 (1 active)").contains("Config exists: false");

        Result onboard = run("onboard");
        assertThat(onboard.code()).isEqualTo(0);
        assertThat(onboard.out()).contains("Created config");
        assertThat(Files.exists(tempDir.resolve("config.json"))).isTrue();
        assertThat(Files.isDirectory(tempDir.resolve(".herald"))).isTrue();
    }

    @Test
    void schedulerCommandShouldUseConfiguredRunner() {
        CliContext withRunner = new CliContext(runtime, new ConfigService(), tempDir.resolve("config.json"), () -> 7);

        assertThat(HeraldCli.commandLine(withRunner).execute("scheduler")).isEqualTo(7);
        assertThat(run("scheduler").err()).contains("scheduler runner is not configured");
    }

    private Result run(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = HeraldCli.commandLine(context).execute(args);
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private record Result(int code, String out, String err) {
    }
}
