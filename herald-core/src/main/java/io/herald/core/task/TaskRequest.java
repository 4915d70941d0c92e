package io.herald.core.task;

/**
 * Input for creating a task. {@code scheduleTime} is raw operator input, cron or a phrase;
 * {@code active} defaults to true when null.
 */
public record TaskRequest(
    String name,
    String webhookUrl,
    String messageKind,
    String messageContent,
    String filePath,
    String scheduleTime,
    Boolean active
) {
}
