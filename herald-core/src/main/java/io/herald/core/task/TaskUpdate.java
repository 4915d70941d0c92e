package io.herald.core.task;

/** Partial update; every {@code null} component leaves the stored value unchanged. */
public record TaskUpdate(
    String name,
    String webhookUrl,
    String messageKind,
    String messageContent,
    String filePath,
    String scheduleTime,
    Boolean active
) {

    public static TaskUpdate activation(boolean active) {
        return new TaskUpdate(null, null, null, null, null, null, active);
    }

    public static TaskUpdate schedule(String scheduleTime) {
        return new TaskUpdate(null, null, null, null, null, scheduleTime, null);
    }

    public boolean isEmpty() {
        return name == null && webhookUrl == null && messageKind == null && messageContent == null
            && filePath == null && scheduleTime == null && active == null;
    }
}
