package io.herald.core.task;

import io.herald.core.dispatch.MessageKind;
import io.herald.core.dispatch.OutboundMessage;
import java.time.Instant;

/**
 * One recurring notification. {@code scheduleExpression} always holds translated cron text, and
 * exactly one of {@code messageContent} and {@code filePath} is set, matching {@code messageKind}.
 */
public record RecurringTask(
    long id,
    String name,
    String webhookUrl,
    MessageKind messageKind,
    String messageContent,
    String filePath,
    String scheduleExpression,
    Instant nextRunAt,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {

    public boolean isDue(Instant now) {
        return active && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public OutboundMessage message() {
        return new OutboundMessage(messageKind, messageContent, filePath);
    }

    public RecurringTask withId(long newId) {
        return new RecurringTask(
            newId, name, webhookUrl, messageKind, messageContent, filePath,
            scheduleExpression, nextRunAt, active, createdAt, updatedAt
        );
    }

    public RecurringTask withNextRunAt(Instant newNextRunAt) {
        return new RecurringTask(
            id, name, webhookUrl, messageKind, messageContent, filePath,
            scheduleExpression, newNextRunAt, active, createdAt, updatedAt
        );
    }
}
