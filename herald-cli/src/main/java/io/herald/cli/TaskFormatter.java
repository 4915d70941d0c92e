package io.herald.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.herald.core.task.RecurringTask;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class TaskFormatter {
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private TaskFormatter() {
    }

    static String line(RecurringTask task, ZoneId zone) {
        return task.id()
            + " | " + task.name()
            + " | " + task.messageKind().wireName()
            + " | " + task.scheduleExpression()
            + " | next " + time(task.nextRunAt(), zone)
            + " | " + (task.active() ? "active" : "inactive");
    }

    static String details(RecurringTask task, ZoneId zone) {
        StringBuilder out = new StringBuilder();
        out.append("Id: ").append(task.id()).append(System.lineSeparator());
        out.append("Name: ").append(task.name()).append(System.lineSeparator());
        out.append("Webhook: ").append(task.webhookUrl()).append(System.lineSeparator());
        out.append("Kind: ").append(task.messageKind().wireName()).append(System.lineSeparator());
        if (task.messageKind().attachment()) {
            out.append("File: ").append(task.filePath()).append(System.lineSeparator());
        } else {
            out.append("Content: ").append(task.messageContent()).append(System.lineSeparator());
        }
        out.append("Schedule: ").append(task.scheduleExpression()).append(System.lineSeparator());
        out.append("Next run: ").append(time(task.nextRunAt(), zone)).append(System.lineSeparator());
        out.append("Active: ").append(task.active()).append(System.lineSeparator());
        out.append("Created: ").append(time(task.createdAt(), zone)).append(System.lineSeparator());
        out.append("Updated: ").append(time(task.updatedAt(), zone));
        return out.toString();
    }

    /** Tasks as a JSON array; instants are ISO-8601 UTC. */
    static String json(List<RecurringTask> tasks) {
        List<Map<String, Object>> rows = tasks.stream().map(TaskFormatter::row).toList();
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tasks", e);
        }
    }

    private static Map<String, Object> row(RecurringTask task) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", task.id());
        row.put("name", task.name());
        row.put("webhookUrl", task.webhookUrl());
        row.put("messageKind", task.messageKind().wireName());
        row.put("messageContent", task.messageContent());
        row.put("filePath", task.filePath());
        row.put("scheduleExpression", task.scheduleExpression());
        row.put("nextRunAt", task.nextRunAt());
        row.put("active", task.active());
        row.put("createdAt", task.createdAt());
        row.put("updatedAt", task.updatedAt());
        return row;
    }

    static String time(Instant instant, ZoneId zone) {
        return instant == null ? "-" : TIME.format(instant.atZone(zone));
    }
}
