package io.herald.core.task;

/** Columns a partial update may write. */
public enum TaskField {
    NAME("name"),
    WEBHOOK_URL("webhook_url"),
    MESSAGE_KIND("message_kind"),
    MESSAGE_CONTENT("message_content"),
    FILE_PATH("file_path"),
    SCHEDULE_EXPRESSION("schedule_expression"),
    NEXT_RUN_AT("next_run_at"),
    ACTIVE("active");

    private final String column;

    TaskField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
