package io.herald.core.dispatch;

import java.util.Locale;
import java.util.Optional;

public enum MessageKind {
    TEXT("text", false),
    MARKDOWN("markdown", false),
    IMAGE("image", true),
    FILE("file", true);

    private final String wireName;
    private final boolean attachment;

    MessageKind(String wireName, boolean attachment) {
        this.wireName = wireName;
        this.attachment = attachment;
    }

    public String wireName() {
        return wireName;
    }

    /** Attachment kinds read {@code filePath}; the others read {@code messageContent}. */
    public boolean attachment() {
        return attachment;
    }

    public static Optional<MessageKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MessageKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
