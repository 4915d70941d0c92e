package io.herald.core.task;

import io.herald.core.dispatch.MessageKind;
import java.util.Locale;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Field rules shared by task creation, partial updates and ad-hoc test sends. */
public final class TaskValidator {
    private static final Logger LOG = LoggerFactory.getLogger(TaskValidator.class);

    private final boolean strictMessageKinds;

    public TaskValidator(boolean strictMessageKinds) {
        this.strictMessageKinds = strictMessageKinds;
    }

    public String requireName(String name) {
        String value = blankToNull(name);
        if (value == null) {
            throw new TaskValidationException("name is required");
        }
        return value;
    }

    public String requireWebhookUrl(String webhookUrl) {
        String value = blankToNull(webhookUrl);
        if (value == null) {
            throw new TaskValidationException("webhookUrl is required");
        }
        if (HttpUrl.parse(value) == null) {
            throw new TaskValidationException("webhookUrl is not a valid http(s) URL: " + value);
        }
        return value;
    }

    public String requireSchedule(String scheduleTime) {
        String value = blankToNull(scheduleTime);
        if (value == null) {
            throw new TaskValidationException("scheduleTime is required");
        }
        return value;
    }

    /**
     * Unknown kinds become {@link MessageKind#TEXT} unless strict, in which case they are rejected.
     * A missing kind is always text.
     */
    public MessageKind resolveKind(String messageKind) {
        String value = blankToNull(messageKind);
        if (value == null) {
            return MessageKind.TEXT;
        }
        return MessageKind.fromWireName(value).orElseGet(() -> {
            if (strictMessageKinds) {
                throw new TaskValidationException("unsupported messageKind: " + value);
            }
            LOG.warn("Unknown message kind '{}', treating it as text", value.toLowerCase(Locale.ROOT));
            return MessageKind.TEXT;
        });
    }

    /** Checks that the kind's payload field is present and the other one is absent. */
    public void checkPayload(MessageKind kind, String messageContent, String filePath) {
        String content = blankToNull(messageContent);
        String path = blankToNull(filePath);
        if (kind.attachment()) {
            if (path == null) {
                throw new TaskValidationException(kind.wireName() + " message requires a filePath");
            }
            if (content != null) {
                throw new TaskValidationException(kind.wireName() + " message must not carry messageContent");
            }
        } else {
            if (content == null) {
                throw new TaskValidationException(kind.wireName() + " message requires messageContent");
            }
            if (path != null) {
                throw new TaskValidationException(kind.wireName() + " message must not carry a filePath");
            }
        }
    }

    public static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
