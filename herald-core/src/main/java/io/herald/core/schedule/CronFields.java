package io.herald.core.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import java.util.Arrays;

/**
 * Reduces stored schedule expressions to the standard five cron fields understood by cron-utils.
 * Six-field expressions carry a leading seconds field, and {@code ?} is accepted as a wildcard.
 */
final class CronFields {
    private static final CronParser UNIX_PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private CronFields() {
    }

    static String[] split(String expression) {
        String trimmed = expression == null ? "" : expression.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return trimmed.split("\\s+");
    }

    static String toUnix(String expression) {
        String[] parts = split(expression);
        if (parts.length == 6) {
            parts = Arrays.copyOfRange(parts, 1, 6);
        }
        if (parts.length != 5) {
            throw new IllegalArgumentException(
                "expected 5 or 6 cron fields but got " + parts.length + ": " + expression
            );
        }
        return String.join(" ", parts).replace('?', '*');
    }

    static Cron parse(String expression) {
        return UNIX_PARSER.parse(toUnix(expression)).validate();
    }
}
