package io.herald.core.schedule;

import java.time.LocalTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a schedule as typed by an operator into the cron expression that gets stored.
 *
 * <p>Input is either a 5/6-field cron string or a phrase from a small vocabulary (daily, weekly,
 * monthly at a time of day, in Chinese or English). Phrases become six-field expressions with a
 * leading seconds field, e.g. {@code 每周一8:30 -> 0 30 8 ? * 1}. Anything unrecognized becomes
 * {@link #FALLBACK_EXPRESSION} unless the translator is strict.
 */
public final class ScheduleExpressionTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleExpressionTranslator.class);

    public static final String FALLBACK_EXPRESSION = "0 0 0 * * ?";

    private static final Pattern DAILY_ZH = Pattern.compile("(?:每天|每日)\\s*(?<rest>.*)$");
    private static final Pattern WEEKLY_ZH = Pattern.compile(
        "(?:每周|每星期|每礼拜)\\s*(?<day>[一二三四五六日天0-7])\\s*(?<rest>.*)$"
    );
    private static final Pattern MONTHLY_ZH = Pattern.compile("每月\\s*(?<day>\\d{1,2})\\s*[号日]\\s*(?<rest>.*)$");
    private static final Pattern TIME_ZH = Pattern.compile(
        "^(?<period>凌晨|早上|早晨|上午|中午|下午|傍晚|晚上)?\\s*(?<hour>\\d{1,2})"
            + "(?:\\s*[:：]\\s*(?<colonMinute>\\d{1,2})\\s*点?"
            + "|\\s*点\\s*(?:(?<pointMinute>\\d{1,2})\\s*分?|(?<half>半))?)\\s*$"
    );

    private static final String TIME_EN = "(?<hour>\\d{1,2})(?::(?<minute>\\d{2}))?\\s*(?<meridiem>am|pm)?";
    private static final Pattern DAILY_EN = Pattern.compile("^(?:every\\s+day|everyday|daily)\\s+at\\s+" + TIME_EN + "$");
    private static final Pattern WEEKLY_EN = Pattern.compile(
        "^every\\s+(?:week\\s+on\\s+)?"
            + "(?<day>sunday|monday|tuesday|wednesday|thursday|friday|saturday|sun|mon|tues|tue|wed|thurs|thur|thu|fri|sat)"
            + "\\s+at\\s+" + TIME_EN + "$"
    );
    private static final Pattern MONTHLY_EN = Pattern.compile(
        "^every\\s+month\\s+on\\s+(?:the\\s+)?(?:day\\s+)?(?<day>\\d{1,2})(?:st|nd|rd|th)?(?:\\s+at\\s+" + TIME_EN + ")?$"
    );

    private static final Map<String, Integer> WEEKDAYS_ZH = Map.ofEntries(
        Map.entry("一", 1), Map.entry("二", 2), Map.entry("三", 3), Map.entry("四", 4),
        Map.entry("五", 5), Map.entry("六", 6), Map.entry("日", 0), Map.entry("天", 0),
        Map.entry("0", 0), Map.entry("1", 1), Map.entry("2", 2), Map.entry("3", 3),
        Map.entry("4", 4), Map.entry("5", 5), Map.entry("6", 6), Map.entry("7", 0)
    );
    private static final Map<String, Integer> WEEKDAYS_EN = Map.of(
        "sun", 0, "mon", 1, "tue", 2, "wed", 3, "thu", 4, "fri", 5, "sat", 6
    );

    private final boolean strict;

    public ScheduleExpressionTranslator() {
        this(false);
    }

    public ScheduleExpressionTranslator(boolean strict) {
        this.strict = strict;
    }

    /**
     * @param scheduleTime cron expression or natural-language phrase
     * @return canonical cron expression, never {@code null}
     * @throws InvalidScheduleException only in strict mode, when nothing matches
     */
    public String translate(String scheduleTime) {
        String input = scheduleTime == null ? "" : scheduleTime.trim();

        Optional<String> cron = fromCron(input);
        if (cron.isPresent()) {
            return cron.get();
        }

        String normalized = input.toLowerCase(Locale.ROOT);
        Optional<String> natural = daily(normalized)
            .or(() -> weekly(normalized))
            .or(() -> monthly(normalized));
        if (natural.isPresent()) {
            return natural.get();
        }

        if (strict) {
            throw new InvalidScheduleException("unrecognized schedule: " + scheduleTime);
        }
        LOG.warn("Unrecognized schedule '{}', falling back to {}", scheduleTime, FALLBACK_EXPRESSION);
        return FALLBACK_EXPRESSION;
    }

    public boolean strict() {
        return strict;
    }

    private Optional<String> fromCron(String input) {
        String[] parts = CronFields.split(input);
        if (parts.length != 5 && parts.length != 6) {
            return Optional.empty();
        }

        String[] fields = parts.length == 6 ? Arrays.copyOfRange(parts, 1, 6) : parts;
        // day-of-month and month start at 1
        if ("0".equals(fields[2])) {
            fields[2] = "1";
        }
        if ("0".equals(fields[3])) {
            fields[3] = "1";
        }

        String candidate = String.join(" ", fields);
        try {
            CronFields.parse(candidate);
            return Optional.of(candidate);
        } catch (RuntimeException e) {
            LOG.debug("Not a valid cron expression '{}': {}", input, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> daily(String input) {
        Matcher zh = DAILY_ZH.matcher(input);
        if (zh.find()) {
            Optional<LocalTime> time = parseChineseTime(zh.group("rest"));
            if (time.isPresent()) {
                return Optional.of(format(time.get(), "*", "*", "?"));
            }
        }

        Matcher en = DAILY_EN.matcher(input);
        if (en.matches()) {
            return parseEnglishTime(en).map(time -> format(time, "*", "*", "?"));
        }
        return Optional.empty();
    }

    private Optional<String> weekly(String input) {
        Matcher zh = WEEKLY_ZH.matcher(input);
        if (zh.find()) {
            int weekday = WEEKDAYS_ZH.get(zh.group("day"));
            Optional<LocalTime> time = parseChineseTime(zh.group("rest"));
            if (time.isPresent()) {
                return Optional.of(format(time.get(), "?", "*", String.valueOf(weekday)));
            }
        }

        Matcher en = WEEKLY_EN.matcher(input);
        if (en.matches()) {
            int weekday = WEEKDAYS_EN.get(en.group("day").substring(0, 3));
            return parseEnglishTime(en).map(time -> format(time, "?", "*", String.valueOf(weekday)));
        }
        return Optional.empty();
    }

    private Optional<String> monthly(String input) {
        Matcher zh = MONTHLY_ZH.matcher(input);
        if (zh.find()) {
            int day = Integer.parseInt(zh.group("day"));
            String rest = zh.group("rest").trim();
            Optional<LocalTime> time = rest.isEmpty() ? Optional.of(LocalTime.MIDNIGHT) : parseChineseTime(rest);
            if (validDayOfMonth(day) && time.isPresent()) {
                return Optional.of(format(time.get(), String.valueOf(day), "*", "?"));
            }
        }

        Matcher en = MONTHLY_EN.matcher(input);
        if (en.matches()) {
            int day = Integer.parseInt(en.group("day"));
            Optional<LocalTime> time = en.group("hour") == null ? Optional.of(LocalTime.MIDNIGHT) : parseEnglishTime(en);
            if (validDayOfMonth(day) && time.isPresent()) {
                return Optional.of(format(time.get(), String.valueOf(day), "*", "?"));
            }
        }
        return Optional.empty();
    }

    private Optional<LocalTime> parseChineseTime(String token) {
        Matcher matcher = TIME_ZH.matcher(token == null ? "" : token.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        int hour = Integer.parseInt(matcher.group("hour"));
        int minute = 0;
        if (matcher.group("colonMinute") != null) {
            minute = Integer.parseInt(matcher.group("colonMinute"));
        } else if (matcher.group("pointMinute") != null) {
            minute = Integer.parseInt(matcher.group("pointMinute"));
        } else if (matcher.group("half") != null) {
            minute = 30;
        }

        String period = matcher.group("period");
        if (period != null) {
            switch (period) {
                case "下午", "傍晚", "晚上" -> hour = hour < 12 ? hour + 12 : hour;
                case "中午" -> hour = hour < 11 ? hour + 12 : hour;
                default -> {
                    // morning periods keep the hour as written
                }
            }
        }
        return timeOf(hour, minute);
    }

    private Optional<LocalTime> parseEnglishTime(Matcher matcher) {
        int hour = Integer.parseInt(matcher.group("hour"));
        int minute = matcher.group("minute") == null ? 0 : Integer.parseInt(matcher.group("minute"));
        String meridiem = matcher.group("meridiem");
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return Optional.empty();
            }
            hour = hour % 12;
            if ("pm".equals(meridiem)) {
                hour += 12;
            }
        }
        return timeOf(hour, minute);
    }

    private Optional<LocalTime> timeOf(int hour, int minute) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(hour, minute));
    }

    private boolean validDayOfMonth(int day) {
        return day >= 1 && day <= 31;
    }

    private String format(LocalTime time, String dayOfMonth, String month, String dayOfWeek) {
        return "0 " + time.getMinute() + " " + time.getHour() + " " + dayOfMonth + " " + month + " " + dayOfWeek;
    }
}
