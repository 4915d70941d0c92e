package io.herald.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ScheduleExpressionTranslatorTest {

    private final ScheduleExpressionTranslator translator = new ScheduleExpressionTranslator();

    @Test
    void shouldKeepValidFiveFieldCron() {
        assertThat(translator.translate("0 9 * * 1-5")).isEqualTo("0 9 * * 1-5");
        assertThat(translator.translate("  */15   * * * *  ")).isEqualTo("*/15 * * * *");
    }

    @Test
    void shouldDropLeadingSecondsFromSixFieldCron() {
        assertThat(translator.translate("0 30 9 * * ?")).isEqualTo("30 9 * * ?");
    }

    @Test
    void shouldRepairZeroDayOfMonthAndMonth() {
        assertThat(translator.translate("0 0 0 0 *")).isEqualTo("0 0 1 * *");
        assertThat(translator.translate("0 0 1 0 *")).isEqualTo("0 0 1 1 *");
    }

    @Test
    void shouldTranslateChineseDailyPhrases() {
        assertThat(translator.translate("每天9点")).isEqualTo("0 0 9 * * ?");
        assertThat(translator.translate("每天9:30")).isEqualTo("0 30 9 * * ?");
        assertThat(translator.translate("每天8点15分")).isEqualTo("0 15 8 * * ?");
        assertThat(translator.translate("每天下午3点")).isEqualTo("0 0 15 * * ?");
        assertThat(translator.translate("每天晚上9点半")).isEqualTo("0 30 21 * * ?");
        assertThat(translator.translate("每天0点")).isEqualTo("0 0 0 * * ?");
    }

    @Test
    void shouldTranslateEnglishDailyPhrases() {
        assertThat(translator.translate("every day at 9")).isEqualTo("0 0 9 * * ?");
        assertThat(translator.translate("Daily at 9:30pm")).isEqualTo("0 30 21 * * ?");
        assertThat(translator.translate("daily at 12am")).isEqualTo("0 0 0 * * ?");
    }

    @Test
    void shouldTranslateWeeklyPhrasesWithSundayAsZero() {
        assertThat(translator.translate("每周一8:30")).isEqualTo("0 30 8 ? * 1");
        assertThat(translator.translate("每星期日10点")).isEqualTo("0 0 10 ? * 0");
        assertThat(translator.translate("每周7 9点")).isEqualTo("0 0 9 ? * 0");
        assertThat(translator.translate("every Monday at 8:30")).isEqualTo("0 30 8 ? * 1");
        assertThat(translator.translate("every week on friday at 17:00")).isEqualTo("0 0 17 ? * 5");
    }

    @Test
    void shouldTranslateMonthlyPhrasesWithMidnightDefault() {
        assertThat(translator.translate("每月1号0点")).isEqualTo("0 0 0 1 * ?");
        assertThat(translator.translate("每月15日")).isEqualTo("0 0 0 15 * ?");
        assertThat(translator.translate("every month on day 1 at 9")).isEqualTo("0 0 9 1 * ?");
        assertThat(translator.translate("every month on the 15th at 6pm")).isEqualTo("0 0 18 15 * ?");
    }

    @Test
    void shouldFallBackToDailyMidnightForUnrecognizedInput() {
        assertThat(translator.translate("whenever you like")).isEqualTo(ScheduleExpressionTranslator.FALLBACK_EXPRESSION);
        assertThat(translator.translate("")).isEqualTo("0 0 0 * * ?");
        assertThat(translator.translate(null)).isEqualTo("0 0 0 * * ?");
        assertThat(translator.translate("99 99 * * *")).isEqualTo("0 0 0 * * ?");
    }

    @Test
    void shouldTreatOutOfRangeValuesAsUnrecognized() {
        assertThat(translator.translate("每天25点")).isEqualTo("0 0 0 * * ?");
        assertThat(translator.translate("每月32号")).isEqualTo("0 0 0 * * ?");
        assertThat(translator.translate("every day at 13pm")).isEqualTo("0 0 0 * * ?");
    }

    @Test
    void strictTranslatorShouldRejectUnrecognizedInput() {
        ScheduleExpressionTranslator strict = new ScheduleExpressionTranslator(true);

        assertThat(strict.translate("每天9点")).isEqualTo("0 0 9 * * ?");
        assertThatThrownBy(() -> strict.translate("whenever you like"))
            .isInstanceOf(InvalidScheduleException.class)
            .hasMessageContaining("whenever you like");
    }
}
