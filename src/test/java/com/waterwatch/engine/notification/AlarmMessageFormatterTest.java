package com.waterwatch.engine.notification;

import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.ComparisonOperator;
import com.waterwatch.engine.model.Severity;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.ThresholdTarget;
import com.waterwatch.engine.model.TimeWindow;
import com.waterwatch.engine.shift.ShiftCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlarmMessageFormatter}.
 */
class AlarmMessageFormatterTest {

    private final AlarmMessageFormatter formatter = new AlarmMessageFormatter();
    private final TimeWindow window = ShiftCalculator.standard(ZoneOffset.UTC)
            .shiftWindow(Instant.parse("2024-03-12T10:00:00Z"));

    @Test
    @DisplayName("Default template renders severity, value, limit and window")
    void defaultTemplate() {
        String text = formatter.format(rule(null), 152_340.456, window);

        assertThat(text).isEqualTo("[WARN] FT5101_TotalLts_shift: 152340.46L >= 150000L (Day Shift 2024-03-12 07:00 - 15:00)");
    }

    @Test
    @DisplayName("Custom template placeholders are substituted")
    void customTemplate() {
        String text = formatter.format(rule("{tag} used {value} {unit} ({target}, limit {limit})"), 1_000_000, window);

        assertThat(text).isEqualTo("FT5101_TotalLts used 1000000 L (shift_total, limit 150000)");
    }

    @Test
    @DisplayName("Unknown placeholders are left as written")
    void unknownPlaceholder() {
        assertThat(formatter.format(rule("{value} {pump}"), 12.5, window)).isEqualTo("12.5 {pump}");
    }

    @Test
    @DisplayName("Cleared notice names the threshold and its limit")
    void clearedMessage() {
        AlarmEvent alarm = AlarmEvent.builder().thresholdRef("FT5101_TotalLts_shift").limitValue(150_000).build();

        assertThat(formatter.formatCleared(alarm)).isEqualTo("[CLEARED] FT5101_TotalLts_shift is back within its limit of 150000");
    }

    @Test
    @DisplayName("Numbers never use scientific notation")
    void numberFormatting() {
        assertThat(AlarmMessageFormatter.formatNumber(4_294_967_295.0)).isEqualTo("4294967295");
        assertThat(AlarmMessageFormatter.formatNumber(0.1)).isEqualTo("0.1");
        assertThat(AlarmMessageFormatter.formatNumber(2.005)).isEqualTo("2.01");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ThresholdRule rule(String template) {
        return ThresholdRule.builder()
                .ref("FT5101_TotalLts_shift")
                .tagId("FT5101_TotalLts")
                .limitValue(150_000)
                .comparisonOperator(ComparisonOperator.GTE)
                .target(ThresholdTarget.SHIFT_TOTAL)
                .severity(Severity.WARN)
                .messageTemplate(template)
                .unit("L")
                .enabled(true)
                .build();
    }
}
