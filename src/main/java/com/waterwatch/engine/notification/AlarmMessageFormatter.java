package com.waterwatch.engine.notification;

import com.waterwatch.engine.model.AlarmEvent;
import com.waterwatch.engine.model.ThresholdRule;
import com.waterwatch.engine.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders alarm SMS text from a rule's message template.
 *
 * Supported placeholders: {value}, {unit}, {limit}, {severity}, {ref}, {tag},
 * {op}, {target}, {window}. Unknown placeholders are left as written.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
public class AlarmMessageFormatter {

    public static final String DEFAULT_TEMPLATE = "[{severity}] {ref}: {value}{unit} {op} {limit}{unit} ({window})";

    public String format(ThresholdRule rule, double observedValue, TimeWindow window) {
        String template = rule.getMessageTemplate() != null && !rule.getMessageTemplate().isBlank()
                ? rule.getMessageTemplate()
                : DEFAULT_TEMPLATE;

        Map<String, String> values = new LinkedHashMap<>();
        values.put("value", formatNumber(observedValue));
        values.put("unit", rule.getUnit() != null ? rule.getUnit() : "");
        values.put("limit", formatNumber(rule.getLimitValue()));
        values.put("severity", rule.getSeverity().name());
        values.put("ref", rule.getRef());
        values.put("tag", rule.getTagId());
        values.put("op", rule.getComparisonOperator().getSymbol());
        values.put("target", rule.getTarget().toConfigValue());
        values.put("window", window.getName() + " " + window.formatRange());

        String text = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            text = text.replace("{" + entry.getKey() + "}", entry.getValue());
        }
        return text;
    }

    /**
     * Text of the notification sent when an alarm clears
     */
    public String formatCleared(AlarmEvent alarm) {
        return String.format("[CLEARED] %s is back within its limit of %s", alarm.getThresholdRef(),
                formatNumber(alarm.getLimitValue()));
    }

    /**
     * Two decimals at most, no trailing zeros, never scientific notation
     */
    static String formatNumber(double value) {
        return BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
}
