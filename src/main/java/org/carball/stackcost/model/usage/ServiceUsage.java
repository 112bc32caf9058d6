package org.carball.stackcost.model.usage;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Usage assumptions for one service, keyed by snake_case names such as {@code avg_monthly_requests}.
 * Values are numbers, booleans or strings.
 */
@EqualsAndHashCode
@ToString
public final class ServiceUsage {

    private final Map<String, Object> values;

    private ServiceUsage(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ServiceUsage of(Map<String, ?> values) {
        return new ServiceUsage(values == null ? Map.of() : values);
    }

    public static ServiceUsage empty() {
        return new ServiceUsage(Map.of());
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Numeric value of {@code key}, or {@code defaultValue} when it is missing, not numeric or not finite.
     */
    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        double number;
        if (value instanceof Number numeric) {
            number = numeric.doubleValue();
        } else if (value instanceof String text) {
            try {
                number = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else {
            return defaultValue;
        }
        return Double.isFinite(number) ? number : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text.trim());
        }
        return defaultValue;
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public int size() {
        return values.size();
    }
}
