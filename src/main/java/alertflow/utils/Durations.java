package alertflow.utils;

import alertflow.exception.ValidationException;

import java.time.Duration;
import java.util.Map;

/**
 * 时间周期解析: "10m" / {minutes: 10} / 秒数 / ISO-8601
 */
public final class Durations {

    private Durations() {
    }

    @SuppressWarnings("unchecked")
    public static Duration parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        if (value instanceof String) {
            return parseString(((String) value).trim());
        }
        if (value instanceof Map) {
            return parseMap((Map<String, Object>) value);
        }
        throw new ValidationException("无效的时间周期格式: " + value);
    }

    private static Duration parseString(String value) {
        if (value.isEmpty()) {
            return null;
        }
        if (value.startsWith("P") || value.startsWith("p")) {
            try {
                return Duration.parse(value);
            } catch (Exception e) {
                throw new ValidationException("无效的时间周期格式: " + value, e);
            }
        }
        String number = value.replaceAll("[^0-9]", "");
        String unit = value.replaceAll("[0-9]", "").trim();
        if (number.isEmpty()) {
            throw new ValidationException("无效的时间周期格式: " + value);
        }

        long amount = Long.parseLong(number);

        switch (unit.toLowerCase()) {
            case "":
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            default:
                throw new ValidationException("无效的时间单位: " + unit);
        }
    }

    private static Duration parseMap(Map<String, Object> map) {
        Duration duration = Duration.ZERO;

        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String unit = entry.getKey().toLowerCase();
            if (!(entry.getValue() instanceof Number)) {
                throw new ValidationException("无效的时间周期数值: " + entry.getValue());
            }
            long amount = ((Number) entry.getValue()).longValue();

            switch (unit) {
                case "seconds":
                    duration = duration.plusSeconds(amount);
                    break;
                case "minutes":
                    duration = duration.plusMinutes(amount);
                    break;
                case "hours":
                    duration = duration.plusHours(amount);
                    break;
                case "days":
                    duration = duration.plusDays(amount);
                    break;
                default:
                    throw new ValidationException("无效的时间单位: " + unit);
            }
        }

        return duration;
    }
}
