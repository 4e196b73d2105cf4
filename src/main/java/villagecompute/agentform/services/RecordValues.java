package villagecompute.agentform.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed reads from the loosely typed maps kept in a {@link RecordStore} and returned by the LLM workflow.
 */
public final class RecordValues {

    private RecordValues() {
        // Utility class, no instantiation
    }

    public static double doubleValue(Object value, double defaultValue) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Numeric value or null when absent or not a number.
     */
    public static Double doubleOrNull(Object value) {
        double parsed = doubleValue(value, Double.NaN);
        return Double.isNaN(parsed) ? null : parsed;
    }

    public static int intValue(Object value, int defaultValue) {
        return value instanceof Number number ? number.intValue() : defaultValue;
    }

    public static boolean booleanValue(Object value) {
        return Boolean.TRUE.equals(value) || (value instanceof String text && Boolean.parseBoolean(text));
    }

    /**
     * Mutable copy of a nested map (empty when absent).
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> mapValue(Object value) {
        return value instanceof Map<?, ?> map ? new LinkedHashMap<>((Map<String, Object>) map) : new LinkedHashMap<>();
    }

    /**
     * Mutable copy of a nested list (empty when absent).
     */
    public static List<Object> listValue(Object value) {
        return value instanceof List<?> list ? new ArrayList<>(list) : new ArrayList<>();
    }

    public static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Incremental mean after adding {@code value} as sample number {@code count}.
     */
    public static double runningAverage(double currentAverage, int count, double value) {
        return count <= 1 ? value : ((currentAverage * (count - 1)) + value) / count;
    }
}
