package org.dxworks.urdf2mjcf.actuator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Default gains for synthesized actuators: {@code kp} for position actuators,
 * {@code kv} for velocity actuators and an optional {@code dampratio}.
 */
public class ActuatorGains {
    public static final double DEFAULT_KP = 500.0;
    public static final double DEFAULT_KV = 1.0;

    private static final Set<String> KNOWN_KEYS = Set.of("kp", "kv", "dampratio");

    private final Map<String, Double> values;

    private ActuatorGains(Map<String, Double> values) {
        this.values = values;
    }

    public static ActuatorGains defaults() {
        return of(DEFAULT_KP, DEFAULT_KV);
    }

    public static ActuatorGains of(double kp, double kv) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("kp", kp);
        values.put("kv", kv);
        return new ActuatorGains(values);
    }

    /** Legacy {@code [kp, kv]} form. */
    public static ActuatorGains of(List<? extends Number> legacy) {
        if (legacy == null || legacy.size() != 2) {
            throw new IllegalArgumentException("Legacy list format must have exactly 2 values [kp, kv], got: " + legacy);
        }
        return of(legacy.get(0).doubleValue(), legacy.get(1).doubleValue());
    }

    /**
     * Parses {@code "kp=500.0,kv=1.0"}, {@code "kp=500.0 kv=1.0"} or
     * {@code "kp = 500.0 , kv = 1.0, dampratio=0.5"}. The last duplicate wins.
     */
    public static ActuatorGains parse(String text) {
        String normalized = text == null ? "" : text.trim().replaceAll("\\s*=\\s*", "=");
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("No valid key=value pairs found in actuator gains: '" + text + "'");
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (String token : normalized.split("[,\\s]+")) {
            if (token.isEmpty()) continue;
            int eq = token.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Invalid format for actuator gain '" + token
                        + "'. Expected key=value, e.g. 'kp=500.0,kv=1.0'");
            }
            String key = token.substring(0, eq).toLowerCase(Locale.ROOT);
            String raw = token.substring(eq + 1);
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown actuator gain key: '" + key + "'. Allowed keys: kp, kv, dampratio");
            }
            try {
                values.put(key, Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for '" + key + "': '" + raw + "'", e);
            }
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No valid key=value pairs found in actuator gains: '" + text + "'");
        }
        return new ActuatorGains(values);
    }

    /** Accepts a gains string or a legacy two-element list, as found in configuration files. */
    public static ActuatorGains from(Object raw) {
        if (raw == null) {
            return defaults();
        }
        if (raw instanceof ActuatorGains gains) {
            return gains;
        }
        if (raw instanceof String s) {
            return parse(s);
        }
        if (raw instanceof List<?> list) {
            if (list.size() != 2) {
                throw new IllegalArgumentException("Legacy list format must have exactly 2 values [kp, kv], got: " + list);
            }
            return of(toDouble(list.get(0)), toDouble(list.get(1)));
        }
        throw new IllegalArgumentException("Unsupported actuator gains value: " + raw);
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid actuator gain value: '" + value + "'", e);
        }
    }

    public double getKp() {
        return values.getOrDefault("kp", DEFAULT_KP);
    }

    public double getKv() {
        return values.getOrDefault("kv", DEFAULT_KV);
    }

    public boolean hasDampRatio() {
        return values.containsKey("dampratio");
    }

    public double getDampRatio() {
        return values.getOrDefault("dampratio", 0.0);
    }

    /** Explicitly given values, in the order they were specified. */
    public Map<String, Double> asMap() {
        return new LinkedHashMap<>(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
