package com.purchasingpower.brain.core;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed read access over an entity's open property bag.
 *
 * <p>Lookups never throw on unexpected value shapes; a value of the wrong
 * type reads as absent. {@link #asMap()} is the escape hatch for extension
 * fields.
 *
 * @since 2.0.0
 */
public final class EntityProperties {

    private static final EntityProperties EMPTY = new EntityProperties(Map.of());

    private final Map<String, Object> values;

    private EntityProperties(Map<String, Object> values) {
        this.values = values;
    }

    public static EntityProperties of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new EntityProperties(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * First non-blank, trimmed scalar among {@code keys}, in the given order.
     */
    public Optional<String> string(String... keys) {
        for (String key : keys) {
            String normalized = normalize(values.get(key));
            if (normalized != null) {
                return Optional.of(normalized);
            }
        }
        return Optional.empty();
    }

    public Optional<Double> number(String key) {
        Object value = values.get(key);
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        String text = normalize(value);
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public Optional<Instant> instant(String key) {
        return toInstant(values.get(key));
    }

    /**
     * True only for a literal boolean {@code true}.
     */
    public boolean flag(String key) {
        return Boolean.TRUE.equals(values.get(key));
    }

    public List<String> stringList(String key) {
        Object value = values.get(key);
        if (!(value instanceof Collection<?> collection)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(collection.size());
        for (Object item : collection) {
            String normalized = normalize(item);
            if (normalized != null) {
                result.add(normalized);
            }
        }
        return result;
    }

    public Object raw(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Trimmed string form of a scalar, or null when blank or not a scalar.
     */
    public static String normalize(Object value) {
        if (value == null || value instanceof Map || value instanceof Collection) {
            return null;
        }
        String trimmed = String.valueOf(value).trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static Optional<Instant> toInstant(Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toInstant());
        }
        if (value instanceof Number epochMillis) {
            return Optional.of(Instant.ofEpochMilli(epochMillis.longValue()));
        }
        String text = normalize(value);
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(text).toInstant());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
