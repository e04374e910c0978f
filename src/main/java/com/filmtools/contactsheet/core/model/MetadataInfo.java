package com.filmtools.contactsheet.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Footer text for a sheet. Values are passed through untouched; a missing or empty value
 * means the line is not drawn.
 */
public final class MetadataInfo {
    private static final MetadataInfo EMPTY = new MetadataInfo(new EnumMap<>(MetadataField.class));

    private final Map<MetadataField, String> values;

    private MetadataInfo(EnumMap<MetadataField, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static MetadataInfo empty() {
        return EMPTY;
    }

    /**
     * Builds metadata from string keys ({@code date}, {@code location}, ...). Unknown keys are ignored.
     */
    public static MetadataInfo fromMap(Map<String, String> raw) {
        EnumMap<MetadataField, String> values = new EnumMap<>(MetadataField.class);
        if (raw != null) {
            raw.forEach((key, value) -> MetadataField.fromKey(key).ifPresent(field -> {
                if (value != null && !value.isEmpty()) {
                    values.put(field, value);
                }
            }));
        }
        return new MetadataInfo(values);
    }

    public Optional<String> get(MetadataField field) {
        return Optional.ofNullable(values.get(field));
    }

    public MetadataInfo with(MetadataField field, String value) {
        EnumMap<MetadataField, String> copy = new EnumMap<>(MetadataField.class);
        copy.putAll(values);
        if (value == null || value.isEmpty()) {
            copy.remove(field);
        } else {
            copy.put(field, value);
        }
        return new MetadataInfo(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetadataInfo other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MetadataInfo" + values;
    }
}
