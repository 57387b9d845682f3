package io.numstab.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, invertible mapping from generated placeholder names ({@code v0},
 * {@code v1}, ...) to the original variable names of the host expression.
 * Iteration order is placeholder order.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class VarMap {

    private static final VarMap EMPTY = new VarMap(Map.of(), Map.of());

    private final Map<String, String> toOriginal;
    private final Map<String, String> toPlaceholder;

    private VarMap(Map<String, String> toOriginal, Map<String, String> toPlaceholder) {
        this.toOriginal = toOriginal;
        this.toPlaceholder = toPlaceholder;
    }

    public static VarMap empty() {
        return EMPTY;
    }

    /**
     * Creates a map from placeholder → original entries, keeping the given
     * iteration order.
     *
     * @throws IllegalArgumentException if two placeholders map to the same
     *                                  original name
     */
    public static VarMap of(Map<String, String> placeholderToOriginal) {
        if (placeholderToOriginal.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> forward = new LinkedHashMap<>();
        Map<String, String> inverse = new LinkedHashMap<>();
        placeholderToOriginal.forEach((placeholder, original) -> {
            Objects.requireNonNull(placeholder, "placeholder must not be null");
            Objects.requireNonNull(original, "original name must not be null");
            if (inverse.putIfAbsent(original, placeholder) != null) {
                throw new IllegalArgumentException("variable '" + original + "' mapped twice");
            }
            forward.put(placeholder, original);
        });
        return new VarMap(Collections.unmodifiableMap(forward), Collections.unmodifiableMap(inverse));
    }

    /** Placeholder names in assignment order. */
    public List<String> placeholders() {
        return List.copyOf(toOriginal.keySet());
    }

    public Optional<String> originalName(String placeholder) {
        return Optional.ofNullable(toOriginal.get(placeholder));
    }

    public Optional<String> placeholderFor(String originalName) {
        return Optional.ofNullable(toPlaceholder.get(originalName));
    }

    public int size() {
        return toOriginal.size();
    }

    public boolean isEmpty() {
        return toOriginal.isEmpty();
    }

    /** Placeholder → original entries in placeholder order. */
    public Map<String, String> asMap() {
        return toOriginal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VarMap other)) return false;
        return List.copyOf(toOriginal.entrySet()).equals(List.copyOf(other.toOriginal.entrySet()));
    }

    @Override
    public int hashCode() {
        return toOriginal.hashCode();
    }

    @Override
    public String toString() {
        return "VarMap" + toOriginal;
    }
}
