package br.com.draftroom.backend.service.draft;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Teto de jogadores por posição em um roster.
 *
 * Posição ausente do mapa não tem teto. Limite 0 bloqueia a posição.
 */
public final class PositionLimits {

    private static final PositionLimits UNLIMITED = new PositionLimits(Map.of());

    private final Map<String, Integer> maxByPosition;

    private PositionLimits(Map<String, Integer> maxByPosition) {
        this.maxByPosition = maxByPosition;
    }

    public static PositionLimits of(Map<String, Integer> limits) {
        if (limits == null || limits.isEmpty()) {
            return UNLIMITED;
        }
        Map<String, Integer> normalized = new LinkedHashMap<>();
        limits.forEach((position, max) -> {
            if (max == null || max < 0) {
                throw new IllegalArgumentException("Limite inválido para " + position + ": " + max);
            }
            normalized.put(normalize(position), max);
        });
        return new PositionLimits(Collections.unmodifiableMap(normalized));
    }

    public static PositionLimits unlimited() {
        return UNLIMITED;
    }

    public static String normalize(String position) {
        return position.trim().toUpperCase(Locale.ROOT);
    }

    public OptionalInt maxFor(String position) {
        Integer max = maxByPosition.get(normalize(position));
        return max == null ? OptionalInt.empty() : OptionalInt.of(max);
    }

    /**
     * @return true se um roster com {@code currentCount} jogadores na posição ainda aceita mais um
     */
    public boolean allows(String position, int currentCount) {
        OptionalInt max = maxFor(position);
        return max.isEmpty() || currentCount < max.getAsInt();
    }

    /**
     * Combina com overrides de autodraft mantendo sempre o teto mais restritivo.
     */
    public PositionLimits tighterOf(PositionLimits overrides) {
        if (overrides == null || overrides.maxByPosition.isEmpty()) {
            return this;
        }
        Map<String, Integer> merged = new LinkedHashMap<>(maxByPosition);
        overrides.maxByPosition.forEach((position, max) -> merged.merge(position, max, Math::min));
        return new PositionLimits(Collections.unmodifiableMap(merged));
    }

    public Map<String, Integer> asMap() {
        return maxByPosition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PositionLimits that)) return false;
        return maxByPosition.equals(that.maxByPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxByPosition);
    }

    @Override
    public String toString() {
        return "PositionLimits" + maxByPosition;
    }
}
