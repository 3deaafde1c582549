package br.com.draftroom.backend.service.draft;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Catálogo menos os jogadores já draftados. Sempre derivado do log de picks,
 * nunca tratado como fonte independente.
 */
public final class AvailablePool {

    /**
     * Melhor rank primeiro; empate decidido pelo menor id do catálogo.
     */
    public static final Comparator<Player> BEST_AVAILABLE_ORDER = Comparator
            .comparingDouble(Player::rank)
            .thenComparing(Player::id);

    private final Map<String, Player> available;

    private AvailablePool(Map<String, Player> available) {
        this.available = available;
    }

    public static AvailablePool of(List<Player> catalog, Set<String> draftedPlayerIds) {
        Map<String, Player> ordered = new LinkedHashMap<>();
        catalog.stream()
                .filter(p -> !draftedPlayerIds.contains(p.id()))
                .sorted(BEST_AVAILABLE_ORDER)
                .forEach(p -> ordered.putIfAbsent(p.id(), p));
        return new AvailablePool(ordered);
    }

    public static AvailablePool of(List<Player> catalog, DraftRoom room) {
        return of(catalog, room.draftedPlayerIds());
    }

    public boolean contains(String playerId) {
        return available.containsKey(playerId);
    }

    public Optional<Player> find(String playerId) {
        return Optional.ofNullable(available.get(playerId));
    }

    public Optional<Player> bestAvailable() {
        return available.values().stream().findFirst();
    }

    public Optional<Player> bestAvailable(Predicate<Player> filter) {
        return available.values().stream().filter(filter).findFirst();
    }
}
