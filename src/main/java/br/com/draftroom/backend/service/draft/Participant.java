package br.com.draftroom.backend.service.draft;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Um assento do draft.
 *
 * O roster só cresce; a fila é editada apenas pelo {@link QueueManager} e pelo commit
 * de picks, sempre com o lock da sala.
 */
@Getter
public class Participant {
    private final String id;
    private final int seatIndex;
    private final boolean bot;
    private final PositionLimits autodraftLimits;
    private boolean ready;

    @Getter(lombok.AccessLevel.NONE)
    private final List<String> queue = new ArrayList<>();

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, List<String>> roster = new LinkedHashMap<>();

    public Participant(String id, int seatIndex, boolean bot, PositionLimits autodraftLimits) {
        this.id = id;
        this.seatIndex = seatIndex;
        this.bot = bot;
        this.autodraftLimits = autodraftLimits;
        // Bots não confirmam presença
        this.ready = bot;
    }

    /**
     * Recria um assento persistido. O roster não entra aqui: ele vem do replay do log de picks.
     */
    public static Participant restore(String id, int seatIndex, boolean bot, PositionLimits autodraftLimits,
            boolean ready, List<String> queue) {
        Participant participant = new Participant(id, seatIndex, bot, autodraftLimits);
        participant.ready = bot || ready;
        participant.queue.addAll(queue);
        return participant;
    }

    public Optional<PositionLimits> autodraftOverrides() {
        return Optional.ofNullable(autodraftLimits);
    }

    public List<String> queueView() {
        return List.copyOf(queue);
    }

    public Map<String, List<String>> rosterView() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        roster.forEach((position, players) -> copy.put(position, List.copyOf(players)));
        return Collections.unmodifiableMap(copy);
    }

    public int countAt(String position) {
        List<String> players = roster.get(PositionLimits.normalize(position));
        return players == null ? 0 : players.size();
    }

    public Map<String, Integer> positionCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        roster.forEach((position, players) -> counts.put(position, players.size()));
        return counts;
    }

    void markReady() {
        this.ready = true;
    }

    void replaceQueue(List<String> playerIds) {
        queue.clear();
        queue.addAll(playerIds);
    }

    boolean removeFromQueue(String playerId) {
        return queue.remove(playerId);
    }

    void addToRoster(String position, String playerId) {
        roster.computeIfAbsent(PositionLimits.normalize(position), p -> new ArrayList<>()).add(playerId);
    }
}
