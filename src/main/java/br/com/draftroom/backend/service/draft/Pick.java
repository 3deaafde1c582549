package br.com.draftroom.backend.service.draft;

import java.time.Instant;
import java.util.Map;

/**
 * Registro imutável de um pick commitado. O log de picks é a história oficial do draft.
 *
 * @param rosterAtPick contagem por posição do roster do assento logo após este pick
 */
public record Pick(
        int pickNumber,
        int round,
        int pickInRound,
        int seatIndex,
        String participantId,
        String playerId,
        String position,
        PickOrigin origin,
        Instant committedAt,
        Map<String, Integer> rosterAtPick) {

    public Pick {
        rosterAtPick = rosterAtPick == null ? Map.of() : Map.copyOf(rosterAtPick);
    }
}
