package br.com.draftroom.backend.service.draft;

import br.com.draftroom.backend.exception.InvalidDraftCommandException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fila de preferências de cada assento.
 *
 * A leitura ({@link #nextValidCandidate}) nunca altera a fila; um jogador só sai da fila
 * quando alguém o draftar.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueManager {

    private final PlayerCatalog playerCatalog;
    private final RosterRulesEvaluator rosterRules;

    /**
     * Primeiro jogador da fila que ainda está disponível e cabe no roster.
     */
    public Optional<String> nextValidCandidate(List<String> queue, AvailablePool pool,
            Map<String, List<String>> roster, PositionLimits limits) {
        for (String playerId : queue) {
            Optional<Player> player = pool.find(playerId);
            if (player.isEmpty()) {
                continue;
            }
            if (rosterRules.canAdd(roster, player.get().position(), limits)) {
                return Optional.of(playerId);
            }
        }
        return Optional.empty();
    }

    /**
     * Substitui a fila inteira. Ids desconhecidos, já draftados ou repetidos são descartados.
     */
    public List<String> replaceQueue(DraftRoom room, int seatIndex, List<String> requested) {
        return room.withLock(() -> {
            Participant participant = editableParticipant(room, seatIndex);
            AvailablePool pool = AvailablePool.of(playerCatalog.listAll(), room);

            List<String> sanitized = new ArrayList<>();
            for (String playerId : new LinkedHashSet<>(requested)) {
                if (playerId != null && pool.contains(playerId)) {
                    sanitized.add(playerId);
                }
            }
            if (sanitized.size() != requested.size()) {
                log.debug("[Queue] Sala {} assento {}: {} entradas descartadas na edição da fila",
                        room.getId(), seatIndex, requested.size() - sanitized.size());
            }
            participant.replaceQueue(sanitized);
            return participant.queueView();
        });
    }

    public List<String> append(DraftRoom room, int seatIndex, String playerId) {
        return room.withLock(() -> {
            Participant participant = editableParticipant(room, seatIndex);
            requireAvailable(room, playerId);
            List<String> queue = new ArrayList<>(participant.queueView());
            if (!queue.contains(playerId)) {
                queue.add(playerId);
                participant.replaceQueue(queue);
            }
            return participant.queueView();
        });
    }

    public List<String> remove(DraftRoom room, int seatIndex, String playerId) {
        return room.withLock(() -> {
            Participant participant = editableParticipant(room, seatIndex);
            participant.removeFromQueue(playerId);
            return participant.queueView();
        });
    }

    /**
     * Move um jogador da fila para {@code targetIndex} (limitado às bordas da fila).
     */
    public List<String> move(DraftRoom room, int seatIndex, String playerId, int targetIndex) {
        return room.withLock(() -> {
            Participant participant = editableParticipant(room, seatIndex);
            List<String> queue = new ArrayList<>(participant.queueView());
            if (!queue.remove(playerId)) {
                throw new InvalidDraftCommandException("Jogador " + playerId + " não está na fila do assento " + seatIndex);
            }
            int bounded = Math.max(0, Math.min(targetIndex, queue.size()));
            queue.add(bounded, playerId);
            participant.replaceQueue(queue);
            return participant.queueView();
        });
    }

    private Participant editableParticipant(DraftRoom room, int seatIndex) {
        if (room.getStatus().isTerminal()) {
            throw new InvalidDraftCommandException("Sala " + room.getId() + " já terminou; fila não pode ser editada");
        }
        if (seatIndex < 0 || seatIndex >= room.getConfig().seatCount()) {
            throw new InvalidDraftCommandException("Assento inválido: " + seatIndex);
        }
        return room.participant(seatIndex);
    }

    private void requireAvailable(DraftRoom room, String playerId) {
        if (playerId == null || playerCatalog.getPlayer(playerId).isEmpty()) {
            throw new InvalidDraftCommandException("Jogador desconhecido: " + playerId);
        }
        if (room.isDrafted(playerId)) {
            throw new InvalidDraftCommandException("Jogador " + playerId + " já foi draftado");
        }
    }
}
