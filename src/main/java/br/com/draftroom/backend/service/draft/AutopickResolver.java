package br.com.draftroom.backend.service.draft;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Escolha automática para timeout e para assentos bot.
 *
 * Três níveis, sempre determinísticos:
 * 1. primeiro jogador válido da fila do assento;
 * 2. melhor disponível (menor rank, desempate pelo menor id) que cabe no roster,
 *    primeiro pelos limites de autodraft do assento e depois pelos limites da sala;
 * 3. melhor disponível ignorando limites, para o draft nunca travar.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutopickResolver {

    private final PlayerCatalog playerCatalog;
    private final QueueManager queueManager;
    private final RosterRulesEvaluator rosterRules;

    public Optional<AutopickDecision> resolve(DraftRoom room, int seatIndex) {
        return room.withLock(() -> {
            Participant participant = room.participant(seatIndex);
            AvailablePool pool = AvailablePool.of(playerCatalog.listAll(), room);
            return resolve(participant, pool, effectiveLimits(room, participant), room.getConfig().positionLimits());
        });
    }

    /**
     * Versão pura: mesmo pool + mesmo roster ⇒ mesma decisão.
     */
    public Optional<AutopickDecision> resolve(Participant participant, AvailablePool pool, PositionLimits limits,
            PositionLimits roomLimits) {
        Map<String, List<String>> roster = participant.rosterView();

        Optional<String> fromQueue = queueManager.nextValidCandidate(participant.queueView(), pool, roster, limits);
        if (fromQueue.isPresent()) {
            log.debug("[Autopick] Assento {} → {} (fila)", participant.getSeatIndex(), fromQueue.get());
            return Optional.of(new AutopickDecision(fromQueue.get(), PickOrigin.QUEUE, true));
        }

        Optional<Player> best = pool.bestAvailable(p -> rosterRules.canAdd(roster, p.position(), limits));
        if (best.isPresent()) {
            log.debug("[Autopick] Assento {} → {} (melhor disponível)", participant.getSeatIndex(), best.get().id());
            return Optional.of(new AutopickDecision(best.get().id(), PickOrigin.BEST_AVAILABLE, true));
        }

        if (!limits.equals(roomLimits)) {
            Optional<Player> roomLegal = pool.bestAvailable(p -> rosterRules.canAdd(roster, p.position(), roomLimits));
            if (roomLegal.isPresent()) {
                log.info("[Autopick] Assento {} esgotou os limites de autodraft; {} pelos limites da sala",
                        participant.getSeatIndex(), roomLegal.get().id());
                return Optional.of(new AutopickDecision(roomLegal.get().id(), PickOrigin.BEST_AVAILABLE, true));
            }
        }

        Optional<Player> fallback = pool.bestAvailable();
        if (fallback.isPresent()) {
            log.warn("⚠️ [Autopick] Assento {} sem posição livre nos limites {}; usando {} sem limites",
                    participant.getSeatIndex(), limits, fallback.get().id());
            return Optional.of(new AutopickDecision(fallback.get().id(), PickOrigin.BEST_AVAILABLE, false));
        }

        log.error("❌ [Autopick] Pool vazio para o assento {}", participant.getSeatIndex());
        return Optional.empty();
    }

    /**
     * Limites da sala combinados com os overrides de autodraft do assento (o mais restritivo vence).
     */
    public PositionLimits effectiveLimits(DraftRoom room, Participant participant) {
        PositionLimits roomLimits = room.getConfig().positionLimits();
        return participant.autodraftOverrides()
                .map(roomLimits::tighterOf)
                .orElse(roomLimits);
    }
}
