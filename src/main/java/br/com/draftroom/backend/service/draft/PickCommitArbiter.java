package br.com.draftroom.backend.service.draft;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Único ponto de mutação do log de picks.
 *
 * Checagens e append acontecem com o lock da sala segurado, como uma operação só
 * (compare-and-append pelo número do pick). Em uma corrida pelo mesmo pick exatamente
 * uma tentativa vence; as demais veem o pick já avançado e recebem STALE_REQUEST.
 *
 * Ordem das checagens:
 * 1. pick atual (STALE_REQUEST)
 * 2. sala ACTIVE (DRAFT_NOT_ACTIVE)
 * 3. assento da vez (WRONG_TURN)
 * 4. jogador no pool (PLAYER_UNAVAILABLE)
 * 5. limite de posição (ROSTER_LIMIT_EXCEEDED)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PickCommitArbiter {

    private final RosterRulesEvaluator rosterRules;
    private final PlayerCatalog playerCatalog;
    private final PickJournal pickJournal;
    private final Clock clock;

    public CommitResult attemptCommit(DraftRoom room, int pickNumber, int seatIndex, String playerId,
            PickOrigin origin) {
        return attemptCommit(room, pickNumber, seatIndex, playerId, origin, true);
    }

    /**
     * @param enforceRosterLimits false apenas no último nível do autopick, quando nenhum
     *                            jogador disponível cabe nos limites
     */
    public CommitResult attemptCommit(DraftRoom room, int pickNumber, int seatIndex, String playerId,
            PickOrigin origin, boolean enforceRosterLimits) {
        return room.withLock(() -> {
            CommitResult rejection = validate(room, pickNumber, seatIndex, playerId, enforceRosterLimits);
            if (rejection != null) {
                log.warn("[Arbiter] Sala {} pick {} assento {} jogador {} ({}): {} - {}", room.getId(), pickNumber,
                        seatIndex, playerId, origin.getWireValue(), rejection.status(), rejection.message());
                return rejection;
            }

            Player player = playerCatalog.getPlayer(playerId).orElseThrow();
            Participant participant = room.participant(seatIndex);
            Pick pick = new Pick(
                    pickNumber,
                    SnakeOrder.roundForPick(pickNumber, room.getConfig().seatCount()),
                    SnakeOrder.pickInRound(pickNumber, room.getConfig().seatCount()),
                    seatIndex,
                    participant.getId(),
                    player.id(),
                    player.position(),
                    origin,
                    clock.instant(),
                    rosterAfter(participant, player.position()));

            // Persistido antes de ficar visível em memória
            pickJournal.appendPick(room.getId(), pick);
            room.appendPick(pick);

            log.info("✅ [Arbiter] Sala {} pick {} ({}) → assento {} escolheu {} [{}] via {}", room.getId(),
                    pickNumber, SnakeOrder.format(pickNumber, room.getConfig().seatCount()), seatIndex,
                    player.id(), player.position(), origin.getWireValue());
            return CommitResult.committed(pick);
        });
    }

    private CommitResult validate(DraftRoom room, int pickNumber, int seatIndex, String playerId,
            boolean enforceRosterLimits) {
        int current = room.getCurrentPick();
        if (pickNumber != current) {
            return CommitResult.rejected(CommitStatus.STALE_REQUEST,
                    "Pick " + pickNumber + " não é o atual (" + current + ")");
        }
        if (room.getStatus() != DraftStatus.ACTIVE) {
            return CommitResult.rejected(CommitStatus.DRAFT_NOT_ACTIVE,
                    "Sala em " + room.getStatus() + ", picks não são aceitos");
        }

        int expectedSeat = SnakeOrder.seatForPick(pickNumber, room.getConfig().seatCount());
        if (seatIndex != expectedSeat) {
            return CommitResult.rejected(CommitStatus.WRONG_TURN,
                    "Vez do assento " + expectedSeat + ", não do " + seatIndex);
        }

        Optional<Player> player = playerId == null ? Optional.empty() : playerCatalog.getPlayer(playerId);
        if (player.isEmpty() || room.isDrafted(playerId)) {
            return CommitResult.rejected(CommitStatus.PLAYER_UNAVAILABLE,
                    "Jogador " + playerId + " não está disponível");
        }

        if (enforceRosterLimits && !rosterRules.canAdd(room.participant(seatIndex), player.get().position(),
                room.getConfig().positionLimits())) {
            return CommitResult.rejected(CommitStatus.ROSTER_LIMIT_EXCEEDED,
                    "Limite de " + player.get().position() + " atingido para o assento " + seatIndex);
        }
        return null;
    }

    private Map<String, Integer> rosterAfter(Participant participant, String position) {
        Map<String, Integer> counts = participant.positionCounts();
        counts.merge(PositionLimits.normalize(position), 1, Integer::sum);
        return counts;
    }
}
