package br.com.draftroom.backend.service.draft;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Ciclo de vida da sala: WAITING → COUNTDOWN → ACTIVE ⇄ PAUSED, ACTIVE → COMPLETE.
 *
 * Nenhuma transição mexe no log de picks. Transições inválidas lançam
 * {@link IllegalStateException}; a sala fica como estava.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DraftStateMachine {

    private final TurnScheduler turnScheduler;

    /**
     * @return true se a confirmação fez a sala entrar em COUNTDOWN
     */
    public boolean markSeatReady(DraftRoom room, int seatIndex, Instant now) {
        return room.withLock(() -> {
            Participant participant = room.participant(seatIndex);
            if (room.getStatus() != DraftStatus.WAITING) {
                log.debug("[StateMachine] Sala {} em {}, ready do assento {} ignorado", room.getId(),
                        room.getStatus(), seatIndex);
                return false;
            }
            participant.markReady();
            return beginCountdownIfReady(room, now);
        });
    }

    public boolean beginCountdownIfReady(DraftRoom room, Instant now) {
        return room.withLock(() -> {
            if (room.getStatus() != DraftStatus.WAITING) {
                return false;
            }
            boolean allReady = room.getParticipants().stream().allMatch(Participant::isReady);
            if (!allReady) {
                return false;
            }
            transition(room, DraftStatus.COUNTDOWN);
            room.setCountdownEndsAt(now.plus(room.getConfig().countdown()));
            log.info("[StateMachine] Sala {} completa, draft começa em {}", room.getId(), room.getCountdownEndsAt());
            return true;
        });
    }

    public boolean activateIfCountdownElapsed(DraftRoom room, Instant now) {
        return room.withLock(() -> {
            if (room.getStatus() != DraftStatus.COUNTDOWN || now.isBefore(room.getCountdownEndsAt())) {
                return false;
            }
            transition(room, DraftStatus.ACTIVE);
            room.setCountdownEndsAt(null);
            turnScheduler.startTimer(room, now);
            log.info("🚀 [StateMachine] Sala {} ativa, pick {} no relógio", room.getId(), room.getCurrentPick());
            return true;
        });
    }

    public void pause(DraftRoom room) {
        room.withLock(() -> {
            transition(room, DraftStatus.PAUSED);
            turnScheduler.cancel(room);
            log.info("⏸️ [StateMachine] Sala {} pausada no pick {}", room.getId(), room.getCurrentPick());
        });
    }

    /**
     * Retoma com relógio cheio para o mesmo pick; o tempo pausado não conta.
     */
    public void resume(DraftRoom room, Instant now) {
        room.withLock(() -> {
            transition(room, DraftStatus.ACTIVE);
            turnScheduler.startTimer(room, now);
            log.info("▶️ [StateMachine] Sala {} retomada no pick {}", room.getId(), room.getCurrentPick());
        });
    }

    /**
     * Avança após um commit: inicia o próximo relógio ou encerra o draft.
     */
    public DraftStatus afterCommit(DraftRoom room, Instant now) {
        return room.withLock(() -> {
            if (room.isComplete()) {
                transition(room, DraftStatus.COMPLETE);
                turnScheduler.cancel(room);
                log.info("🏁 [StateMachine] Sala {} completa com {} picks", room.getId(), room.getConfig().totalPicks());
            } else {
                turnScheduler.startTimer(room, now);
            }
            return room.getStatus();
        });
    }

    /**
     * Usado na recuperação: salas ativas ganham relógio cheio, contagens regressivas recomeçam.
     */
    public void restartClock(DraftRoom room, Instant now) {
        room.withLock(() -> {
            if (room.getStatus() == DraftStatus.ACTIVE) {
                turnScheduler.startTimer(room, now);
            } else if (room.getStatus() == DraftStatus.COUNTDOWN) {
                room.setCountdownEndsAt(now.plus(room.getConfig().countdown()));
            }
        });
    }

    private void transition(DraftRoom room, DraftStatus target) {
        DraftStatus current = room.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Sala " + room.getId() + ": transição " + current + " → " + target
                    + " não permitida");
        }
        room.setStatus(target);
    }
}
