package br.com.draftroom.backend.service.draft;

import br.com.draftroom.backend.config.properties.DraftEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Relógio de pick de cada sala.
 *
 * Não registra callbacks: o {@link TimerState} fica na sala e um driver externo
 * (o tick agendado) pergunta por {@link #claimExpired} periodicamente.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnScheduler {

    private final DraftEngineProperties properties;

    public TimerState startTimer(DraftRoom room, Instant now) {
        return room.withLock(() -> {
            int pickNumber = room.getCurrentPick();
            int seat = SnakeOrder.seatForPick(pickNumber, room.getConfig().seatCount());
            TimerState timer = TimerState.start(pickNumber, seat, now, room.getConfig().pickClock(),
                    room.getConfig().gracePeriod());
            room.setTimer(timer);
            log.debug("⏰ [TurnScheduler] Sala {} pick {} assento {} deadline {}", room.getId(), pickNumber, seat,
                    timer.deadline());
            return timer;
        });
    }

    /**
     * Marca o relógio do pick atual como expirado, se for a hora.
     *
     * Expira quando o grace acabou ou, para assentos bot, assim que o atraso de bot passou.
     * Devolve o timer só para quem o marcou; chamadas seguintes para o mesmo pick
     * devolvem vazio.
     */
    public Optional<TimerState> claimExpired(DraftRoom room, Instant now) {
        return room.withLock(() -> {
            TimerState timer = room.getTimer();
            if (room.getStatus() != DraftStatus.ACTIVE || timer == null || timer.expired()) {
                return Optional.<TimerState>empty();
            }
            if (timer.pickNumber() != room.getCurrentPick()) {
                return Optional.<TimerState>empty();
            }
            boolean botTurn = room.participant(timer.seatIndex()).isBot();
            boolean botReady = botTurn && !now.isBefore(
                    timer.startedAt().plus(Duration.ofMillis(properties.getEngine().getBotPickDelayMs())));
            if (!timer.isGraceElapsed(now) && !botReady) {
                return Optional.<TimerState>empty();
            }
            TimerState expired = timer.markExpired();
            room.setTimer(expired);
            if (!botTurn) {
                log.info("⏰ [TurnScheduler] Sala {} pick {} expirou para o assento {}", room.getId(),
                        timer.pickNumber(), timer.seatIndex());
            }
            return Optional.of(expired);
        });
    }

    public void cancel(DraftRoom room) {
        room.withLock(() -> room.setTimer(null));
    }
}
