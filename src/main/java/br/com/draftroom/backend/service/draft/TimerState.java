package br.com.draftroom.backend.service.draft;

import java.time.Duration;
import java.time.Instant;

/**
 * Relógio do pick ativo.
 *
 * O cliente só enxerga {@link #deadline()}; {@link #graceEnd()} é quando o servidor
 * considera o relógio realmente expirado.
 */
public record TimerState(
        int pickNumber,
        int seatIndex,
        Instant startedAt,
        Instant deadline,
        Instant graceEnd,
        boolean expired) {

    public static TimerState start(int pickNumber, int seatIndex, Instant now, Duration pickClock,
            Duration gracePeriod) {
        Instant deadline = now.plus(pickClock);
        return new TimerState(pickNumber, seatIndex, now, deadline, deadline.plus(gracePeriod), false);
    }

    public boolean isGraceElapsed(Instant now) {
        return !now.isBefore(graceEnd);
    }

    public long remainingSeconds(Instant now) {
        long remainingMs = Duration.between(now, deadline).toMillis();
        if (remainingMs <= 0) {
            return 0;
        }
        return (remainingMs + 999) / 1000;
    }

    public TimerState markExpired() {
        return new TimerState(pickNumber, seatIndex, startedAt, deadline, graceEnd, true);
    }
}
