package br.com.draftroom.backend.service.draft;

import java.time.Duration;

/**
 * Configuração imutável de uma sala, fixada na criação.
 */
public record DraftRoomConfig(
        int seatCount,
        int rounds,
        Duration pickClock,
        Duration gracePeriod,
        Duration countdown,
        PositionLimits positionLimits) {

    /** Teto de picks por sala (assentos x rodadas) */
    public static final int MAX_TOTAL_PICKS = 10_000;

    public DraftRoomConfig {
        if (seatCount < 1 || rounds < 1) {
            throw new IllegalArgumentException("Sala precisa de ao menos 1 assento e 1 rodada");
        }
        if ((long) seatCount * rounds > MAX_TOTAL_PICKS) {
            throw new IllegalArgumentException("Sala com " + seatCount + " x " + rounds + " passa de "
                    + MAX_TOTAL_PICKS + " picks");
        }
    }

    public int totalPicks() {
        return seatCount * rounds;
    }
}
