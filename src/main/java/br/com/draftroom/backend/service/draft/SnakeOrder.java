package br.com.draftroom.backend.service.draft;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Aritmética da ordem snake.
 *
 * Rodadas ímpares andam 0 → N-1, rodadas pares voltam N-1 → 0. Picks são 1-based.
 */
public final class SnakeOrder {

    private SnakeOrder() {
    }

    public static int totalPicks(int seatCount, int rounds) {
        return seatCount * rounds;
    }

    public static boolean isValidPickNumber(int pickNumber, int seatCount, int rounds) {
        return pickNumber >= 1 && pickNumber <= totalPicks(seatCount, rounds);
    }

    public static int roundForPick(int pickNumber, int seatCount) {
        requirePositive(pickNumber, seatCount);
        return (pickNumber + seatCount - 1) / seatCount;
    }

    public static int pickInRound(int pickNumber, int seatCount) {
        requirePositive(pickNumber, seatCount);
        return ((pickNumber - 1) % seatCount) + 1;
    }

    public static boolean isReverseRound(int round) {
        return round % 2 == 0;
    }

    public static int seatForPick(int pickNumber, int seatCount) {
        int round = roundForPick(pickNumber, seatCount);
        int offset = pickInRound(pickNumber, seatCount) - 1;
        return isReverseRound(round) ? seatCount - 1 - offset : offset;
    }

    /**
     * Pick global de um assento em uma rodada.
     */
    public static int pickNumberFor(int seatIndex, int round, int seatCount) {
        int offset = isReverseRound(round) ? seatCount - 1 - seatIndex : seatIndex;
        return (round - 1) * seatCount + offset + 1;
    }

    public static List<Integer> pickNumbersForSeat(int seatIndex, int seatCount, int rounds) {
        List<Integer> picks = new ArrayList<>(rounds);
        for (int round = 1; round <= rounds; round++) {
            picks.add(pickNumberFor(seatIndex, round, seatCount));
        }
        return picks;
    }

    /**
     * Próximo pick do assento a partir de {@code currentPick} (inclusive), ou -1 se não houver.
     */
    public static int nextPickForSeat(int seatIndex, int currentPick, int seatCount, int rounds) {
        for (int pick : pickNumbersForSeat(seatIndex, seatCount, rounds)) {
            if (pick >= currentPick) {
                return pick;
            }
        }
        return -1;
    }

    /**
     * Quantos picks faltam até a vez do assento; 0 quando ele já está no relógio, -1 se acabou.
     */
    public static int picksUntilTurn(int seatIndex, int currentPick, int seatCount, int rounds) {
        int next = nextPickForSeat(seatIndex, currentPick, seatCount, rounds);
        return next < 0 ? -1 : next - currentPick;
    }

    /**
     * Formata como "rodada.pick", ex: pick 5 com 12 assentos → "1.05".
     */
    public static String format(int pickNumber, int seatCount) {
        return String.format(Locale.ROOT, "%d.%02d", roundForPick(pickNumber, seatCount),
                pickInRound(pickNumber, seatCount));
    }

    public static int parse(String formatted, int seatCount) {
        if (formatted == null) {
            throw new IllegalArgumentException("Pick formatado nulo");
        }
        String[] parts = formatted.trim().split("\\.");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Formato de pick inválido: " + formatted);
        }
        int round;
        int inRound;
        try {
            round = Integer.parseInt(parts[0]);
            inRound = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Formato de pick inválido: " + formatted, e);
        }
        if (round < 1 || inRound < 1 || inRound > seatCount) {
            throw new IllegalArgumentException("Pick fora da faixa: " + formatted);
        }
        return (round - 1) * seatCount + inRound;
    }

    private static void requirePositive(int pickNumber, int seatCount) {
        if (pickNumber < 1 || seatCount < 1) {
            throw new IllegalArgumentException(
                    "pickNumber e seatCount devem ser positivos: pick=" + pickNumber + ", seats=" + seatCount);
        }
    }
}
