package br.com.draftroom.backend.service.draft;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Arena de uma sala de draft.
 *
 * Cada sala é uma unidade de concorrência independente: todo estado mutável fica aqui e
 * só é alterado com {@link #withLock} segurado. O log de picks é a fonte da verdade;
 * {@code currentPick}, rosters e jogadores draftados derivam dele.
 */
public class DraftRoom {

    @Getter
    private final String id;
    @Getter
    private final DraftRoomConfig config;
    @Getter
    private final Instant createdAt;

    private final List<Participant> participants;
    private final List<Pick> picks = new ArrayList<>();
    private final Set<String> draftedPlayerIds = new HashSet<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Getter
    private volatile DraftStatus status;
    @Getter
    private volatile TimerState timer;
    @Getter
    private volatile Instant countdownEndsAt;

    public DraftRoom(String id, DraftRoomConfig config, List<Participant> participants, Instant createdAt) {
        if (participants.size() != config.seatCount()) {
            throw new IllegalArgumentException("Sala " + id + ": " + participants.size()
                    + " participantes para " + config.seatCount() + " assentos");
        }
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).getSeatIndex() != i) {
                throw new IllegalArgumentException("Sala " + id + ": assento fora de ordem no índice " + i);
            }
        }
        this.id = id;
        this.config = config;
        this.participants = List.copyOf(participants);
        this.createdAt = createdAt;
        this.status = DraftStatus.WAITING;
    }

    /**
     * Reconstrói uma sala a partir da configuração e do log de picks persistido.
     * O log precisa ser contíguo a partir de 1 e sem jogador repetido.
     */
    public static DraftRoom restore(String id, DraftRoomConfig config, List<Participant> participants,
            Instant createdAt, DraftStatus persistedStatus, List<Pick> log) {
        DraftRoom room = new DraftRoom(id, config, participants, createdAt);
        log.stream()
                .sorted((a, b) -> Integer.compare(a.pickNumber(), b.pickNumber()))
                .forEach(room::appendPick);
        room.status = room.isComplete() ? DraftStatus.COMPLETE : persistedStatus;
        return room;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public int getCurrentPick() {
        return withLock(() -> picks.size() + 1);
    }

    public boolean isComplete() {
        return getCurrentPick() > config.totalPicks();
    }

    /**
     * @return assento no relógio, ou vazio se o draft terminou
     */
    public Optional<Integer> seatOnTheClock() {
        int current = getCurrentPick();
        if (current > config.totalPicks()) {
            return Optional.empty();
        }
        return Optional.of(SnakeOrder.seatForPick(current, config.seatCount()));
    }

    public List<Participant> getParticipants() {
        return participants;
    }

    public Participant participant(int seatIndex) {
        if (seatIndex < 0 || seatIndex >= participants.size()) {
            throw new IllegalArgumentException("Assento inválido " + seatIndex + " na sala " + id);
        }
        return participants.get(seatIndex);
    }

    public List<Pick> getPicks() {
        return withLock(() -> List.copyOf(picks));
    }

    public List<Pick> picksAfter(int pickNumber) {
        return withLock(() -> {
            int from = Math.max(0, Math.min(pickNumber, picks.size()));
            return List.copyOf(picks.subList(from, picks.size()));
        });
    }

    public Optional<Pick> lastPick() {
        return withLock(() -> picks.isEmpty() ? Optional.<Pick>empty() : Optional.of(picks.get(picks.size() - 1)));
    }

    public boolean isDrafted(String playerId) {
        return withLock(() -> draftedPlayerIds.contains(playerId));
    }

    public Set<String> draftedPlayerIds() {
        return withLock(() -> Collections.unmodifiableSet(new HashSet<>(draftedPlayerIds)));
    }

    void appendPick(Pick pick) {
        withLock(() -> {
            int expected = picks.size() + 1;
            if (pick.pickNumber() != expected) {
                throw new IllegalStateException("Sala " + id + ": pick " + pick.pickNumber()
                        + " fora de sequência, esperado " + expected);
            }
            if (!draftedPlayerIds.add(pick.playerId())) {
                throw new IllegalStateException("Sala " + id + ": jogador " + pick.playerId() + " já draftado");
            }
            picks.add(pick);
            participants.get(pick.seatIndex()).addToRoster(pick.position(), pick.playerId());
            // Jogador sai da fila de todo mundo assim que é commitado
            participants.forEach(p -> p.removeFromQueue(pick.playerId()));
        });
    }

    void setStatus(DraftStatus status) {
        this.status = status;
    }

    void setTimer(TimerState timer) {
        this.timer = timer;
    }

    void setCountdownEndsAt(Instant countdownEndsAt) {
        this.countdownEndsAt = countdownEndsAt;
    }
}
