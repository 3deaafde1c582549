package br.com.draftroom.backend.service.draft;

import br.com.draftroom.backend.support.InMemoryPlayerCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TurnSchedulerTest {

    private DraftEngineFixture engine;
    private TurnScheduler scheduler;

    @BeforeEach
    void setup() {
        engine = new DraftEngineFixture(InMemoryPlayerCatalog.balanced(10));
        scheduler = engine.turnScheduler;
    }

    @Test
    void timerCoversCurrentPickWithDeadlineAndGrace() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(4, 2, Map.of()));
        Instant start = engine.clock.instant();

        TimerState timer = room.getTimer();

        assertThat(timer.pickNumber()).isEqualTo(1);
        assertThat(timer.seatIndex()).isZero();
        assertThat(timer.deadline()).isEqualTo(start.plusSeconds(30));
        assertThat(timer.graceEnd()).isEqualTo(start.plusSeconds(32));
        assertThat(timer.remainingSeconds(start)).isEqualTo(30);
        assertThat(timer.expired()).isFalse();
    }

    @Test
    void notExpiredBeforeGraceEnds() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(4, 2, Map.of()));
        Instant start = engine.clock.instant();

        assertThat(scheduler.claimExpired(room, start.plusSeconds(30))).isEmpty();
        assertThat(scheduler.claimExpired(room, start.plusMillis(31_999))).isEmpty();
        assertThat(room.getTimer().remainingSeconds(start.plusSeconds(31))).isZero();

        assertThat(scheduler.claimExpired(room, start.plusSeconds(32))).isPresent();
    }

    @Test
    void expiryIsClaimedOnlyOnce() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(4, 2, Map.of()));
        Instant late = engine.clock.instant().plusSeconds(40);

        TimerState claimed = scheduler.claimExpired(room, late).orElseThrow();

        assertThat(claimed.expired()).isTrue();
        assertThat(claimed.pickNumber()).isEqualTo(1);
        assertThat(room.getTimer().expired()).isTrue();
        assertThat(scheduler.claimExpired(room, late.plusSeconds(5))).isEmpty();
    }

    @Test
    void timerFromPreviousPickIsNeverClaimed() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(4, 2, Map.of()));
        TimerState stale = room.getTimer();

        // commit sem reiniciar o relógio: o timer ainda aponta para o pick 1
        engine.arbiter.attemptCommit(room, 1, 0, "QB-01", PickOrigin.MANUAL);

        assertThat(room.getTimer()).isEqualTo(stale);
        assertThat(scheduler.claimExpired(room, engine.clock.instant().plusSeconds(60))).isEmpty();
    }

    @Test
    void pausedRoomDoesNotExpire() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(4, 2, Map.of()));
        engine.stateMachine.pause(room);

        assertThat(room.getTimer()).isNull();
        assertThat(scheduler.claimExpired(room, engine.clock.instant().plusSeconds(120))).isEmpty();
    }

    @Test
    void botSeatIsClaimedWithoutWaitingForClock() {
        List<Participant> seats = new ArrayList<>();
        seats.add(new Participant("bot-0", 0, true, null));
        seats.add(new Participant("bot-1", 1, true, null));
        DraftRoom room = engine.activate(new DraftRoom("bots", DraftEngineFixture.config(2, 1, Map.of()), seats,
                engine.clock.instant()));

        assertThat(room.getStatus()).isEqualTo(DraftStatus.ACTIVE);
        assertThat(scheduler.claimExpired(room, engine.clock.instant())).isPresent();
    }

    @Test
    void botDelayIsHonoured() {
        engine.properties.getEngine().setBotPickDelayMs(1500);
        List<Participant> seats = List.of(new Participant("bot-0", 0, true, null),
                new Participant("team-1", 1, false, null));
        DraftRoom room = new DraftRoom("mixed", DraftEngineFixture.config(2, 1, Map.of()), seats,
                engine.clock.instant());
        engine.activate(room);
        Instant start = engine.clock.instant();

        assertThat(scheduler.claimExpired(room, start.plusMillis(1499))).isEmpty();
        assertThat(scheduler.claimExpired(room, start.plus(Duration.ofMillis(1500)))).isPresent();
    }

    @Test
    void cancelClearsTimer() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(4, 2, Map.of()));

        scheduler.cancel(room);

        assertThat(room.getTimer()).isNull();
    }
}
