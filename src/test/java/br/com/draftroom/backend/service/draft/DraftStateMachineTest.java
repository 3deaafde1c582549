package br.com.draftroom.backend.service.draft;

import br.com.draftroom.backend.support.InMemoryPlayerCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DraftStateMachineTest {

    private DraftEngineFixture engine;
    private DraftStateMachine stateMachine;

    @BeforeEach
    void setup() {
        engine = new DraftEngineFixture(InMemoryPlayerCatalog.balanced(10));
        stateMachine = engine.stateMachine;
    }

    @Test
    void countdownStartsOnlyWhenEverySeatIsReady() {
        DraftRoomConfig config = new DraftRoomConfig(3, 2, Duration.ofSeconds(30), Duration.ofSeconds(2),
                Duration.ofSeconds(10), PositionLimits.unlimited());
        DraftRoom room = engine.waitingRoom(config);
        Instant now = engine.clock.instant();

        assertThat(stateMachine.markSeatReady(room, 0, now)).isFalse();
        assertThat(stateMachine.markSeatReady(room, 1, now)).isFalse();
        assertThat(room.getStatus()).isEqualTo(DraftStatus.WAITING);

        assertThat(stateMachine.markSeatReady(room, 2, now)).isTrue();
        assertThat(room.getStatus()).isEqualTo(DraftStatus.COUNTDOWN);
        assertThat(room.getCountdownEndsAt()).isEqualTo(now.plusSeconds(10));

        assertThat(stateMachine.activateIfCountdownElapsed(room, now.plusSeconds(9))).isFalse();
        assertThat(stateMachine.activateIfCountdownElapsed(room, now.plusSeconds(10))).isTrue();
        assertThat(room.getStatus()).isEqualTo(DraftStatus.ACTIVE);
        assertThat(room.getCountdownEndsAt()).isNull();
        assertThat(room.getTimer().pickNumber()).isEqualTo(1);
        assertThat(room.getTimer().startedAt()).isEqualTo(now.plusSeconds(10));
    }

    @Test
    void readyOutsideWaitingIsIgnored() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(2, 1, Map.of()));

        assertThat(stateMachine.markSeatReady(room, 0, engine.clock.instant())).isFalse();
        assertThat(room.getStatus()).isEqualTo(DraftStatus.ACTIVE);
    }

    @Test
    void resumeGivesFullClockForSamePick() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(2, 2, Map.of()));
        engine.pickCurrent(room, "QB-01");
        engine.clock.advanceSeconds(25);

        stateMachine.pause(room);
        assertThat(room.getStatus()).isEqualTo(DraftStatus.PAUSED);
        assertThat(room.getTimer()).isNull();

        engine.clock.advanceSeconds(300);
        Instant resumedAt = engine.clock.instant();
        stateMachine.resume(room, resumedAt);

        assertThat(room.getStatus()).isEqualTo(DraftStatus.ACTIVE);
        assertThat(room.getCurrentPick()).isEqualTo(2);
        assertThat(room.getTimer().pickNumber()).isEqualTo(2);
        assertThat(room.getTimer().deadline()).isEqualTo(resumedAt.plusSeconds(30));
    }

    @Test
    void invalidTransitionsThrowAndKeepState() {
        DraftRoom waiting = engine.waitingRoom(DraftEngineFixture.config(2, 1, Map.of()));

        assertThatThrownBy(() -> stateMachine.pause(waiting)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> stateMachine.resume(waiting, engine.clock.instant()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(waiting.getStatus()).isEqualTo(DraftStatus.WAITING);

        DraftRoom active = engine.activeRoom(DraftEngineFixture.config(2, 1, Map.of()));
        assertThatThrownBy(() -> stateMachine.resume(active, engine.clock.instant()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(active.getStatus()).isEqualTo(DraftStatus.ACTIVE);
    }

    @Test
    void lastCommitCompletesDraftAndStopsClock() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(2, 2, Map.of()));

        engine.pickCurrent(room, "QB-01");
        engine.pickCurrent(room, "RB-01");
        engine.pickCurrent(room, "WR-01");
        assertThat(room.getStatus()).isEqualTo(DraftStatus.ACTIVE);

        engine.pickCurrent(room, "TE-01");

        assertThat(room.getStatus()).isEqualTo(DraftStatus.COMPLETE);
        assertThat(room.getTimer()).isNull();
        assertThat(room.seatOnTheClock()).isEmpty();
        assertThatThrownBy(() -> stateMachine.pause(room)).isInstanceOf(IllegalStateException.class);
        assertThat(engine.arbiter.attemptCommit(room, 5, 0, "QB-02", PickOrigin.MANUAL).isCommitted()).isFalse();
    }

    @Test
    void restartClockAfterRecovery() {
        DraftRoom room = engine.activeRoom(DraftEngineFixture.config(2, 2, Map.of()));
        engine.clock.advanceSeconds(20);

        stateMachine.restartClock(room, engine.clock.instant());

        assertThat(room.getTimer().deadline()).isEqualTo(engine.clock.instant().plusSeconds(30));
    }
}
