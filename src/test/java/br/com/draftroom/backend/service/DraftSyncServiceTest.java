package br.com.draftroom.backend.service;

import br.com.draftroom.backend.config.properties.DraftEngineProperties;
import br.com.draftroom.backend.dto.DraftSnapshotDTO;
import br.com.draftroom.backend.dto.events.DraftFeedEvent;
import br.com.draftroom.backend.service.draft.CommitResult;
import br.com.draftroom.backend.service.draft.DraftRoom;
import br.com.draftroom.backend.service.draft.DraftRoomConfig;
import br.com.draftroom.backend.service.draft.DraftStateMachine;
import br.com.draftroom.backend.service.draft.DraftStatus;
import br.com.draftroom.backend.service.draft.Participant;
import br.com.draftroom.backend.service.draft.PickCommitArbiter;
import br.com.draftroom.backend.service.draft.PickOrigin;
import br.com.draftroom.backend.service.draft.PositionLimits;
import br.com.draftroom.backend.service.draft.RosterRulesEvaluator;
import br.com.draftroom.backend.service.draft.SnakeOrder;
import br.com.draftroom.backend.service.draft.TurnScheduler;
import br.com.draftroom.backend.support.InMemoryPlayerCatalog;
import br.com.draftroom.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class DraftSyncServiceTest {

    private MutableClock clock;
    private InMemoryPlayerCatalog catalog;
    private PickCommitArbiter arbiter;
    private DraftStateMachine stateMachine;
    private DraftEventPublisher externalPublisher;
    private DraftSyncService syncService;
    private DraftRoom room;

    @BeforeEach
    void setup() {
        clock = MutableClock.startingAt("2024-09-01T18:00:00Z");
        catalog = InMemoryPlayerCatalog.balanced(30);
        arbiter = new PickCommitArbiter(new RosterRulesEvaluator(), catalog, (roomId, pick) -> {
        }, clock);
        stateMachine = new DraftStateMachine(new TurnScheduler(new DraftEngineProperties()));
        externalPublisher = mock(DraftEventPublisher.class);
        syncService = new DraftSyncService(List.of(externalPublisher));

        DraftRoomConfig config = new DraftRoomConfig(4, 20, Duration.ofSeconds(30), Duration.ofSeconds(2),
                Duration.ZERO, PositionLimits.unlimited());
        List<Participant> participants = new ArrayList<>();
        for (int seat = 0; seat < 4; seat++) {
            participants.add(new Participant("team-" + seat, seat, false, null));
        }
        room = new DraftRoom("room-sync", config, participants, clock.instant());
        for (int seat = 0; seat < 4; seat++) {
            stateMachine.markSeatReady(room, seat, clock.instant());
        }
        stateMachine.activateIfCountdownElapsed(room, clock.instant());
    }

    @Test
    void reconnectReceivesMissedPicksThenLiveFeedWithoutDuplicates() {
        // given: cliente tirou snapshot no pick 50 e caiu
        for (int i = 0; i < 50; i++) {
            commitNext();
        }
        DraftSnapshotDTO snapshot = syncService.snapshot(room, clock.instant());
        assertThat(snapshot.getLastPickNumber()).isEqualTo(50);
        assertThat(snapshot.getPicks()).hasSize(50);

        commitNext();
        commitNext();
        commitNext();

        // act
        RecordingSubscriber client = new RecordingSubscriber("cliente-1");
        int replayed = syncService.subscribe(room, client, snapshot.getLastPickNumber());
        commitNext();

        // assert
        assertThat(replayed).isEqualTo(3);
        assertThat(client.pickNumbers()).containsExactly(51, 52, 53, 54);
        assertThat(client.pickEvents()).extracting(DraftFeedEvent::getReplay)
                .containsExactly(true, true, true, false);
        assertThat(client.pickEvents().get(3).getCurrentPick()).isEqualTo(55);
    }

    @Test
    void subscribingWhilePicksAreCommittedKeepsFeedContiguous() throws Exception {
        for (int i = 0; i < 10; i++) {
            commitNext();
        }
        CountDownLatch started = new CountDownLatch(1);
        Thread committer = new Thread(() -> {
            started.countDown();
            for (int i = 0; i < 40; i++) {
                commitNext();
            }
        });
        committer.start();
        started.await(5, TimeUnit.SECONDS);

        DraftSnapshotDTO snapshot = syncService.snapshot(room, clock.instant());
        RecordingSubscriber client = new RecordingSubscriber("cliente-2");
        syncService.subscribe(room, client, snapshot.getLastPickNumber());
        committer.join(10_000);

        List<Integer> expected = new ArrayList<>();
        for (int pick = snapshot.getLastPickNumber() + 1; pick <= 50; pick++) {
            expected.add(pick);
        }
        assertThat(client.pickNumbers()).containsExactlyElementsOf(expected);
    }

    @Test
    void snapshotDescribesClockAndRosters() {
        commitNext();
        commitNext();
        clock.advanceSeconds(12);

        DraftSnapshotDTO snapshot = syncService.snapshot(room, clock.instant());

        assertThat(snapshot.getStatus()).isEqualTo(DraftStatus.ACTIVE);
        assertThat(snapshot.getTotalPicks()).isEqualTo(80);
        assertThat(snapshot.getCurrentPick()).isEqualTo(3);
        assertThat(snapshot.getOnTheClockSeat()).isEqualTo(2);
        assertThat(snapshot.getTimer().getPickNumber()).isEqualTo(3);
        assertThat(snapshot.getTimer().getRemainingSeconds()).isEqualTo(18);
        assertThat(snapshot.getPicks()).extracting("label").containsExactly("1.01", "1.02");
        assertThat(snapshot.getParticipants().get(0).getRoster()).containsEntry("QB", List.of("QB-01"));
        assertThat(snapshot.getParticipants().get(0).getNextPickNumber()).isEqualTo(8);
    }

    @Test
    void failingSubscriberIsDroppedWithoutAffectingOthers() {
        RecordingSubscriber healthy = new RecordingSubscriber("saudavel");
        DraftFeedSubscriber broken = mock(DraftFeedSubscriber.class);
        when(broken.subscriberId()).thenReturn("quebrado");
        syncService.subscribe(room, healthy, 0);
        syncService.subscribe(room, broken, 0);
        doThrow(new IllegalStateException("socket fechado")).when(broken).onEvent(any());

        commitNext();
        commitNext();

        assertThat(healthy.pickNumbers()).containsExactly(1, 2);
        assertThat(syncService.subscriberCount(room.getId())).isEqualTo(1);
        verify(broken, times(1)).onEvent(any());
    }

    @Test
    void externalPublisherGetsPicksAndStateButNotTicks() {
        doThrow(new IllegalStateException("redis fora")).when(externalPublisher)
                .publish(argThat(DraftFeedEvent::isPickCommitted));
        RecordingSubscriber client = new RecordingSubscriber("local");
        syncService.subscribe(room, client, 0);

        commitNext();
        syncService.publishTimerTick(room, clock.instant());
        syncService.publishStateChange(room, clock.instant());

        verify(externalPublisher, times(2)).publish(any());
        verify(externalPublisher, never()).publish(argThat(event -> DraftFeedEvent.TIMER_TICK.equals(event.getType())));
        assertThat(client.events).extracting(DraftFeedEvent::getType)
                .containsExactly(DraftFeedEvent.PICK_COMMITTED, DraftFeedEvent.TIMER_TICK, DraftFeedEvent.STATE_CHANGED);
    }

    @Test
    void closedRoomDropsSubscribers() {
        RecordingSubscriber client = new RecordingSubscriber("cliente");
        syncService.subscribe(room, client, 0);

        syncService.closeRoom(room.getId());
        commitNext();

        assertThat(syncService.subscriberCount(room.getId())).isZero();
        assertThat(client.events).isEmpty();
    }

    private void commitNext() {
        room.withLock(() -> {
            int pickNumber = room.getCurrentPick();
            int seat = SnakeOrder.seatForPick(pickNumber, room.getConfig().seatCount());
            String playerId = catalog.listAll().get(pickNumber - 1).id();
            CommitResult result = arbiter.attemptCommit(room, pickNumber, seat, playerId, PickOrigin.MANUAL);
            assertThat(result.isCommitted()).isTrue();
            stateMachine.afterCommit(room, clock.instant());
            syncService.publishPick(room, result.pick());
        });
    }

    static class RecordingSubscriber implements DraftFeedSubscriber {
        private final String id;
        final List<DraftFeedEvent> events = new CopyOnWriteArrayList<>();

        RecordingSubscriber(String id) {
            this.id = id;
        }

        @Override
        public String subscriberId() {
            return id;
        }

        @Override
        public void onEvent(DraftFeedEvent event) {
            events.add(event);
        }

        List<DraftFeedEvent> pickEvents() {
            return events.stream().filter(DraftFeedEvent::isPickCommitted).toList();
        }

        List<Integer> pickNumbers() {
            return pickEvents().stream().map(event -> event.getPick().getPickNumber()).toList();
        }
    }
}
