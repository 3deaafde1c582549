package br.com.draftroom.backend.service.draft;

import br.com.draftroom.backend.exception.InvalidDraftCommandException;
import br.com.draftroom.backend.support.InMemoryPlayerCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueManagerTest {

    private DraftEngineFixture engine;
    private QueueManager queueManager;
    private DraftRoom room;

    @BeforeEach
    void setup() {
        engine = new DraftEngineFixture(InMemoryPlayerCatalog.balanced(10));
        queueManager = engine.queueManager;
        room = engine.activeRoom(DraftEngineFixture.config(4, 3, Map.of("QB", 1)));
    }

    @Test
    void nextValidCandidateSkipsDraftedAndIllegalEntries() {
        AvailablePool pool = AvailablePool.of(engine.catalog.listAll(), Set.of("RB-01"));
        Map<String, List<String>> roster = Map.of("QB", List.of("QB-09"));
        List<String> queue = List.of("RB-01", "QB-02", "WR-03");

        Optional<String> candidate = queueManager.nextValidCandidate(queue, pool, roster,
                PositionLimits.of(Map.of("QB", 1)));

        assertThat(candidate).contains("WR-03");
        // leitura não altera a fila
        assertThat(queue).containsExactly("RB-01", "QB-02", "WR-03");
    }

    @Test
    void nextValidCandidateIsEmptyWhenNothingFits() {
        AvailablePool pool = AvailablePool.of(engine.catalog.listAll(), Set.of());
        Optional<String> candidate = queueManager.nextValidCandidate(List.of("QB-01", "unknown"), pool,
                Map.of("QB", List.of("QB-09")), PositionLimits.of(Map.of("QB", 1)));
        assertThat(candidate).isEmpty();
    }

    @Test
    void replaceQueueDropsUnknownDraftedAndDuplicates() {
        engine.pickCurrent(room, "WR-01");

        List<String> queue = queueManager.replaceQueue(room, 1,
                Arrays.asList("RB-02", "nope", "WR-01", "RB-02", null, "TE-04"));

        assertThat(queue).containsExactly("RB-02", "TE-04");
        assertThat(room.participant(1).queueView()).containsExactly("RB-02", "TE-04");
    }

    @Test
    void appendRejectsUnknownOrDraftedPlayer() {
        engine.pickCurrent(room, "WR-01");

        assertThatThrownBy(() -> queueManager.append(room, 1, "nope"))
                .isInstanceOf(InvalidDraftCommandException.class);
        assertThatThrownBy(() -> queueManager.append(room, 1, "WR-01"))
                .isInstanceOf(InvalidDraftCommandException.class);
    }

    @Test
    void appendIsIdempotent() {
        queueManager.append(room, 2, "RB-03");
        List<String> queue = queueManager.append(room, 2, "RB-03");
        assertThat(queue).containsExactly("RB-03");
    }

    @Test
    void moveAndRemove() {
        queueManager.replaceQueue(room, 0, List.of("QB-01", "RB-01", "WR-01", "TE-01"));

        assertThat(queueManager.move(room, 0, "TE-01", 0)).containsExactly("TE-01", "QB-01", "RB-01", "WR-01");
        assertThat(queueManager.move(room, 0, "TE-01", 99)).containsExactly("QB-01", "RB-01", "WR-01", "TE-01");
        assertThat(queueManager.remove(room, 0, "RB-01")).containsExactly("QB-01", "WR-01", "TE-01");
        assertThatThrownBy(() -> queueManager.move(room, 0, "RB-01", 0))
                .isInstanceOf(InvalidDraftCommandException.class);
    }

    @Test
    void committedPlayerLeavesEveryQueue() {
        queueManager.replaceQueue(room, 1, List.of("QB-01", "RB-01"));
        queueManager.replaceQueue(room, 2, List.of("RB-01", "QB-01"));

        engine.pickCurrent(room, "QB-01");

        assertThat(room.participant(1).queueView()).containsExactly("RB-01");
        assertThat(room.participant(2).queueView()).containsExactly("RB-01");
    }

    @Test
    void invalidSeatIsRejected() {
        assertThatThrownBy(() -> queueManager.replaceQueue(room, 7, List.of()))
                .isInstanceOf(InvalidDraftCommandException.class);
    }
}
