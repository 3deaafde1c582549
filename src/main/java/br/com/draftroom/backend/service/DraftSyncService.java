package br.com.draftroom.backend.service;

import br.com.draftroom.backend.dto.DraftSnapshotDTO;
import br.com.draftroom.backend.dto.ParticipantDTO;
import br.com.draftroom.backend.dto.PickDTO;
import br.com.draftroom.backend.dto.TimerDTO;
import br.com.draftroom.backend.dto.events.DraftFeedEvent;
import br.com.draftroom.backend.service.draft.DraftRoom;
import br.com.draftroom.backend.service.draft.DraftStatus;
import br.com.draftroom.backend.service.draft.Participant;
import br.com.draftroom.backend.service.draft.Pick;
import br.com.draftroom.backend.service.draft.SnakeOrder;
import br.com.draftroom.backend.service.draft.TimerState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Camada de sincronização: snapshot completo + feed incremental.
 *
 * Publicação e inscrição acontecem com o lock da sala segurado. Quem se inscreve informando
 * o último pick que viu recebe os picks seguintes e só então entra no feed, então entre
 * snapshot e feed não há buraco nem duplicata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftSyncService {

    private final List<DraftEventPublisher> externalPublishers;

    private final Map<String, Set<DraftFeedSubscriber>> subscribersByRoom = new ConcurrentHashMap<>();

    public DraftSnapshotDTO snapshot(DraftRoom room, Instant now) {
        return room.withLock(() -> {
            int currentPick = room.getCurrentPick();
            int seatCount = room.getConfig().seatCount();
            List<PickDTO> picks = room.getPicks().stream()
                    .map(pick -> toDto(pick, seatCount))
                    .toList();
            List<ParticipantDTO> participants = room.getParticipants().stream()
                    .map(participant -> toDto(room, participant, currentPick))
                    .toList();

            return DraftSnapshotDTO.builder()
                    .roomId(room.getId())
                    .status(room.getStatus())
                    .seatCount(seatCount)
                    .rounds(room.getConfig().rounds())
                    .totalPicks(room.getConfig().totalPicks())
                    .pickClockSeconds((int) room.getConfig().pickClock().toSeconds())
                    .positionLimits(room.getConfig().positionLimits().asMap())
                    .currentPick(currentPick)
                    .lastPickNumber(currentPick - 1)
                    .onTheClockSeat(room.seatOnTheClock().orElse(null))
                    .timer(timerDto(room, now))
                    .countdownEndsAt(room.getCountdownEndsAt())
                    .participants(participants)
                    .picks(picks)
                    .generatedAt(now)
                    .build();
        });
    }

    /**
     * Inscreve no feed reenviando os picks depois de {@code lastKnownPick}.
     *
     * @return quantos picks foram reenviados
     */
    public int subscribe(DraftRoom room, DraftFeedSubscriber subscriber, int lastKnownPick) {
        return room.withLock(() -> {
            List<Pick> missed = room.picksAfter(Math.max(0, lastKnownPick));
            for (Pick pick : missed) {
                DraftFeedEvent event = pickEvent(room, pick, pick.pickNumber() + 1);
                event.setReplay(true);
                subscriber.onEvent(event);
            }
            subscribersByRoom.computeIfAbsent(room.getId(), id -> new CopyOnWriteArraySet<>()).add(subscriber);
            log.info("[Sync] {} inscrito na sala {} a partir do pick {} ({} reenviados)",
                    subscriber.subscriberId(), room.getId(), lastKnownPick, missed.size());
            return missed.size();
        });
    }

    public void unsubscribe(String roomId, DraftFeedSubscriber subscriber) {
        Set<DraftFeedSubscriber> subscribers = subscribersByRoom.get(roomId);
        if (subscribers != null && subscribers.remove(subscriber)) {
            log.debug("[Sync] {} saiu da sala {}", subscriber.subscriberId(), roomId);
        }
    }

    public void unsubscribeAll(DraftFeedSubscriber subscriber) {
        subscribersByRoom.forEach((roomId, subscribers) -> subscribers.remove(subscriber));
    }

    public int subscriberCount(String roomId) {
        Set<DraftFeedSubscriber> subscribers = subscribersByRoom.get(roomId);
        return subscribers == null ? 0 : subscribers.size();
    }

    public void publishPick(DraftRoom room, Pick pick) {
        room.withLock(() -> publish(room, pickEvent(room, pick, room.getCurrentPick())));
    }

    public void publishStateChange(DraftRoom room, Instant now) {
        room.withLock(() -> publish(room, DraftFeedEvent.builder()
                .type(DraftFeedEvent.STATE_CHANGED)
                .roomId(room.getId())
                .status(room.getStatus())
                .currentPick(room.getCurrentPick())
                .onTheClockSeat(room.seatOnTheClock().orElse(null))
                .timer(timerDto(room, now))
                .countdownEndsAt(room.getCountdownEndsAt())
                .timestamp(now)
                .build()));
    }

    public void publishTimerTick(DraftRoom room, Instant now) {
        room.withLock(() -> {
            TimerDTO timer = timerDto(room, now);
            if (timer == null) {
                return;
            }
            publishLocal(room, DraftFeedEvent.builder()
                    .type(DraftFeedEvent.TIMER_TICK)
                    .roomId(room.getId())
                    .status(room.getStatus())
                    .currentPick(room.getCurrentPick())
                    .onTheClockSeat(timer.getSeatIndex())
                    .timer(timer)
                    .timestamp(now)
                    .build());
        });
    }

    public void publishQueueUpdate(DraftRoom room, int seatIndex, List<String> queue, Instant now) {
        room.withLock(() -> publishLocal(room, DraftFeedEvent.builder()
                .type(DraftFeedEvent.QUEUE_UPDATED)
                .roomId(room.getId())
                .seatIndex(seatIndex)
                .queue(queue)
                .timestamp(now)
                .build()));
    }

    /**
     * Sala encerrada: ninguém mais precisa do feed.
     */
    public void closeRoom(String roomId) {
        Set<DraftFeedSubscriber> removed = subscribersByRoom.remove(roomId);
        if (removed != null) {
            log.info("[Sync] Feed da sala {} encerrado ({} inscritos)", roomId, removed.size());
        }
    }

    private void publish(DraftRoom room, DraftFeedEvent event) {
        publishLocal(room, event);
        for (DraftEventPublisher publisher : externalPublishers) {
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                log.error("❌ [Sync] Publicador externo falhou para {} na sala {}", event.getType(), room.getId(), e);
            }
        }
    }

    // Ticks e filas ficam só nos clientes conectados a esta instância
    private void publishLocal(DraftRoom room, DraftFeedEvent event) {
        Set<DraftFeedSubscriber> subscribers = subscribersByRoom.get(room.getId());
        if (subscribers == null) {
            return;
        }
        for (DraftFeedSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(event);
            } catch (RuntimeException e) {
                log.error("❌ [Sync] Falha ao entregar {} para {}; removendo inscrição", event.getType(),
                        subscriber.subscriberId(), e);
                subscribers.remove(subscriber);
            }
        }
    }

    private DraftFeedEvent pickEvent(DraftRoom room, Pick pick, int currentPickAfter) {
        int seatCount = room.getConfig().seatCount();
        boolean complete = currentPickAfter > room.getConfig().totalPicks();
        return DraftFeedEvent.builder()
                .type(DraftFeedEvent.PICK_COMMITTED)
                .roomId(room.getId())
                .status(complete ? DraftStatus.COMPLETE : room.getStatus())
                .pick(toDto(pick, seatCount))
                .currentPick(currentPickAfter)
                .onTheClockSeat(complete ? null : SnakeOrder.seatForPick(currentPickAfter, seatCount))
                .replay(false)
                .timestamp(pick.committedAt())
                .build();
    }

    private TimerDTO timerDto(DraftRoom room, Instant now) {
        TimerState timer = room.getTimer();
        if (timer == null || room.getStatus() != DraftStatus.ACTIVE) {
            return null;
        }
        return TimerDTO.builder()
                .pickNumber(timer.pickNumber())
                .seatIndex(timer.seatIndex())
                .deadline(timer.deadline())
                .remainingSeconds(timer.remainingSeconds(now))
                .build();
    }

    private PickDTO toDto(Pick pick, int seatCount) {
        return PickDTO.from(pick, SnakeOrder.format(pick.pickNumber(), seatCount));
    }

    private ParticipantDTO toDto(DraftRoom room, Participant participant, int currentPick) {
        return ParticipantDTO.builder()
                .id(participant.getId())
                .seatIndex(participant.getSeatIndex())
                .bot(participant.isBot())
                .ready(participant.isReady())
                .roster(participant.rosterView())
                .autodraftLimits(participant.autodraftOverrides().map(l -> l.asMap()).orElse(null))
                .nextPickNumber(SnakeOrder.nextPickForSeat(participant.getSeatIndex(), currentPick,
                        room.getConfig().seatCount(), room.getConfig().rounds()))
                .build();
    }
}
