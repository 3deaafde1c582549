package br.com.draftroom.backend.service;

import br.com.draftroom.backend.domain.entity.DraftPickEntity;
import br.com.draftroom.backend.domain.entity.DraftRoomEntity;
import br.com.draftroom.backend.domain.entity.DraftSeatEntity;
import br.com.draftroom.backend.domain.repository.DraftPickRepository;
import br.com.draftroom.backend.domain.repository.DraftRoomRepository;
import br.com.draftroom.backend.domain.repository.DraftSeatRepository;
import br.com.draftroom.backend.service.draft.DraftRoom;
import br.com.draftroom.backend.service.draft.DraftRoomConfig;
import br.com.draftroom.backend.service.draft.DraftStatus;
import br.com.draftroom.backend.service.draft.Participant;
import br.com.draftroom.backend.service.draft.Pick;
import br.com.draftroom.backend.service.draft.PickJournal;
import br.com.draftroom.backend.service.draft.PickOrigin;
import br.com.draftroom.backend.service.draft.PositionLimits;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Estado persistido de cada sala: configuração, assentos (fila e overrides) e o log de picks.
 *
 * Rosters e pool não são gravados; saem do replay do log em {@link #loadRoom}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftPersistenceService implements PickJournal {

    private static final TypeReference<List<String>> QUEUE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Integer>> LIMITS_TYPE = new TypeReference<>() {
    };

    private final DraftRoomRepository draftRoomRepository;
    private final DraftSeatRepository draftSeatRepository;
    private final DraftPickRepository draftPickRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public void saveNewRoom(DraftRoom room) {
        DraftRoomConfig config = room.getConfig();
        draftRoomRepository.save(DraftRoomEntity.builder()
                .id(room.getId())
                .seatCount(config.seatCount())
                .rounds(config.rounds())
                .pickClockSeconds((int) config.pickClock().toSeconds())
                .gracePeriodSeconds((int) config.gracePeriod().toSeconds())
                .countdownSeconds((int) config.countdown().toSeconds())
                .positionLimitsJson(toJson(config.positionLimits().asMap()))
                .status(room.getStatus().name())
                .currentPick(room.getCurrentPick())
                .createdAt(room.getCreatedAt())
                .build());

        List<DraftSeatEntity> seats = new ArrayList<>();
        for (Participant participant : room.getParticipants()) {
            seats.add(DraftSeatEntity.builder()
                    .roomId(room.getId())
                    .seatIndex(participant.getSeatIndex())
                    .participantId(participant.getId())
                    .bot(participant.isBot())
                    .ready(participant.isReady())
                    .queueJson(toJson(participant.queueView()))
                    .autodraftLimitsJson(participant.autodraftOverrides()
                            .map(limits -> toJson(limits.asMap()))
                            .orElse(null))
                    .build());
        }
        draftSeatRepository.saveAll(seats);
        log.info("💾 [Persistence] Sala {} salva com {} assentos", room.getId(), seats.size());
    }

    /**
     * Grava o pick com flush imediato: as unique constraints do banco precisam falhar aqui,
     * antes do pick ser aplicado em memória.
     */
    @Override
    @Transactional
    public void appendPick(String roomId, Pick pick) {
        draftPickRepository.saveAndFlush(DraftPickEntity.builder()
                .roomId(roomId)
                .pickNumber(pick.pickNumber())
                .round(pick.round())
                .pickInRound(pick.pickInRound())
                .seatIndex(pick.seatIndex())
                .participantId(pick.participantId())
                .playerId(pick.playerId())
                .position(pick.position())
                .origin(pick.origin().getWireValue())
                .committedAt(pick.committedAt())
                .rosterAtPickJson(toJson(pick.rosterAtPick()))
                .build());

        draftRoomRepository.findById(roomId).ifPresent(entity -> {
            entity.setCurrentPick(pick.pickNumber() + 1);
            draftRoomRepository.save(entity);
        });
    }

    @Transactional
    public void updateStatus(DraftRoom room) {
        DraftRoomEntity entity = draftRoomRepository.findById(room.getId())
                .orElseThrow(() -> new IllegalStateException("Sala " + room.getId() + " não persistida"));
        entity.setStatus(room.getStatus().name());
        entity.setCurrentPick(room.getCurrentPick());
        draftRoomRepository.save(entity);
    }

    @Transactional
    public void saveQueue(String roomId, int seatIndex, List<String> queue) {
        DraftSeatEntity seat = requireSeat(roomId, seatIndex);
        seat.setQueueJson(toJson(queue));
        draftSeatRepository.save(seat);
    }

    /**
     * Picks removem o jogador da fila de todos; grava as filas que mudaram.
     */
    @Transactional
    public void syncQueues(DraftRoom room) {
        for (DraftSeatEntity seat : draftSeatRepository.findByRoomIdOrderBySeatIndexAsc(room.getId())) {
            String current = toJson(room.participant(seat.getSeatIndex()).queueView());
            if (!current.equals(seat.getQueueJson())) {
                seat.setQueueJson(current);
                draftSeatRepository.save(seat);
            }
        }
    }

    @Transactional
    public void saveReady(String roomId, int seatIndex) {
        DraftSeatEntity seat = requireSeat(roomId, seatIndex);
        seat.setReady(true);
        draftSeatRepository.save(seat);
    }

    /**
     * Todas as salas não terminais, reconstruídas a partir da configuração e do log.
     */
    @Transactional(readOnly = true)
    public List<DraftRoom> loadRecoverableRooms() {
        List<String> statuses = EnumSet.complementOf(EnumSet.of(DraftStatus.COMPLETE)).stream()
                .map(Enum::name)
                .toList();
        List<DraftRoom> rooms = new ArrayList<>();
        for (DraftRoomEntity entity : draftRoomRepository.findByStatusIn(statuses)) {
            try {
                rooms.add(rebuild(entity));
            } catch (RuntimeException e) {
                log.error("❌ [Persistence] Sala {} não pôde ser reconstruída", entity.getId(), e);
            }
        }
        return rooms;
    }

    @Transactional(readOnly = true)
    public Optional<DraftRoom> loadRoom(String roomId) {
        return draftRoomRepository.findById(roomId).map(this::rebuild);
    }

    private DraftRoom rebuild(DraftRoomEntity entity) {
        DraftRoomConfig config = new DraftRoomConfig(
                entity.getSeatCount(),
                entity.getRounds(),
                Duration.ofSeconds(entity.getPickClockSeconds()),
                Duration.ofSeconds(entity.getGracePeriodSeconds()),
                Duration.ofSeconds(entity.getCountdownSeconds()),
                PositionLimits.of(fromJson(entity.getPositionLimitsJson(), LIMITS_TYPE, Map.of())));

        List<Participant> participants = draftSeatRepository.findByRoomIdOrderBySeatIndexAsc(entity.getId())
                .stream()
                .map(seat -> Participant.restore(
                        seat.getParticipantId(),
                        seat.getSeatIndex(),
                        Boolean.TRUE.equals(seat.getBot()),
                        seat.getAutodraftLimitsJson() == null ? null
                                : PositionLimits.of(fromJson(seat.getAutodraftLimitsJson(), LIMITS_TYPE, Map.of())),
                        Boolean.TRUE.equals(seat.getReady()),
                        fromJson(seat.getQueueJson(), QUEUE_TYPE, List.of())))
                .toList();

        List<Pick> pickLog = draftPickRepository.findByRoomIdOrderByPickNumberAsc(entity.getId()).stream()
                .map(this::toPick)
                .toList();

        return DraftRoom.restore(entity.getId(), config, participants, entity.getCreatedAt(),
                DraftStatus.valueOf(entity.getStatus()), pickLog);
    }

    private Pick toPick(DraftPickEntity entity) {
        return new Pick(
                entity.getPickNumber(),
                entity.getRound(),
                entity.getPickInRound(),
                entity.getSeatIndex(),
                entity.getParticipantId(),
                entity.getPlayerId(),
                entity.getPosition(),
                PickOrigin.fromWireValue(entity.getOrigin()),
                entity.getCommittedAt(),
                fromJson(entity.getRosterAtPickJson(), LIMITS_TYPE, Map.of()));
    }

    private DraftSeatEntity requireSeat(String roomId, int seatIndex) {
        return draftSeatRepository.findByRoomIdAndSeatIndex(roomId, seatIndex)
                .orElseThrow(() -> new IllegalStateException("Assento " + seatIndex + " da sala " + roomId
                        + " não persistido"));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar estado do draft", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao ler estado persistido do draft", e);
        }
    }
}
