package br.com.draftroom.backend.service;

import br.com.draftroom.backend.config.properties.DraftEngineProperties;
import br.com.draftroom.backend.dto.CreateDraftRoomRequest;
import br.com.draftroom.backend.dto.DraftSnapshotDTO;
import br.com.draftroom.backend.dto.SeatRequest;
import br.com.draftroom.backend.exception.DraftConfigurationException;
import br.com.draftroom.backend.exception.DraftRoomNotFoundException;
import br.com.draftroom.backend.exception.InvalidDraftCommandException;
import br.com.draftroom.backend.service.audit.DraftAuditAction;
import br.com.draftroom.backend.service.audit.DraftAuditService;
import br.com.draftroom.backend.service.draft.AutopickDecision;
import br.com.draftroom.backend.service.draft.AutopickResolver;
import br.com.draftroom.backend.service.draft.CommitResult;
import br.com.draftroom.backend.service.draft.CommitStatus;
import br.com.draftroom.backend.service.draft.DraftRoom;
import br.com.draftroom.backend.service.draft.DraftRoomConfig;
import br.com.draftroom.backend.service.draft.DraftStateMachine;
import br.com.draftroom.backend.service.draft.DraftStatus;
import br.com.draftroom.backend.service.draft.Participant;
import br.com.draftroom.backend.service.draft.Pick;
import br.com.draftroom.backend.service.draft.PickCommitArbiter;
import br.com.draftroom.backend.service.draft.PickOrigin;
import br.com.draftroom.backend.service.draft.PlayerCatalog;
import br.com.draftroom.backend.service.draft.PositionLimits;
import br.com.draftroom.backend.service.draft.QueueManager;
import br.com.draftroom.backend.service.draft.TimerState;
import br.com.draftroom.backend.service.draft.TurnScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Orquestra as salas de draft: criação, comandos dos clientes, tick do relógio e recuperação.
 *
 * Toda operação que muda uma sala roda com o lock dela, do commit no arbiter até a
 * publicação no feed. Efeitos secundários (status persistido, auditoria, Redis) que falham
 * são logados sem desfazer o pick, que já está no log durável.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftRoomService {

    private final DraftRoomRegistry registry;
    private final DraftPersistenceService persistence;
    private final PlayerCatalog playerCatalog;
    private final PickCommitArbiter arbiter;
    private final AutopickResolver autopickResolver;
    private final QueueManager queueManager;
    private final DraftStateMachine stateMachine;
    private final TurnScheduler turnScheduler;
    private final DraftSyncService syncService;
    private final DraftAuditService auditService;
    private final DraftEngineProperties properties;
    private final Clock clock;

    // ═══════════════════════════════════════════════════════════
    // CRIAÇÃO
    // ═══════════════════════════════════════════════════════════

    public String createRoom(CreateDraftRoomRequest request) {
        DraftRoomConfig config = validate(request);
        String roomId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        List<Participant> participants = new ArrayList<>();
        for (int seat = 0; seat < request.getSeats().size(); seat++) {
            SeatRequest seatRequest = request.getSeats().get(seat);
            PositionLimits overrides = seatRequest.getAutodraftLimits() == null ? null
                    : PositionLimits.of(seatRequest.getAutodraftLimits());
            participants.add(new Participant(seatRequest.getId(), seat, seatRequest.isBot(), overrides));
        }
        DraftRoom room = new DraftRoom(roomId, config, participants, now);

        for (int seat = 0; seat < request.getSeats().size(); seat++) {
            List<String> seed = request.getSeats().get(seat).getQueueSeed();
            if (seed != null && !seed.isEmpty()) {
                queueManager.replaceQueue(room, seat, seed);
            }
        }

        persistence.saveNewRoom(room);
        registry.register(room);
        audit(room, DraftAuditAction.ROOM_CREATED, null, null, Map.of(
                "seatCount", config.seatCount(),
                "rounds", config.rounds(),
                "pickClockSeconds", config.pickClock().toSeconds()));
        log.info("✅ [DraftRoom] Sala {} criada: {} assentos x {} rodadas, relógio {}s + grace {}s", roomId,
                config.seatCount(), config.rounds(), config.pickClock().toSeconds(),
                config.gracePeriod().toSeconds());

        // Sala só de bots já está pronta
        room.withLock(() -> {
            if (stateMachine.beginCountdownIfReady(room, now)) {
                onCountdownStarted(room, now);
            }
        });
        return roomId;
    }

    DraftRoomConfig validate(CreateDraftRoomRequest request) {
        List<String> problems = new ArrayList<>();
        int seatCount = request.getSeatCount() == null ? 0 : request.getSeatCount();
        int rounds = request.getRounds() == null ? 0 : request.getRounds();
        int pickClock = request.getPickClockSeconds() == null ? properties.getPickClockSeconds()
                : request.getPickClockSeconds();
        int grace = request.getGracePeriodSeconds() == null ? properties.getGracePeriodSeconds()
                : request.getGracePeriodSeconds();
        List<SeatRequest> seats = request.getSeats() == null ? List.of() : request.getSeats();

        if (seatCount < 1) {
            problems.add("seatCount deve ser ≥ 1");
        }
        if (rounds < 1) {
            problems.add("rounds deve ser ≥ 1");
        }
        if (pickClock <= 0) {
            problems.add("pickClockSeconds deve ser > 0");
        }
        if (grace < 0) {
            problems.add("gracePeriodSeconds não pode ser negativo");
        }
        if (seats.size() != seatCount) {
            problems.add("seats tem " + seats.size() + " entradas para seatCount " + seatCount);
        }

        Set<String> ids = new HashSet<>();
        for (SeatRequest seat : seats) {
            if (seat == null || seat.getId() == null || seat.getId().isBlank()) {
                problems.add("todo assento precisa de id");
            } else if (!ids.add(seat.getId())) {
                problems.add("participante repetido: " + seat.getId());
            }
            if (seat != null && seat.getAutodraftLimits() != null) {
                checkLimits(seat.getAutodraftLimits(), "autodraftLimits de " + seat.getId(), problems);
            }
        }

        Map<String, Integer> limits = request.getPositionLimits() == null ? properties.getDefaultPositionLimits()
                : request.getPositionLimits();
        checkLimits(limits, "positionLimits", problems);

        if (seatCount >= 1 && rounds >= 1) {
            long totalPicks = (long) seatCount * rounds;
            if (totalPicks > DraftRoomConfig.MAX_TOTAL_PICKS) {
                problems.add("seatCount x rounds = " + totalPicks + " passa do máximo de "
                        + DraftRoomConfig.MAX_TOTAL_PICKS + " picks");
            } else {
                int catalogSize = playerCatalog.listAll().size();
                if (catalogSize < totalPicks) {
                    problems.add("catálogo tem " + catalogSize + " jogadores para " + totalPicks + " picks");
                }
            }
        }

        if (!problems.isEmpty()) {
            log.warn("⚠️ [DraftRoom] Criação rejeitada: {}", problems);
            throw new DraftConfigurationException(problems);
        }
        return new DraftRoomConfig(seatCount, rounds, Duration.ofSeconds(pickClock), Duration.ofSeconds(grace),
                Duration.ofSeconds(properties.getEngine().getCountdownSeconds()), PositionLimits.of(limits));
    }

    private void checkLimits(Map<String, Integer> limits, String field, List<String> problems) {
        limits.forEach((position, max) -> {
            if (position == null || position.isBlank()) {
                problems.add(field + ": posição vazia");
            } else if (max == null || max < 0) {
                problems.add(field + ": limite inválido para " + position + " (" + max + ")");
            }
        });
    }

    // ═══════════════════════════════════════════════════════════
    // CICLO DE VIDA
    // ═══════════════════════════════════════════════════════════

    public DraftStatus markReady(String roomId, int seatIndex) {
        DraftRoom room = requireLiveRoom(roomId);
        return room.withLock(() -> {
            Instant now = clock.instant();
            requireSeat(room, seatIndex);
            boolean wasReady = room.participant(seatIndex).isReady();
            boolean countdown = stateMachine.markSeatReady(room, seatIndex, now);
            if (!wasReady && room.participant(seatIndex).isReady()) {
                safely(room, "saveReady", () -> persistence.saveReady(roomId, seatIndex));
                audit(room, DraftAuditAction.PARTICIPANT_READY, seatIndex, null, null);
            }
            if (countdown) {
                onCountdownStarted(room, now);
            }
            return room.getStatus();
        });
    }

    public void pause(String roomId) {
        DraftRoom room = requireLiveRoom(roomId);
        room.withLock(() -> {
            stateMachine.pause(room);
            safely(room, "updateStatus", () -> persistence.updateStatus(room));
            audit(room, DraftAuditAction.DRAFT_PAUSED, null, room.getCurrentPick(), null);
            syncService.publishStateChange(room, clock.instant());
        });
    }

    public void resume(String roomId) {
        DraftRoom room = requireLiveRoom(roomId);
        room.withLock(() -> {
            Instant now = clock.instant();
            stateMachine.resume(room, now);
            safely(room, "updateStatus", () -> persistence.updateStatus(room));
            audit(room, DraftAuditAction.DRAFT_RESUMED, null, room.getCurrentPick(), null);
            syncService.publishStateChange(room, now);
        });
    }

    // ═══════════════════════════════════════════════════════════
    // PICKS
    // ═══════════════════════════════════════════════════════════

    /**
     * Pick manual. Rejeições voltam como valor; a sala nunca quebra por causa delas.
     * Sala encerrada responde STALE_REQUEST ou DRAFT_NOT_ACTIVE pelo próprio arbiter.
     */
    public CommitResult submitPick(String roomId, int pickNumber, int seatIndex, String playerId) {
        DraftRoom room = findRoom(roomId);
        return room.withLock(() -> {
            CommitResult result = arbiter.attemptCommit(room, pickNumber, seatIndex, playerId, PickOrigin.MANUAL);
            if (result.isCommitted()) {
                onCommitted(room, result.pick(), clock.instant());
            }
            return result;
        });
    }

    /**
     * Um passo do driver de relógio em todas as salas vivas.
     */
    public void tick() {
        for (DraftRoom room : registry.liveRooms()) {
            try {
                tick(room);
            } catch (RuntimeException e) {
                log.error("❌ [DraftRoom] Erro no tick da sala {}", room.getId(), e);
            }
        }
    }

    void tick(DraftRoom room) {
        Instant now = clock.instant();
        room.withLock(() -> {
            if (stateMachine.activateIfCountdownElapsed(room, now)) {
                safely(room, "updateStatus", () -> persistence.updateStatus(room));
                audit(room, DraftAuditAction.DRAFT_STARTED, null, room.getCurrentPick(), null);
                syncService.publishStateChange(room, now);
            }

            // Bots em sequência resolvem no mesmo tick
            int guard = room.getConfig().totalPicks();
            Optional<TimerState> expired = turnScheduler.claimExpired(room, now);
            while (expired.isPresent() && guard-- > 0) {
                runAutopick(room, expired.get(), now);
                expired = turnScheduler.claimExpired(room, now);
            }

            if (room.getStatus() == DraftStatus.ACTIVE) {
                syncService.publishTimerTick(room, now);
            }
        });
    }

    private void runAutopick(DraftRoom room, TimerState timer, Instant now) {
        int seat = timer.seatIndex();
        boolean bot = room.participant(seat).isBot();
        if (!bot) {
            audit(room, DraftAuditAction.TIMER_EXPIRED, seat, timer.pickNumber(), null);
        }

        Optional<AutopickDecision> decision = autopickResolver.resolve(room, seat);
        if (decision.isEmpty()) {
            log.error("❌ [Autopick] Sala {} pick {}: nenhum jogador disponível", room.getId(), timer.pickNumber());
            return;
        }

        CommitResult result;
        try {
            result = arbiter.attemptCommit(room, timer.pickNumber(), seat, decision.get().playerId(),
                    decision.get().origin(), decision.get().enforceRosterLimits());
        } catch (RuntimeException e) {
            log.error("❌ [Autopick] Sala {} pick {} falhou ao commitar; relógio reiniciado", room.getId(),
                    timer.pickNumber(), e);
            turnScheduler.startTimer(room, now);
            return;
        }

        if (result.isCommitted()) {
            log.info("🤖 [Autopick] Sala {} pick {} assento {} ({}) → {} via {}", room.getId(), timer.pickNumber(),
                    seat, bot ? "bot" : "timeout", decision.get().playerId(), decision.get().origin().getWireValue());
            onCommitted(room, result.pick(), now);
        } else if (result.status() == CommitStatus.STALE_REQUEST) {
            // Pick manual venceu a corrida
            log.debug("[Autopick] Sala {} pick {} já commitado", room.getId(), timer.pickNumber());
        } else {
            log.error("❌ [Autopick] Sala {} pick {} rejeitado: {} - {}", room.getId(), timer.pickNumber(),
                    result.status(), result.message());
            turnScheduler.startTimer(room, now);
        }
    }

    private void onCommitted(DraftRoom room, Pick pick, Instant now) {
        DraftStatus status = stateMachine.afterCommit(room, now);
        // Feed antes de qualquer efeito secundário: o pick já está no log durável
        syncService.publishPick(room, pick);
        safely(room, "updateStatus", () -> persistence.updateStatus(room));
        safely(room, "syncQueues", () -> persistence.syncQueues(room));
        audit(room, pick.origin().isAutomatic() ? DraftAuditAction.PICK_AUTO : DraftAuditAction.PICK_MANUAL,
                pick.seatIndex(), pick.pickNumber(),
                Map.of("playerId", pick.playerId(), "origin", pick.origin().getWireValue()));

        if (status == DraftStatus.COMPLETE) {
            syncService.publishStateChange(room, now);
            audit(room, DraftAuditAction.DRAFT_COMPLETED, null, pick.pickNumber(), null);
            syncService.closeRoom(room.getId());
            registry.remove(room.getId());
            log.info("🏁 [DraftRoom] Sala {} encerrada", room.getId());
        }
    }

    private void onCountdownStarted(DraftRoom room, Instant now) {
        safely(room, "updateStatus", () -> persistence.updateStatus(room));
        audit(room, DraftAuditAction.COUNTDOWN_STARTED, null, null, null);
        syncService.publishStateChange(room, now);
    }

    // ═══════════════════════════════════════════════════════════
    // FILA
    // ═══════════════════════════════════════════════════════════

    public List<String> getQueue(String roomId, int seatIndex) {
        DraftRoom room = requireLiveRoom(roomId);
        requireSeat(room, seatIndex);
        return room.withLock(() -> room.participant(seatIndex).queueView());
    }

    public List<String> updateQueue(String roomId, int seatIndex, List<String> playerIds) {
        DraftRoom room = requireLiveRoom(roomId);
        return room.withLock(() -> afterQueueEdit(room, seatIndex,
                queueManager.replaceQueue(room, seatIndex, playerIds)));
    }

    public List<String> appendToQueue(String roomId, int seatIndex, String playerId) {
        DraftRoom room = requireLiveRoom(roomId);
        return room.withLock(() -> afterQueueEdit(room, seatIndex, queueManager.append(room, seatIndex, playerId)));
    }

    public List<String> removeFromQueue(String roomId, int seatIndex, String playerId) {
        DraftRoom room = requireLiveRoom(roomId);
        return room.withLock(() -> afterQueueEdit(room, seatIndex, queueManager.remove(room, seatIndex, playerId)));
    }

    public List<String> moveInQueue(String roomId, int seatIndex, String playerId, int targetIndex) {
        DraftRoom room = requireLiveRoom(roomId);
        return room.withLock(() -> afterQueueEdit(room, seatIndex,
                queueManager.move(room, seatIndex, playerId, targetIndex)));
    }

    private List<String> afterQueueEdit(DraftRoom room, int seatIndex, List<String> queue) {
        safely(room, "saveQueue", () -> persistence.saveQueue(room.getId(), seatIndex, queue));
        audit(room, DraftAuditAction.QUEUE_UPDATED, seatIndex, null, Map.of("size", queue.size()));
        syncService.publishQueueUpdate(room, seatIndex, queue, clock.instant());
        return queue;
    }

    // ═══════════════════════════════════════════════════════════
    // SINCRONIZAÇÃO
    // ═══════════════════════════════════════════════════════════

    public DraftSnapshotDTO getSnapshot(String roomId) {
        return syncService.snapshot(findRoom(roomId), clock.instant());
    }

    /**
     * @param lastKnownPick último pick que o cliente já tem (0 se nenhum)
     * @return quantos picks foram reenviados antes de entrar no feed
     */
    public int subscribe(String roomId, DraftFeedSubscriber subscriber, int lastKnownPick) {
        DraftRoom room = findRoom(roomId);
        int replayed = syncService.subscribe(room, subscriber, lastKnownPick);
        if (room.getStatus().isTerminal()) {
            // Nada mais vai ser publicado para uma sala encerrada
            syncService.unsubscribe(roomId, subscriber);
        }
        return replayed;
    }

    public void unsubscribe(String roomId, DraftFeedSubscriber subscriber) {
        syncService.unsubscribe(roomId, subscriber);
    }

    // ═══════════════════════════════════════════════════════════
    // RECUPERAÇÃO
    // ═══════════════════════════════════════════════════════════

    @EventListener(ApplicationReadyEvent.class)
    public void recoverRooms() {
        Instant now = clock.instant();
        List<DraftRoom> rooms = persistence.loadRecoverableRooms();
        int recovered = 0;
        for (DraftRoom room : rooms) {
            if (room.getStatus().isTerminal()) {
                // Último pick gravado antes do status
                safely(room, "updateStatus", () -> persistence.updateStatus(room));
                continue;
            }
            if (adopt(room, now) == room) {
                recovered++;
            }
        }
        log.info("✅ [DraftRoom] {} salas recuperadas", recovered);
    }

    // ═══════════════════════════════════════════════════════════
    // AUXILIARES
    // ═══════════════════════════════════════════════════════════

    private DraftRoom requireLiveRoom(String roomId) {
        DraftRoom room = findRoom(roomId);
        if (room.getStatus().isTerminal()) {
            throw new IllegalStateException("Sala " + roomId + " já está encerrada");
        }
        return room;
    }

    /**
     * Sala do registro; fora dele, lê do banco. Sala encerrada é servida como leitura,
     * sala ainda em andamento entra no registro antes de receber comandos.
     */
    private DraftRoom findRoom(String roomId) {
        Optional<DraftRoom> live = registry.find(roomId);
        if (live.isPresent()) {
            return live.get();
        }
        DraftRoom stored = persistence.loadRoom(roomId).orElseThrow(() -> new DraftRoomNotFoundException(roomId));
        if (stored.getStatus().isTerminal()) {
            return stored;
        }
        return adopt(stored, clock.instant());
    }

    /**
     * Coloca no registro uma sala lida do banco. Se outra requisição chegou antes,
     * a instância dela vence e a lida aqui é descartada.
     */
    private DraftRoom adopt(DraftRoom stored, Instant now) {
        stateMachine.restartClock(stored, now);
        DraftRoom live = registry.registerIfAbsent(stored);
        if (live == stored) {
            audit(stored, DraftAuditAction.ROOM_RECOVERED, null, stored.getCurrentPick(),
                    Map.of("status", stored.getStatus().name()));
            log.info("🔄 [DraftRoom] Sala {} recuperada em {} no pick {}", stored.getId(), stored.getStatus(),
                    stored.getCurrentPick());
        }
        return live;
    }

    private void requireSeat(DraftRoom room, int seatIndex) {
        if (seatIndex < 0 || seatIndex >= room.getConfig().seatCount()) {
            throw new InvalidDraftCommandException("Assento inválido: " + seatIndex);
        }
    }

    private void audit(DraftRoom room, DraftAuditAction action, Integer seatIndex, Integer pickNumber,
            Map<String, ?> details) {
        safely(room, "audit " + action,
                () -> auditService.record(room.getId(), action, seatIndex, pickNumber, details));
    }

    private void safely(DraftRoom room, String operation, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("❌ [DraftRoom] Sala {}: {} falhou", room.getId(), operation, e);
        }
    }
}
