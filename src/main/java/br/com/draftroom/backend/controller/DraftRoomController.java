package br.com.draftroom.backend.controller;

import br.com.draftroom.backend.dto.CreateDraftRoomRequest;
import br.com.draftroom.backend.dto.DraftSnapshotDTO;
import br.com.draftroom.backend.dto.PickDTO;
import br.com.draftroom.backend.dto.PickResponse;
import br.com.draftroom.backend.dto.QueueMoveRequest;
import br.com.draftroom.backend.dto.QueueUpdateRequest;
import br.com.draftroom.backend.dto.SubmitPickRequest;
import br.com.draftroom.backend.service.DraftRoomService;
import br.com.draftroom.backend.service.draft.CommitResult;
import br.com.draftroom.backend.service.draft.CommitStatus;
import br.com.draftroom.backend.service.draft.DraftStatus;
import br.com.draftroom.backend.service.draft.SnakeOrder;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/drafts")
@RequiredArgsConstructor
public class DraftRoomController {

    private static final String KEY_QUEUE = "queue";

    private final DraftRoomService draftRoomService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> createRoom(@Valid @RequestBody CreateDraftRoomRequest request) {
        String roomId = draftRoomService.createRoom(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("roomId", roomId, "snapshot", draftRoomService.getSnapshot(roomId)));
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<DraftSnapshotDTO> getSnapshot(@PathVariable String roomId) {
        return ResponseEntity.ok(draftRoomService.getSnapshot(roomId));
    }

    @PostMapping("/{roomId}/seats/{seatIndex}/ready")
    public ResponseEntity<Map<String, Object>> markReady(@PathVariable String roomId, @PathVariable int seatIndex) {
        DraftStatus status = draftRoomService.markReady(roomId, seatIndex);
        return ResponseEntity.ok(Map.of("status", status));
    }

    @PostMapping("/{roomId}/pause")
    public ResponseEntity<DraftSnapshotDTO> pause(@PathVariable String roomId) {
        draftRoomService.pause(roomId);
        log.info("⏸️ [DraftRoom] Sala {} pausada via API", roomId);
        return ResponseEntity.ok(draftRoomService.getSnapshot(roomId));
    }

    @PostMapping("/{roomId}/resume")
    public ResponseEntity<DraftSnapshotDTO> resume(@PathVariable String roomId) {
        draftRoomService.resume(roomId);
        log.info("▶️ [DraftRoom] Sala {} retomada via API", roomId);
        return ResponseEntity.ok(draftRoomService.getSnapshot(roomId));
    }

    @PostMapping("/{roomId}/picks")
    public ResponseEntity<PickResponse> submitPick(@PathVariable String roomId,
            @Valid @RequestBody SubmitPickRequest request) {
        CommitResult result = draftRoomService.submitPick(roomId, request.getPickNumber(), request.getSeatIndex(),
                request.getPlayerId());
        DraftSnapshotDTO snapshot = draftRoomService.getSnapshot(roomId);

        PickResponse response = PickResponse.builder()
                .status(result.status())
                .message(result.message())
                .pick(result.committedPick()
                        .map(pick -> PickDTO.from(pick, SnakeOrder.format(pick.pickNumber(), snapshot.getSeatCount())))
                        .orElse(null))
                .currentPick(snapshot.getCurrentPick())
                .build();
        return ResponseEntity.status(httpStatusFor(result.status())).body(response);
    }

    @GetMapping("/{roomId}/seats/{seatIndex}/queue")
    public ResponseEntity<Map<String, List<String>>> getQueue(@PathVariable String roomId,
            @PathVariable int seatIndex) {
        return ResponseEntity.ok(Map.of(KEY_QUEUE, draftRoomService.getQueue(roomId, seatIndex)));
    }

    @PutMapping("/{roomId}/seats/{seatIndex}/queue")
    public ResponseEntity<Map<String, List<String>>> replaceQueue(@PathVariable String roomId,
            @PathVariable int seatIndex, @Valid @RequestBody QueueUpdateRequest request) {
        return ResponseEntity.ok(Map.of(KEY_QUEUE,
                draftRoomService.updateQueue(roomId, seatIndex, request.getPlayerIds())));
    }

    @PostMapping("/{roomId}/seats/{seatIndex}/queue/{playerId}")
    public ResponseEntity<Map<String, List<String>>> appendToQueue(@PathVariable String roomId,
            @PathVariable int seatIndex, @PathVariable String playerId) {
        return ResponseEntity.ok(Map.of(KEY_QUEUE, draftRoomService.appendToQueue(roomId, seatIndex, playerId)));
    }

    @DeleteMapping("/{roomId}/seats/{seatIndex}/queue/{playerId}")
    public ResponseEntity<Map<String, List<String>>> removeFromQueue(@PathVariable String roomId,
            @PathVariable int seatIndex, @PathVariable String playerId) {
        return ResponseEntity.ok(Map.of(KEY_QUEUE, draftRoomService.removeFromQueue(roomId, seatIndex, playerId)));
    }

    @PutMapping("/{roomId}/seats/{seatIndex}/queue/{playerId}/position")
    public ResponseEntity<Map<String, List<String>>> moveInQueue(@PathVariable String roomId,
            @PathVariable int seatIndex, @PathVariable String playerId, @Valid @RequestBody QueueMoveRequest request) {
        return ResponseEntity.ok(Map.of(KEY_QUEUE,
                draftRoomService.moveInQueue(roomId, seatIndex, playerId, request.getTargetIndex())));
    }

    static HttpStatus httpStatusFor(CommitStatus status) {
        return switch (status) {
            case COMMITTED -> HttpStatus.OK;
            case STALE_REQUEST, PLAYER_UNAVAILABLE, DRAFT_NOT_ACTIVE -> HttpStatus.CONFLICT;
            case WRONG_TURN -> HttpStatus.FORBIDDEN;
            case ROSTER_LIMIT_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
