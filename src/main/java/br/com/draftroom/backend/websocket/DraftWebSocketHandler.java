package br.com.draftroom.backend.websocket;

import br.com.draftroom.backend.exception.DraftRoomNotFoundException;
import br.com.draftroom.backend.service.DraftRoomService;
import br.com.draftroom.backend.service.DraftSyncService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 🔌 WebSocket dos clientes do draft em /ws/draft
 *
 * MENSAGENS (cliente → servidor):
 * - {"type":"snapshot","roomId":"..."} → estado completo
 * - {"type":"subscribe","roomId":"...","lastKnownPick":50} → picks 51+ e depois o feed
 * - {"type":"unsubscribe","roomId":"..."}
 * - {"type":"ping"} → pong
 *
 * Fluxo de reconexão: snapshot, depois subscribe com o lastPickNumber do snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DraftWebSocketHandler extends TextWebSocketHandler {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_ROOM_ID = "roomId";

    private final DraftRoomService draftRoomService;
    private final DraftSyncService draftSyncService;
    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketFeedSubscriber> subscribers = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        subscribers.put(session.getId(), new WebSocketFeedSubscriber(session, objectMapper));
        log.info("🔌 [DraftWS] Cliente conectado: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        WebSocketFeedSubscriber subscriber = subscribers.get(session.getId());
        if (subscriber == null) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(message.getPayload());
            String type = json.path(FIELD_TYPE).asText("");
            String roomId = json.path(FIELD_ROOM_ID).asText(null);

            switch (type) {
                case "ping" -> subscriber.send(Map.of(FIELD_TYPE, "pong", "timestamp", Instant.now()));
                case "snapshot" -> subscriber.send(Map.of(
                        FIELD_TYPE, "snapshot",
                        "snapshot", draftRoomService.getSnapshot(requireRoomId(roomId))));
                case "subscribe" -> {
                    int lastKnownPick = json.path("lastKnownPick").asInt(0);
                    int replayed = draftRoomService.subscribe(requireRoomId(roomId), subscriber, lastKnownPick);
                    subscriber.send(Map.of(FIELD_TYPE, "subscribed", FIELD_ROOM_ID, roomId, "replayed", replayed));
                }
                case "unsubscribe" -> draftRoomService.unsubscribe(requireRoomId(roomId), subscriber);
                default -> sendError(subscriber, "Tipo de mensagem desconhecido: " + type);
            }
        } catch (DraftRoomNotFoundException | IllegalArgumentException e) {
            sendError(subscriber, e.getMessage());
        } catch (Exception e) {
            log.error("❌ [DraftWS] Erro ao processar mensagem da sessão {}", session.getId(), e);
            sendError(subscriber, "Erro ao processar mensagem");
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        WebSocketFeedSubscriber subscriber = subscribers.remove(session.getId());
        if (subscriber != null) {
            draftSyncService.unsubscribeAll(subscriber);
        }
        log.info("🔌 [DraftWS] Cliente desconectado: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("⚠️ [DraftWS] Erro de transporte na sessão {}: {}", session.getId(), exception.getMessage());
    }

    private String requireRoomId(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId é obrigatório");
        }
        return roomId;
    }

    private void sendError(WebSocketFeedSubscriber subscriber, String message) {
        try {
            subscriber.send(Map.of(FIELD_TYPE, "error", "message", String.valueOf(message)));
        } catch (RuntimeException e) {
            log.debug("[DraftWS] Não foi possível enviar erro para {}: {}", subscriber.subscriberId(), e.getMessage());
        }
    }
}
