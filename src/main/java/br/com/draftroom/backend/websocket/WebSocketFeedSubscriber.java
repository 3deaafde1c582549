package br.com.draftroom.backend.websocket;

import br.com.draftroom.backend.dto.events.DraftFeedEvent;
import br.com.draftroom.backend.service.DraftFeedSubscriber;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Sessão WebSocket inscrita no feed. O decorator enfileira os envios, então
 * {@link #onEvent} não bloqueia o lock da sala esperando a rede.
 */
public class WebSocketFeedSubscriber implements DraftFeedSubscriber {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketFeedSubscriber(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.objectMapper = objectMapper;
    }

    @Override
    public String subscriberId() {
        return "ws:" + session.getId();
    }

    @Override
    public void onEvent(DraftFeedEvent event) {
        send(event);
    }

    public void send(Object payload) {
        if (!session.isOpen()) {
            throw new IllegalStateException("Sessão " + session.getId() + " fechada");
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar mensagem do feed", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
