package br.com.draftroom.backend.service.audit;

import br.com.draftroom.backend.domain.entity.DraftAuditEvent;
import br.com.draftroom.backend.domain.repository.DraftAuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trilha de auditoria append-only, encadeada por SHA-256 dentro de cada sala.
 *
 * Falhas são logadas e não propagam para o draft.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftAuditService {

    private final DraftAuditEventRepository auditRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public void record(String roomId, DraftAuditAction action, Integer seatIndex, Integer pickNumber,
            Map<String, ?> details) {
        try {
            String previousHash = auditRepository.findTopByRoomIdOrderByIdDesc(roomId)
                    .map(DraftAuditEvent::getHash)
                    .orElse(null);
            Instant now = clock.instant();
            String payload = details == null || details.isEmpty() ? null : objectMapper.writeValueAsString(details);

            DraftAuditEvent event = DraftAuditEvent.builder()
                    .roomId(roomId)
                    .action(action.name())
                    .seatIndex(seatIndex)
                    .pickNumber(pickNumber)
                    .payload(payload)
                    .previousHash(previousHash)
                    .createdAt(now)
                    .build();
            event.setHash(hashOf(event));
            auditRepository.save(event);
        } catch (JsonProcessingException e) {
            log.error("❌ [Audit] Falha ao serializar {} da sala {}", action, roomId, e);
        } catch (RuntimeException e) {
            log.error("❌ [Audit] Falha ao gravar {} da sala {}", action, roomId, e);
        }
    }

    /**
     * @return true se todos os elos da sala batem com o hash recalculado
     */
    @Transactional(readOnly = true)
    public boolean verifyChain(String roomId) {
        List<DraftAuditEvent> events = auditRepository.findByRoomIdOrderByIdAsc(roomId);
        String previous = null;
        for (DraftAuditEvent event : events) {
            if (!Objects.equals(previous, event.getPreviousHash()) || !hashOf(event).equals(event.getHash())) {
                log.warn("⚠️ [Audit] Cadeia da sala {} quebrada no evento {}", roomId, event.getId());
                return false;
            }
            previous = event.getHash();
        }
        return true;
    }

    String hashOf(DraftAuditEvent event) {
        String material = String.join("|",
                String.valueOf(event.getPreviousHash()),
                event.getRoomId(),
                event.getAction(),
                String.valueOf(event.getSeatIndex()),
                String.valueOf(event.getPickNumber()),
                String.valueOf(event.getPayload()),
                String.valueOf(event.getCreatedAt().toEpochMilli()));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponível", e);
        }
    }
}
