package br.com.draftroom.backend.scheduled;

import br.com.draftroom.backend.service.DraftRoomService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * ⏰ Driver externo do relógio dos drafts
 *
 * A cada tick: contagens regressivas terminadas ativam a sala, relógios expirados
 * (ou vez de bot) disparam o autopick e os clientes recebem os segundos restantes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DraftClockScheduledTask {

    private final DraftRoomService draftRoomService;

    @Scheduled(fixedDelayString = "${draft.engine.tick-interval-ms:1000}")
    public void tick() {
        try {
            draftRoomService.tick();
        } catch (Exception e) {
            log.error("❌ [DraftClock] Erro no tick", e);
        }
    }
}
