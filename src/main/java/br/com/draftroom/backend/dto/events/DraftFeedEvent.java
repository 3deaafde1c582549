package br.com.draftroom.backend.dto.events;

import br.com.draftroom.backend.dto.PickDTO;
import br.com.draftroom.backend.dto.TimerDTO;
import br.com.draftroom.backend.service.draft.DraftStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * ✅ Evento do feed incremental de uma sala
 *
 * Entregue aos clientes conectados (WebSocket) e publicado no Redis no canal
 * {@code draft:{roomId}}.
 *
 * TIPOS:
 * - pick_committed: um pick entrou no log (traz o pick, o pick atual e o assento no relógio)
 * - state_changed: transição de ciclo de vida
 * - timer_tick: segundos restantes do relógio exibido
 * - queue_updated: fila de um assento mudou
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DraftFeedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String PICK_COMMITTED = "pick_committed";
    public static final String STATE_CHANGED = "state_changed";
    public static final String TIMER_TICK = "timer_tick";
    public static final String QUEUE_UPDATED = "queue_updated";

    private String type;
    private String roomId;
    private DraftStatus status;
    private PickDTO pick;
    private Integer currentPick;
    private Integer onTheClockSeat;
    private TimerDTO timer;
    private Instant countdownEndsAt;
    private Integer seatIndex;
    private List<String> queue;
    /** true para picks reenviados na retomada de uma assinatura */
    private Boolean replay;
    private Instant timestamp;

    public boolean isPickCommitted() {
        return PICK_COMMITTED.equals(type);
    }
}
