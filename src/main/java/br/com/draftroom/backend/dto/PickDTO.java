package br.com.draftroom.backend.dto;

import br.com.draftroom.backend.service.draft.Pick;
import br.com.draftroom.backend.service.draft.PickOrigin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickDTO {
    private int pickNumber;
    private int round;
    private int pickInRound;
    /** Ex: "3.07" */
    private String label;
    private int seatIndex;
    private String participantId;
    private String playerId;
    private String position;
    private PickOrigin origin;
    private Instant committedAt;
    private Map<String, Integer> rosterAtPick;

    public static PickDTO from(Pick pick, String label) {
        return PickDTO.builder()
                .pickNumber(pick.pickNumber())
                .round(pick.round())
                .pickInRound(pick.pickInRound())
                .label(label)
                .seatIndex(pick.seatIndex())
                .participantId(pick.participantId())
                .playerId(pick.playerId())
                .position(pick.position())
                .origin(pick.origin())
                .committedAt(pick.committedAt())
                .rosterAtPick(pick.rosterAtPick())
                .build();
    }
}
