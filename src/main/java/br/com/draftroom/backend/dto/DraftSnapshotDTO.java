package br.com.draftroom.backend.dto;

import br.com.draftroom.backend.service.draft.DraftStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Estado completo de uma sala. Suficiente para o cliente reconstruir o draft sozinho
 * e depois continuar pelo feed a partir de {@code lastPickNumber}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftSnapshotDTO {
    private String roomId;
    private DraftStatus status;
    private int seatCount;
    private int rounds;
    private int totalPicks;
    private int pickClockSeconds;
    private Map<String, Integer> positionLimits;
    private int currentPick;
    private int lastPickNumber;
    private Integer onTheClockSeat;
    private TimerDTO timer;
    private Instant countdownEndsAt;
    private List<ParticipantDTO> participants;
    private List<PickDTO> picks;
    private Instant generatedAt;
}
