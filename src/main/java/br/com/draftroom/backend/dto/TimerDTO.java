package br.com.draftroom.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Relógio visível ao cliente. O fim do grace nunca é exposto.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimerDTO {
    private int pickNumber;
    private int seatIndex;
    private Instant deadline;
    private long remainingSeconds;
}
