package br.com.draftroom.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantDTO {
    private String id;
    private int seatIndex;
    private boolean bot;
    private boolean ready;
    private Map<String, List<String>> roster;
    private Map<String, Integer> autodraftLimits;
    /** -1 quando o assento não tem mais picks */
    private int nextPickNumber;
}
