package br.com.draftroom.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatRequest {
    @NotBlank
    private String id;
    private boolean bot;
    private List<String> queueSeed;
    private Map<String, Integer> autodraftLimits;
}
