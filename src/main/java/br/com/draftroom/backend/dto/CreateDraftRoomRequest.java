package br.com.draftroom.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Criação de sala. Campos de tempo e limites nulos usam os padrões de {@code draft.*}.
 * As regras de negócio (assentos ≥ 1, catálogo suficiente...) são checadas no serviço.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDraftRoomRequest {
    @NotNull
    private Integer seatCount;
    @NotNull
    private Integer rounds;
    private Integer pickClockSeconds;
    private Integer gracePeriodSeconds;
    private Map<String, Integer> positionLimits;
    @NotNull
    @Valid
    private List<SeatRequest> seats;
}
