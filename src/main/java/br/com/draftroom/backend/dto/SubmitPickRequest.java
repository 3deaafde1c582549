package br.com.draftroom.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitPickRequest {
    @NotNull
    @Min(1)
    private Integer pickNumber;
    @NotNull
    @Min(0)
    private Integer seatIndex;
    @NotBlank
    private String playerId;
}
