package br.com.draftroom.backend.dto;

import br.com.draftroom.backend.service.draft.CommitStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickResponse {
    private CommitStatus status;
    private String message;
    private PickDTO pick;
    private int currentPick;
}
