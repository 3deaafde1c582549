package br.com.draftroom.backend.controller;

import br.com.draftroom.backend.dto.DraftSnapshotDTO;
import br.com.draftroom.backend.exception.DraftRoomNotFoundException;
import br.com.draftroom.backend.exception.GlobalExceptionHandler;
import br.com.draftroom.backend.service.DraftRoomService;
import br.com.draftroom.backend.service.draft.CommitResult;
import br.com.draftroom.backend.service.draft.CommitStatus;
import br.com.draftroom.backend.service.draft.DraftStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DraftRoomControllerTest {

    private DraftRoomService draftRoomService;
    private MockMvc mockMvc;

    @BeforeEach
    void setup() {
        draftRoomService = mock(DraftRoomService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DraftRoomController(draftRoomService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void rejectionStatusesMapToHttp() {
        assertThat(DraftRoomController.httpStatusFor(CommitStatus.COMMITTED)).isEqualTo(HttpStatus.OK);
        assertThat(DraftRoomController.httpStatusFor(CommitStatus.STALE_REQUEST)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(DraftRoomController.httpStatusFor(CommitStatus.PLAYER_UNAVAILABLE)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(DraftRoomController.httpStatusFor(CommitStatus.WRONG_TURN)).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(DraftRoomController.httpStatusFor(CommitStatus.ROSTER_LIMIT_EXCEEDED))
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void rejectedPickReturnsStatusAndCurrentPick() throws Exception {
        when(draftRoomService.submitPick("sala", 2, 1, "QB-01"))
                .thenReturn(CommitResult.rejected(CommitStatus.PLAYER_UNAVAILABLE, "Jogador QB-01 não está disponível"));
        when(draftRoomService.getSnapshot("sala")).thenReturn(snapshot());

        mockMvc.perform(post("/api/drafts/sala/picks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pickNumber\":2,\"seatIndex\":1,\"playerId\":\"QB-01\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("PLAYER_UNAVAILABLE"))
                .andExpect(jsonPath("$.currentPick").value(2));
    }

    @Test
    void invalidPickBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/drafts/sala/picks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pickNumber\":0,\"seatIndex\":1}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(draftRoomService);
    }

    @Test
    void unknownRoomIsNotFound() throws Exception {
        when(draftRoomService.getSnapshot("sumiu")).thenThrow(new DraftRoomNotFoundException("sumiu"));

        mockMvc.perform(get("/api/drafts/sumiu"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void pauseOnFinishedRoomIsConflict() throws Exception {
        doThrow(new IllegalStateException("Sala sala já está encerrada")).when(draftRoomService).pause("sala");

        mockMvc.perform(post("/api/drafts/sala/pause"))
                .andExpect(status().isConflict());
    }

    private static DraftSnapshotDTO snapshot() {
        return DraftSnapshotDTO.builder()
                .roomId("sala")
                .status(DraftStatus.ACTIVE)
                .seatCount(4)
                .rounds(2)
                .totalPicks(8)
                .currentPick(2)
                .lastPickNumber(1)
                .onTheClockSeat(1)
                .build();
    }
}
