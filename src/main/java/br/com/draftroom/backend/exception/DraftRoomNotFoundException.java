package br.com.draftroom.backend.exception;

public class DraftRoomNotFoundException extends RuntimeException {

    public DraftRoomNotFoundException(String roomId) {
        super("Sala de draft não encontrada: " + roomId);
    }
}
