package br.com.draftroom.backend.service.draft;

/**
 * Registro durável do log de picks. O arbiter grava aqui antes de aplicar o pick na memória,
 * então um pick visível na sala sempre já está persistido.
 */
public interface PickJournal {

    void appendPick(String roomId, Pick pick);
}
