package br.com.draftroom.backend.service.draft;

/**
 * Resultado de uma tentativa de commit. Apenas {@link #COMMITTED} altera a sala.
 */
public enum CommitStatus {
    COMMITTED,
    /** Número do pick não é o atual; em corrida é o resultado esperado para quem perdeu. */
    STALE_REQUEST,
    WRONG_TURN,
    PLAYER_UNAVAILABLE,
    ROSTER_LIMIT_EXCEEDED,
    DRAFT_NOT_ACTIVE;

    public boolean isCommitted() {
        return this == COMMITTED;
    }
}
