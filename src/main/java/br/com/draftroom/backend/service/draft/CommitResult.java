package br.com.draftroom.backend.service.draft;

import java.util.Optional;

public record CommitResult(CommitStatus status, Pick pick, String message) {

    public static CommitResult committed(Pick pick) {
        return new CommitResult(CommitStatus.COMMITTED, pick, null);
    }

    public static CommitResult rejected(CommitStatus status, String message) {
        if (status.isCommitted()) {
            throw new IllegalArgumentException("Rejeição não pode ter status COMMITTED");
        }
        return new CommitResult(status, null, message);
    }

    public boolean isCommitted() {
        return status.isCommitted();
    }

    public Optional<Pick> committedPick() {
        return Optional.ofNullable(pick);
    }
}
