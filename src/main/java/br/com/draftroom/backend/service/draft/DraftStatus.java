package br.com.draftroom.backend.service.draft;

import java.util.EnumSet;
import java.util.Set;

/**
 * Estados do ciclo de vida da sala.
 *
 * WAITING → COUNTDOWN → ACTIVE ⇄ PAUSED, ACTIVE → COMPLETE (terminal).
 */
public enum DraftStatus {
    WAITING,
    COUNTDOWN,
    ACTIVE,
    PAUSED,
    COMPLETE;

    public boolean isTerminal() {
        return this == COMPLETE;
    }

    public boolean canTransitionTo(DraftStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<DraftStatus> allowedTargets() {
        return switch (this) {
            case WAITING -> EnumSet.of(COUNTDOWN);
            case COUNTDOWN -> EnumSet.of(ACTIVE);
            case ACTIVE -> EnumSet.of(PAUSED, COMPLETE);
            case PAUSED -> EnumSet.of(ACTIVE);
            case COMPLETE -> EnumSet.noneOf(DraftStatus.class);
        };
    }
}
