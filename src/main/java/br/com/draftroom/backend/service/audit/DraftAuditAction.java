package br.com.draftroom.backend.service.audit;

public enum DraftAuditAction {
    ROOM_CREATED,
    PARTICIPANT_READY,
    COUNTDOWN_STARTED,
    DRAFT_STARTED,
    PICK_MANUAL,
    PICK_AUTO,
    TIMER_EXPIRED,
    QUEUE_UPDATED,
    DRAFT_PAUSED,
    DRAFT_RESUMED,
    DRAFT_COMPLETED,
    ROOM_RECOVERED
}
