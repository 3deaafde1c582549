package br.com.draftroom.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "draft_rooms", indexes = {
        @Index(name = "idx_draft_rooms_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftRoomEntity {
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "seat_count", nullable = false)
    private Integer seatCount;

    @Column(nullable = false)
    private Integer rounds;

    @Column(name = "pick_clock_seconds", nullable = false)
    private Integer pickClockSeconds;

    @Column(name = "grace_period_seconds", nullable = false)
    private Integer gracePeriodSeconds;

    @Column(name = "countdown_seconds", nullable = false)
    private Integer countdownSeconds;

    @Column(name = "position_limits", columnDefinition = "TEXT")
    private String positionLimitsJson;

    @Column(length = 20, nullable = false)
    private String status;

    // Cache do tamanho do log; a fonte da verdade continua sendo draft_picks
    @Column(name = "current_pick", nullable = false)
    private Integer currentPick;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = Instant.now();
    }
}
