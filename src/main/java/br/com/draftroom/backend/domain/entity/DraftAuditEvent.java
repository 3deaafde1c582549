package br.com.draftroom.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Trilha de auditoria append-only. Cada linha carrega o hash da anterior da mesma sala.
 */
@Entity
@Table(name = "draft_audit_events", indexes = {
        @Index(name = "idx_audit_room", columnList = "room_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftAuditEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", length = 36, nullable = false)
    private String roomId;

    @Column(length = 40, nullable = false)
    private String action;

    @Column(name = "seat_index")
    private Integer seatIndex;

    @Column(name = "pick_number")
    private Integer pickNumber;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(name = "previous_hash", length = 64)
    private String previousHash;

    @Column(length = 64, nullable = false)
    private String hash;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
