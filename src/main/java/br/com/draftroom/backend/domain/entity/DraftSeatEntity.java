package br.com.draftroom.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "draft_seats", uniqueConstraints = {
        @UniqueConstraint(name = "uniq_seat_room_index", columnNames = {"room_id", "seat_index"}),
        @UniqueConstraint(name = "uniq_seat_room_participant", columnNames = {"room_id", "participant_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftSeatEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", length = 36, nullable = false)
    private String roomId;

    @Column(name = "seat_index", nullable = false)
    private Integer seatIndex;

    @Column(name = "participant_id", length = 100, nullable = false)
    private String participantId;

    @Column(nullable = false)
    private Boolean bot;

    @Column(nullable = false)
    private Boolean ready;

    @Column(name = "queue", columnDefinition = "TEXT")
    private String queueJson;

    @Column(name = "autodraft_limits", columnDefinition = "TEXT")
    private String autodraftLimitsJson;
}
