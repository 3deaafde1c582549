package br.com.draftroom.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Linha do log de picks. As duas unique constraints repetem no banco as garantias do arbiter:
 * um pick por número e um jogador por sala.
 */
@Entity
@Table(name = "draft_picks", uniqueConstraints = {
        @UniqueConstraint(name = "uniq_pick_room_number", columnNames = {"room_id", "pick_number"}),
        @UniqueConstraint(name = "uniq_pick_room_player", columnNames = {"room_id", "player_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftPickEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", length = 36, nullable = false)
    private String roomId;

    @Column(name = "pick_number", nullable = false)
    private Integer pickNumber;

    @Column(name = "round_number", nullable = false)
    private Integer round;

    @Column(name = "pick_in_round", nullable = false)
    private Integer pickInRound;

    @Column(name = "seat_index", nullable = false)
    private Integer seatIndex;

    @Column(name = "participant_id", length = 100, nullable = false)
    private String participantId;

    @Column(name = "player_id", length = 64, nullable = false)
    private String playerId;

    @Column(length = 10, nullable = false)
    private String position;

    @Column(length = 20, nullable = false)
    private String origin;

    @Column(name = "committed_at", nullable = false)
    private Instant committedAt;

    @Column(name = "roster_at_pick", columnDefinition = "TEXT")
    private String rosterAtPickJson;
}
