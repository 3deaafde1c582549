package br.com.draftroom.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "catalog_players", indexes = {
        @Index(name = "idx_catalog_position", columnList = "position")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogPlayer {
    @Id
    @Column(name = "player_id", length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 10, nullable = false)
    private String position;

    // "rank" é palavra reservada no MySQL 8
    @Column(name = "adp_rank", nullable = false)
    private Double rank;

    @Column(length = 10)
    private String team;
}
