package br.com.draftroom.backend.domain.repository;

import br.com.draftroom.backend.domain.entity.CatalogPlayer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CatalogPlayerRepository extends JpaRepository<CatalogPlayer, String> {
    List<CatalogPlayer> findAllByOrderByRankAscIdAsc();
}
