package br.com.draftroom.backend.service;

import br.com.draftroom.backend.domain.entity.CatalogPlayer;
import br.com.draftroom.backend.domain.repository.CatalogPlayerRepository;
import br.com.draftroom.backend.service.draft.Player;
import br.com.draftroom.backend.service.draft.PlayerCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Catálogo de jogadores lido do banco. É estático durante um draft, então fica em cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerCatalogService implements PlayerCatalog {

    public static final String CATALOG_CACHE = "catalog-players";
    public static final String PLAYER_CACHE = "catalog-player";

    private final CatalogPlayerRepository catalogPlayerRepository;

    @Override
    @Cacheable(value = PLAYER_CACHE, key = "#playerId")
    @Transactional(readOnly = true)
    public Optional<Player> getPlayer(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return catalogPlayerRepository.findById(playerId).map(this::toPlayer);
    }

    @Override
    @Cacheable(CATALOG_CACHE)
    @Transactional(readOnly = true)
    public List<Player> listAll() {
        List<Player> players = catalogPlayerRepository.findAllByOrderByRankAscIdAsc().stream()
                .map(this::toPlayer)
                .toList();
        log.debug("[Catalog] {} jogadores carregados do banco", players.size());
        return players;
    }

    @Transactional(readOnly = true)
    public long size() {
        return catalogPlayerRepository.count();
    }

    @CacheEvict(value = { CATALOG_CACHE, PLAYER_CACHE }, allEntries = true)
    public void evictCache() {
        log.info("[Catalog] Cache do catálogo invalidado");
    }

    private Player toPlayer(CatalogPlayer entity) {
        return new Player(entity.getId(), entity.getName(), entity.getPosition(), entity.getRank(), entity.getTeam());
    }
}
