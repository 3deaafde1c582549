package br.com.draftroom.backend.config;

import br.com.draftroom.backend.config.properties.DraftEngineProperties;
import br.com.draftroom.backend.domain.entity.CatalogPlayer;
import br.com.draftroom.backend.domain.repository.CatalogPlayerRepository;
import br.com.draftroom.backend.service.PlayerCatalogService;
import br.com.draftroom.backend.service.draft.PositionLimits;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Popula {@code catalog_players} a partir do JSON de recurso quando a tabela está vazia.
 * Roda antes do ApplicationReadyEvent, então a recuperação de salas já encontra o catálogo.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogSeeder implements CommandLineRunner {

    private final CatalogPlayerRepository catalogPlayerRepository;
    private final PlayerCatalogService playerCatalogService;
    private final DraftEngineProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) throws IOException {
        if (!properties.getCatalog().isSeedOnStartup()) {
            log.info("[Catalog] Seed desabilitado por configuração");
            return;
        }
        long existing = catalogPlayerRepository.count();
        if (existing > 0) {
            log.info("[Catalog] Catálogo já possui {} jogadores, seed ignorado", existing);
            return;
        }
        List<CatalogPlayer> players = load(resourceLoader.getResource(properties.getCatalog().getResource()));
        catalogPlayerRepository.saveAll(players);
        playerCatalogService.evictCache();
        log.info("✅ [Catalog] {} jogadores importados de {}", players.size(), properties.getCatalog().getResource());
    }

    List<CatalogPlayer> load(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            List<SeedPlayer> seed = objectMapper.readValue(in, new TypeReference<List<SeedPlayer>>() {
            });
            return seed.stream()
                    .map(p -> CatalogPlayer.builder()
                            .id(p.id())
                            .name(p.name())
                            .position(PositionLimits.normalize(p.position()))
                            .rank(p.rank())
                            .team(p.team())
                            .build())
                    .toList();
        }
    }

    record SeedPlayer(String id, String name, String position, double rank, String team) {
    }
}
