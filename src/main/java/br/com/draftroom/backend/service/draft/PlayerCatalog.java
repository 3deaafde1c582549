package br.com.draftroom.backend.service.draft;

import java.util.List;
import java.util.Optional;

/**
 * Catálogo de jogadores consumido pelo motor. Considerado estático durante um draft.
 */
public interface PlayerCatalog {

    Optional<Player> getPlayer(String playerId);

    List<Player> listAll();
}
