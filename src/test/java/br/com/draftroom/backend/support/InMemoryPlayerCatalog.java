package br.com.draftroom.backend.support;

import br.com.draftroom.backend.service.draft.Player;
import br.com.draftroom.backend.service.draft.PlayerCatalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catálogo fixo para testes. Ids no formato {@code POS-NN}; o rank segue a ordem de inserção.
 */
public class InMemoryPlayerCatalog implements PlayerCatalog {

    private final Map<String, Player> players = new LinkedHashMap<>();

    public InMemoryPlayerCatalog(List<Player> players) {
        players.forEach(p -> this.players.put(p.id(), p));
    }

    /**
     * Catálogo intercalado por posição: QB-01, RB-01, WR-01, TE-01, QB-02...
     * com rank 1, 2, 3... nessa ordem.
     */
    public static InMemoryPlayerCatalog balanced(int perPosition) {
        List<Player> players = new ArrayList<>();
        int rank = 1;
        for (int i = 1; i <= perPosition; i++) {
            for (String position : List.of("QB", "RB", "WR", "TE")) {
                players.add(player(position + "-" + String.format("%02d", i), position, rank++));
            }
        }
        return new InMemoryPlayerCatalog(players);
    }

    public static Player player(String id, String position, double rank) {
        return new Player(id, "Jogador " + id, position, rank, "FA");
    }

    @Override
    public Optional<Player> getPlayer(String playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    @Override
    public List<Player> listAll() {
        return List.copyOf(players.values());
    }
}
