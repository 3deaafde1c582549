package br.com.draftroom.backend.service.draft;

/**
 * Jogador do catálogo externo (somente leitura dentro do motor).
 *
 * @param id       id estável do catálogo
 * @param name     nome para exibição
 * @param position posição normalizada (QB, RB, WR, TE...)
 * @param rank     rank/ADP, menor é melhor
 * @param team     time de origem (informativo)
 */
public record Player(String id, String name, String position, double rank, String team) {

    public Player {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Player id é obrigatório");
        }
        if (position == null || position.isBlank()) {
            throw new IllegalArgumentException("Player " + id + " sem posição");
        }
        position = PositionLimits.normalize(position);
    }
}
