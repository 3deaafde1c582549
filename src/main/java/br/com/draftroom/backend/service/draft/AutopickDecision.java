package br.com.draftroom.backend.service.draft;

/**
 * Resultado do autopick.
 *
 * @param enforceRosterLimits false apenas no último recurso, quando nenhum jogador
 *                            disponível respeita os limites de posição
 */
public record AutopickDecision(String playerId, PickOrigin origin, boolean enforceRosterLimits) {
}
