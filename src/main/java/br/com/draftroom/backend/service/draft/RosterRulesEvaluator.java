package br.com.draftroom.backend.service.draft;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Regras de roster: a única restrição de draft é o teto por posição.
 * Funções puras, sem efeito colateral.
 */
@Component
public class RosterRulesEvaluator {

    public boolean canAdd(Map<String, List<String>> roster, String position, PositionLimits limits) {
        String normalized = PositionLimits.normalize(position);
        List<String> atPosition = roster.get(normalized);
        int count = atPosition == null ? 0 : atPosition.size();
        return limits.allows(normalized, count);
    }

    public boolean canAdd(Participant participant, String position, PositionLimits limits) {
        return limits.allows(position, participant.countAt(position));
    }
}
