package br.com.draftroom.backend.exception;

import java.util.List;

/**
 * Configuração de sala inválida. Só acontece na criação; a sala não chega a existir.
 */
public class DraftConfigurationException extends RuntimeException {

    private final List<String> problems;

    public DraftConfigurationException(List<String> problems) {
        super("Configuração de draft inválida: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public DraftConfigurationException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
