package br.com.draftroom.backend.exception;

/**
 * Comando de cliente que não pode ser aplicado no estado atual da sala
 * (edição de fila inválida, assento inexistente...).
 */
public class InvalidDraftCommandException extends RuntimeException {

    public InvalidDraftCommandException(String message) {
        super(message);
    }
}
