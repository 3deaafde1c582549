package br.com.draftroom.backend.service;

import br.com.draftroom.backend.dto.events.DraftFeedEvent;

/**
 * Saída do feed para colaboradores externos (notificações, outras instâncias).
 */
public interface DraftEventPublisher {

    void publish(DraftFeedEvent event);
}
