package br.com.draftroom.backend.service;

import br.com.draftroom.backend.dto.events.DraftFeedEvent;

/**
 * Cliente inscrito no feed incremental de uma sala.
 *
 * {@link #onEvent} é chamado com o lock da sala segurado, na ordem do log; implementações
 * não devem bloquear.
 */
public interface DraftFeedSubscriber {

    String subscriberId();

    void onEvent(DraftFeedEvent event);
}
