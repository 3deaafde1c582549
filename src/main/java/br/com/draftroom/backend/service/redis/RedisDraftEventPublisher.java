package br.com.draftroom.backend.service.redis;

import br.com.draftroom.backend.dto.events.DraftFeedEvent;
import br.com.draftroom.backend.service.DraftEventPublisher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * ✅ Publica o feed de cada sala no Redis Pub/Sub
 *
 * CANAL: draft:{roomId}
 *
 * A publicação sai do lock da sala: uma thread única mantém a ordem dos eventos
 * e a latência do Redis não segura o draft.
 */
@Slf4j
@Service
public class RedisDraftEventPublisher implements DraftEventPublisher {

    public static final String CHANNEL_PREFIX = "draft:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final ExecutorService publisher = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "draft-redis-publisher");
        thread.setDaemon(true);
        return thread;
    });

    public RedisDraftEventPublisher(RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void publish(DraftFeedEvent event) {
        String channel = CHANNEL_PREFIX + event.getRoomId();
        CompletableFuture.runAsync(() -> redisTemplate.convertAndSend(channel, event), publisher)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("❌ [Pub/Sub] Erro ao publicar {} em {}", event.getType(), channel, error);
                    } else {
                        log.debug("📢 [Pub/Sub] {} publicado em {}", event.getType(), channel);
                    }
                });
    }

    @PreDestroy
    public void shutdown() {
        publisher.shutdown();
    }
}
