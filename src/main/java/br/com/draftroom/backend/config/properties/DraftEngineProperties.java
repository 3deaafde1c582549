package br.com.draftroom.backend.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "draft")
public class DraftEngineProperties {

    private Engine engine = new Engine();
    private Catalog catalog = new Catalog();

    /**
     * Valores usados quando a criação da sala não informa relógio/grace/limites
     */
    private int pickClockSeconds = 30;
    private int gracePeriodSeconds = 2;
    private Map<String, Integer> defaultPositionLimits = new LinkedHashMap<>(Map.of(
            "QB", 4,
            "RB", 10,
            "WR", 11,
            "TE", 5));

    @Data
    public static class Engine {
        private long tickIntervalMs = 1000;
        private long botPickDelayMs = 0;
        private int countdownSeconds = 10;
    }

    @Data
    public static class Catalog {
        private String resource = "classpath:catalog/players.json";
        private boolean seedOnStartup = true;
    }
}
