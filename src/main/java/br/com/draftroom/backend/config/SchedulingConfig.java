package br.com.draftroom.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {

    @Override
    public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
        // Pool dedicado para o tick dos drafts
        taskRegistrar.setScheduler(Executors.newScheduledThreadPool(2));
    }

    /**
     * Relógio único do motor; testes substituem por um relógio controlado.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
