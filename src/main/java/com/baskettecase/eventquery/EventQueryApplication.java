package com.baskettecase.eventquery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Event Query Core Application
 *
 * Composes parameterized analytics SQL from filter sets and runs it against a PostgreSQL
 * connection resolved per call. Data sources are built by
 * {@link com.baskettecase.eventquery.db.DatabaseClientFactory}, not by Boot auto-configuration.
 */
@Slf4j
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class EventQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventQueryApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Event Query Core is ready!");
        log.info("📊 Metrics available at: /actuator/prometheus");
        log.info("🏥 Health check at: /actuator/health");
    }
}
