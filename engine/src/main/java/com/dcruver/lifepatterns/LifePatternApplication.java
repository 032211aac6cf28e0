package com.dcruver.lifepatterns;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Life Pattern Intelligence engine.
 *
 * Turns a month or so of daily journal entries (text, voice transcript, image
 * caption) into themes, weekly trends, anomalies, cycles and insights.
 *
 * All insights are observational and advisory, never diagnostic.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class LifePatternApplication {

    public static void main(String[] args) {
        log.info("Starting Life Pattern Intelligence engine...");
        SpringApplication.run(LifePatternApplication.class, args);
    }
}
