package org.stellarcalendar;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application class for the Stellar Calendar federation server.
 * Publishes local events to the Fediverse and accepts follows, replies and RSVPs
 * through the ActivityPub protocol.
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class StellarCalendarApplication {

    public static void main(String[] args) {
        SpringApplication.run(StellarCalendarApplication.class, args);
        log.info("Stellar Calendar federation server started");
    }
}
