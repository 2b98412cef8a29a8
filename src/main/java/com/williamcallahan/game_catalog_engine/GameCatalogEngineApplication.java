/**
 * Main application class for the Game Catalog Engine
 *
 * @author William Callahan
 *
 * Features:
 * - Keeps the local game catalog in sync with the IGDB API
 * - Serves layered (Redis, Postgres, IGDB, local) game search
 * - Supports scheduled and admin-triggered catalog synchronization
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.game_catalog_engine;

import java.io.IOException;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class GameCatalogEngineApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(GameCatalogEngineApplication.class, args);
    }

    private static void loadDotEnvFile() {
        java.nio.file.Path envFile = java.nio.file.Paths.get(".env");
        if (!java.nio.file.Files.exists(envFile)) {
            return;
        }
        try {
            java.util.Properties props = new java.util.Properties();
            try (java.io.InputStream is = java.nio.file.Files.newInputStream(envFile)) {
                props.load(is);
            }
            // Real environment variables win over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            System.err.println("[ENV] Failed to load .env file: " + e.getMessage());
        }
    }
}
