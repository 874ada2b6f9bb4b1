package dev.pldb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the PLDB ranking engine.
 *
 * <p>Loads the entity records from {@code pldb.ranking.records-dir} and ranks them on startup.
 */
@SpringBootApplication
public class PldbRankApplication {
    public static void main(String[] args) {
        SpringApplication.run(PldbRankApplication.class, args);
    }
}
