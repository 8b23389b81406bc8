package com.poc.chmigrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MySQL to ClickHouse migration service.
 * @EnableAsync is configured in AsyncConfiguration, JPA repositories in DatabaseConfiguration.
 */
@SpringBootApplication
public class ChMigratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChMigratorApplication.class, args);
    }
}
