package org.healthplatform.warehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the life expectancy warehouse transformer.
 *
 * Takes the latest raw WHO life expectancy snapshot from the staging bucket, validates and
 * normalizes it, and bulk-loads it into the PostgreSQL warehouse. Each start runs the
 * transform job once and exits with a non-zero code if it failed.
 */
@SpringBootApplication
public class WarehouseTransformApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(WarehouseTransformApplication.class, args)
        ));
    }
}
