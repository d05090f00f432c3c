package org.healthplatform.warehouse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings of the transform run, bound from {@code transform.*}.
 * Every value can be overridden from the environment.
 */
@Data
@ConfigurationProperties(prefix = "transform")
public class TransformProperties {

    /**
     * Truncates the filtered table to this many rows. Unset means no limit.
     */
    private Integer maxRows;

    private Staging staging = new Staging();

    private Warehouse warehouse = new Warehouse();

    @Data
    public static class Staging {
        private String endpoint = "http://minio:9000";
        private String accessKey = "minioadmin";
        private String secretKey = "minioadmin";
        private String region = "us-east-1";
        private String bucket = "raw-health-data";
        private String prefix = "who_life_expectancy";
    }

    @Data
    public static class Warehouse {
        private String schema = "public";
        private String table = "health_life_expectancy";
        private int copyBufferSize = 65536;
    }
}
