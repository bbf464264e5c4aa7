package dao.tron.txverify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "storage")
@Data
public class StorageProperties {

    /**
     * http: fetch batch contents over HTTPS (S3 or any static host).
     * in-memory: local map, for development and tests.
     */
    private String mode = "http";

    /**
     * Base URL for storage references that are plain keys.
     * Example: https://etrap-batches.s3.us-west-2.amazonaws.com
     */
    private String baseUrl;

    /**
     * Region used to turn s3://bucket/key references into virtual-hosted HTTPS URLs.
     * Default: us-west-2
     */
    private String region = "us-west-2";

    private long connectTimeoutMs = 5000;

    private long readTimeoutMs = 15000;
}
