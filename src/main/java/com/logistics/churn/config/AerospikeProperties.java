package com.logistics.churn.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings of the alert and benchmark store.
 */
@Data
@ConfigurationProperties(prefix = "aerospike")
public class AerospikeProperties {

    private boolean enabled = true;

    private String host = "127.0.0.1";

    private int port = 3000;

    private String namespace = "logistics";

    // A batch pass is sequential, so a small pool is enough
    private int maxConnsPerNode = 100;

    private int connectTimeoutMs = 5000;

    private int totalTimeoutMs = 3000;

    private int socketTimeoutMs = 1000;
}
