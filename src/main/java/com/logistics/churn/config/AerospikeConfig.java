package com.logistics.churn.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Store beans for the alert and benchmark repositories. Disabled with
 * {@code aerospike.enabled=false}, in which case another configuration supplies the same beans.
 */
@Configuration
@ConditionalOnProperty(name = "aerospike.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AerospikeProperties.class)
public class AerospikeConfig {

    private static final Logger log = LoggerFactory.getLogger(AerospikeConfig.class);

    public static final String SET_ALERTS = "alerts";
    public static final String SET_BENCHMARKS = "benchmarks";

    private final AerospikeProperties properties;

    public AerospikeConfig(AerospikeProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = properties.getMaxConnsPerNode();
        clientPolicy.timeout = properties.getConnectTimeoutMs();
        applyTimeouts(clientPolicy.readPolicyDefault);
        applyTimeouts(clientPolicy.writePolicyDefault);

        log.info("Connecting to alert store at {}:{} (namespace {})",
                properties.getHost(), properties.getPort(), properties.getNamespace());
        return new AerospikeClient(clientPolicy, properties.getHost(), properties.getPort());
    }

    /**
     * Alerts and benchmarks are rewritten in place by id, and the user key is stored so
     * scans can return it.
     */
    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        applyTimeouts(policy);
        policy.sendKey = true;
        policy.recordExistsAction = RecordExistsAction.UPDATE;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        applyTimeouts(policy);
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return properties.getNamespace();
    }

    private void applyTimeouts(Policy policy) {
        policy.totalTimeout = properties.getTotalTimeoutMs();
        policy.socketTimeout = properties.getSocketTimeoutMs();
    }
}
