package com.logistics.churn.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.logistics.churn.testutil.InMemoryAerospike;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Store beans for @SpringBootTest contexts running with aerospike.enabled=false: the
 * repositories write to an {@link InMemoryAerospike} that tests can inspect.
 */
@TestConfiguration
public class TestAerospikeConfig {

    @Bean
    public InMemoryAerospike inMemoryAerospike() {
        return new InMemoryAerospike();
    }

    @Bean
    public AerospikeClient aerospikeClient(InMemoryAerospike store) {
        return store.client();
    }

    @Bean("aerospikeNamespace")
    public String aerospikeNamespace() {
        return "test";
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        return new Policy();
    }
}
