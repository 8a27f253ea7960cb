package com.logistics.churn.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.logistics.churn.config.AerospikeConfig;
import com.logistics.churn.model.Benchmark;
import com.logistics.churn.model.BenchmarkMetric;
import com.logistics.churn.model.BenchmarkPeriod;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Benchmark store: one record per (partner, SKU, metric, period). Writing the same key
 * again replaces the value.
 */
@Repository
public class BenchmarkRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public BenchmarkRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void upsert(Benchmark benchmark) {
        Key key = new Key(namespace, AerospikeConfig.SET_BENCHMARKS, benchmark.benchmarkKey());
        client.put(writePolicy, key,
                new Bin("partnerId", benchmark.getPartnerId()),
                new Bin("skuId", benchmark.getSkuId()),
                new Bin("metricType", benchmark.getMetric().getCode()),
                new Bin("period", benchmark.getPeriod().getCode()),
                new Bin("value", benchmark.getValue()),
                new Bin("updatedAt", benchmark.getUpdatedAt()));
    }

    public void upsertAll(List<Benchmark> benchmarks) {
        for (Benchmark benchmark : benchmarks) {
            upsert(benchmark);
        }
    }

    public List<Benchmark> findByPartner(String partnerId) {
        List<Benchmark> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BENCHMARKS,
                (key, record) -> {
                    if (partnerId.equals(record.getString("partnerId"))) {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    }
                });
        return results;
    }

    public List<Benchmark> findAll() {
        List<Benchmark> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BENCHMARKS,
                (key, record) -> {
                    synchronized (results) {
                        results.add(mapRecord(record));
                    }
                });
        return results;
    }

    private Benchmark mapRecord(Record record) {
        return Benchmark.builder()
                .partnerId(record.getString("partnerId"))
                .skuId(record.getString("skuId"))
                .metric(BenchmarkMetric.fromCode(record.getString("metricType")))
                .period(BenchmarkPeriod.fromCode(record.getString("period")))
                .value(record.getDouble("value"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
