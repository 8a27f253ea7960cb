package com.logistics.churn.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.logistics.churn.config.AerospikeConfig;
import com.logistics.churn.model.AlertSeverity;
import com.logistics.churn.model.AlertType;
import com.logistics.churn.model.ChangeDirection;
import com.logistics.churn.model.RiskLevel;
import com.logistics.churn.model.StoredAlert;
import com.logistics.churn.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Alert store: one record per alert in the {@code alerts} set, keyed by the alert id.
 */
@Repository
public class AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    public static final int DEFAULT_PARTNER_LIMIT = 50;
    public static final int DEFAULT_UNRESOLVED_LIMIT = 100;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Insert an alert. An alert without id gets a generated one.
     *
     * @return the alert as stored, with its id
     */
    public StoredAlert save(StoredAlert alert) {
        if (alert.getId() == null) {
            alert.setId(UUID.randomUUID().toString());
        }
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alert.getId());

        client.put(writePolicy, key,
                new Bin("id", alert.getId()),
                new Bin("partnerId", alert.getPartnerId()),
                new Bin("skuId", alert.getSkuId()),
                new Bin("alertType", alert.getAlertType().getCode()),
                new Bin("severity", alert.getSeverity().getCode()),
                new Bin("scoredSeverity", alert.getScoredSeverity() != null ? alert.getScoredSeverity().name() : null),
                new Bin("timeframe", alert.getTimeframe().getCode()),
                new Bin("message", alert.getMessage()),
                new Bin("benchmarkValue", alert.getBenchmarkValue()),
                new Bin("currentValue", alert.getCurrentValue()),
                new Bin("pctChange", alert.getPercentageChange()),
                new Bin("direction", alert.getDirection() != null ? alert.getDirection().getCode() : null),
                new Bin("isResolved", alert.isResolved() ? 1 : 0),
                new Bin("createdAt", alert.getCreatedAt()),
                new Bin("updatedAt", alert.getUpdatedAt()));

        log.debug("Stored alert {} ({} for partner {})", alert.getId(), alert.getAlertType(), alert.getPartnerId());
        return alert;
    }

    public StoredAlert findById(String id) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Alerts of one partner, newest first.
     */
    public List<StoredAlert> findByPartner(String partnerId, int limit) {
        return scan(limit, record -> partnerId.equals(record.getString("partnerId")));
    }

    /**
     * Unresolved alerts of all partners, newest first.
     */
    public List<StoredAlert> findUnresolved(int limit) {
        return scan(limit, record -> record.getLong("isResolved") == 0);
    }

    /**
     * Mark an alert resolved.
     *
     * @return false when no alert has this id
     */
    public boolean resolve(String id, long now) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, id);
        if (!client.exists(readPolicy, key)) {
            return false;
        }
        client.put(writePolicy, key,
                new Bin("isResolved", 1),
                new Bin("updatedAt", now));
        log.info("Alert {} resolved", id);
        return true;
    }

    private List<StoredAlert> scan(int limit, Predicate<Record> filter) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
        List<StoredAlert> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                (key, record) -> {
                    if (filter.test(record)) {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    }
                });

        results.sort(Comparator.comparingLong(StoredAlert::getCreatedAt).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    private StoredAlert mapRecord(Record record) {
        String scored = record.getString("scoredSeverity");
        return StoredAlert.builder()
                .id(record.getString("id"))
                .partnerId(record.getString("partnerId"))
                .skuId(record.getString("skuId"))
                .alertType(AlertType.fromCode(record.getString("alertType")))
                .severity(AlertSeverity.fromCode(record.getString("severity")))
                .scoredSeverity(scored != null ? RiskLevel.valueOf(scored) : null)
                .timeframe(Timeframe.fromCode(record.getString("timeframe")))
                .message(record.getString("message"))
                .benchmarkValue(record.getString("benchmarkValue"))
                .currentValue(record.getString("currentValue"))
                .percentageChange(record.getString("pctChange"))
                .direction(ChangeDirection.fromCode(record.getString("direction")))
                .resolved(record.getLong("isResolved") != 0)
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
