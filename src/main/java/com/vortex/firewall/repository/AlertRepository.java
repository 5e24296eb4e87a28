package com.vortex.firewall.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.vortex.firewall.config.AerospikeConfig;
import com.vortex.firewall.model.AlertRecord;
import com.vortex.firewall.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
public class AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(AlertRecord alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alert.getAlertId());

        Bin alertIdBin = new Bin("alertId", alert.getAlertId());
        Bin alertTypeBin = new Bin("alertType", alert.getAlertType());
        Bin messageBin = new Bin("message", alert.getMessage());
        Bin resourceIdBin = new Bin("resourceId", alert.getResourceId());
        Bin severityBin = new Bin("severity", alert.getSeverity().name());
        Bin actionBin = new Bin("action", alert.getAction());
        Bin createdAtBin = new Bin("createdAt", alert.getCreatedAt());

        client.put(writePolicy, key,
                alertIdBin, alertTypeBin, messageBin, resourceIdBin,
                severityBin, actionBin, createdAtBin);
    }

    public List<AlertRecord> findRecent(int limit) {
        return scan(alert -> true, limit);
    }

    public List<AlertRecord> findByResourceId(String resourceId, int limit) {
        return scan(alert -> resourceId.equals(alert.getResourceId()), limit);
    }

    private List<AlertRecord> scan(Predicate<AlertRecord> filter, int limit) {
        List<AlertRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                (key, record) -> {
                    try {
                        AlertRecord alert = mapRecord(record);
                        if (filter.test(alert)) {
                            synchronized (results) {
                                results.add(alert);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize alert record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AlertRecord::getCreatedAt).reversed());
        if (results.size() > limit) {
            return results.subList(0, limit);
        }
        return results;
    }

    private AlertRecord mapRecord(Record record) {
        return AlertRecord.builder()
                .alertId(record.getString("alertId"))
                .alertType(record.getString("alertType"))
                .message(record.getString("message"))
                .resourceId(record.getString("resourceId"))
                .severity(Severity.valueOf(record.getString("severity")))
                .action(record.getString("action"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
