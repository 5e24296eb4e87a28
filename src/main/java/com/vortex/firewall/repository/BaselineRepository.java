package com.vortex.firewall.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.vortex.firewall.config.AerospikeConfig;
import com.vortex.firewall.model.BaselineRecord;
import com.vortex.firewall.model.MetricType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One Aerospike record per (metric, campaign). The record key is
 * {@code metric:resourceId}, so a write is an upsert of a single record and
 * there is never more than one live baseline per key.
 */
@Repository
public class BaselineRepository {

    private static final Logger log = LoggerFactory.getLogger(BaselineRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy replacePolicy;
    private final Policy readPolicy;

    public BaselineRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("replaceWritePolicy") WritePolicy replacePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.replacePolicy = replacePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * @return the stored baseline, or null when none has been recorded yet
     */
    public BaselineRecord find(MetricType metricType, String resourceId) {
        Key key = new Key(namespace, AerospikeConfig.SET_BASELINES, BaselineRecord.keyOf(metricType, resourceId));
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return null;
        }
        return mapRecord(record);
    }

    public void save(BaselineRecord baseline) {
        Key key = new Key(namespace, AerospikeConfig.SET_BASELINES,
                BaselineRecord.keyOf(baseline.getMetricType(), baseline.getResourceId()));

        Bin metricBin = new Bin("metricType", baseline.getMetricType().getKey());
        Bin resourceBin = new Bin("resourceId", baseline.getResourceId());
        Bin valueBin = new Bin("value", baseline.getValue());
        Bin samplesBin = new Bin("sampleCount", baseline.getSampleCount());
        Bin updatedAtBin = new Bin("updatedAt", baseline.getUpdatedAt());

        client.put(replacePolicy, key, metricBin, resourceBin, valueBin, samplesBin, updatedAtBin);
    }

    public List<BaselineRecord> findByResourceId(String resourceId) {
        List<BaselineRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BASELINES,
                (key, record) -> {
                    if (!resourceId.equals(record.getString("resourceId"))) {
                        return;
                    }
                    try {
                        BaselineRecord baseline = mapRecord(record);
                        synchronized (results) {
                            results.add(baseline);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize baseline record for {}: {}", resourceId, e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(BaselineRecord::getMetricType));
        return results;
    }

    private BaselineRecord mapRecord(Record record) {
        return BaselineRecord.builder()
                .metricType(MetricType.fromKey(record.getString("metricType")))
                .resourceId(record.getString("resourceId"))
                .value(record.getDouble("value"))
                .sampleCount(record.getLong("sampleCount"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
