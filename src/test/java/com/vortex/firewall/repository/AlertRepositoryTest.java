package com.vortex.firewall.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.vortex.firewall.config.AerospikeConfig;
import com.vortex.firewall.model.AlertRecord;
import com.vortex.firewall.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.vortex.firewall.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertRepositoryTest {

    @Mock private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private AlertRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AlertRepository(client, "test", writePolicy);
    }

    private static Record record(String alertId, String resourceId, long createdAt) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("alertId", alertId);
        bins.put("alertType", "SPENDING_SPIKE");
        bins.put("message", "spike");
        bins.put("resourceId", resourceId);
        bins.put("severity", "HIGH");
        bins.put("action", "ALERT");
        bins.put("createdAt", createdAt);
        return new Record(bins, 1, 0);
    }

    private void stubScan(Record... records) {
        doAnswer(inv -> {
            ScanCallback callback = inv.getArgument(3);
            for (Record r : records) {
                callback.scanCallback(null, r);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq(AerospikeConfig.SET_ALERTS),
                any(ScanCallback.class));
    }

    @Test
    void save_keysByAlertId() {
        repository.save(createAlert("A-1", "C-1", Severity.HIGH, NOW));

        ArgumentCaptor<Key> key = ArgumentCaptor.forClass(Key.class);
        verify(client).put(same(writePolicy), key.capture(),
                any(Bin.class), any(Bin.class), any(Bin.class), any(Bin.class),
                any(Bin.class), any(Bin.class), any(Bin.class));
        assertThat(key.getValue().setName).isEqualTo(AerospikeConfig.SET_ALERTS);
        assertThat(key.getValue().userKey.toString()).isEqualTo("A-1");
    }

    @Test
    void findRecent_newestFirstAndLimited() {
        stubScan(record("A-1", "C-1", 100L), record("A-3", "C-2", 300L), record("A-2", "C-1", 200L));

        List<AlertRecord> alerts = repository.findRecent(2);

        assertThat(alerts).extracting(AlertRecord::getAlertId).containsExactly("A-3", "A-2");
        assertThat(alerts.get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void findByResourceId_onlyReturnsThatCampaign() {
        stubScan(record("A-1", "C-1", 100L), record("A-3", "C-2", 300L), record("A-2", "C-1", 200L));

        List<AlertRecord> alerts = repository.findByResourceId("C-1", 10);

        assertThat(alerts).extracting(AlertRecord::getAlertId).containsExactly("A-2", "A-1");
    }

    @Test
    void findRecent_skipsMalformedRecords() {
        Record malformed = record("A-bad", "C-1", 250L);
        malformed.bins.remove("severity");
        stubScan(record("A-1", "C-1", 100L), malformed, record("A-2", "C-2", 200L));

        List<AlertRecord> alerts = repository.findRecent(10);

        assertThat(alerts).extracting(AlertRecord::getAlertId).containsExactly("A-2", "A-1");
    }
}
