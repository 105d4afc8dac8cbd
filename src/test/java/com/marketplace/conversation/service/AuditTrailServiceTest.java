package com.marketplace.conversation.service;

import com.aerospike.client.AerospikeException;
import com.marketplace.conversation.config.EngineConfig;
import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.config.RegimeConfig;
import com.marketplace.conversation.engine.GatePolicy;
import com.marketplace.conversation.model.AuditActor;
import com.marketplace.conversation.model.AuditEntry;
import com.marketplace.conversation.model.AuditOutcome;
import com.marketplace.conversation.repository.AuditEntryRepository;
import com.marketplace.conversation.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditTrailServiceTest {

    @Mock private AuditEntryRepository auditRepo;
    @Mock private MetricsConfig metricsConfig;

    private MutableClock clock;
    private EngineConfig engineConfig;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T10:00:00Z"));
        engineConfig = new EngineConfig();
    }

    private AuditTrailService trail(RegimeConfig regime) {
        return new AuditTrailService(auditRepo, GatePolicy.from(regime), engineConfig, metricsConfig, clock);
    }

    @Test
    void record_storesEntryWithTimestampAndDetails() {
        AuditTrailService trail = trail(new RegimeConfig());

        boolean persisted = trail.record("action_approved", "B-1", "PA-1",
                AuditActor.HUMAN, AuditOutcome.APPROVED, Map.of("decidedBy", "ops-ana"));

        assertThat(persisted).isTrue();
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditRepo).save(captor.capture());
        AuditEntry entry = captor.getValue();
        assertThat(entry.getId()).isNotBlank();
        assertThat(entry.getTimestamp()).isEqualTo(clock.millis());
        assertThat(entry.getReferenceId()).isEqualTo("PA-1");
        assertThat(entry.getActor()).isEqualTo(AuditActor.HUMAN);
        assertThat(entry.isCompliance()).isFalse();
        assertThat(entry.getDetails()).containsEntry("decidedBy", "ops-ana");
    }

    @Test
    void record_underSupervisedRegime_isFlaggedForCompliance() {
        RegimeConfig regime = new RegimeConfig();
        regime.setMode(RegimeConfig.Mode.SUPERVISED);
        regime.setRequireHumanConfirmation(true);

        trail(regime).record("action_pending", "B-1", "PA-1", AuditActor.AUTOMATED, AuditOutcome.PENDING, null);

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditRepo).save(captor.capture());
        assertThat(captor.getValue().isCompliance()).isTrue();
        assertThat(captor.getValue().getDetails()).isEmpty();
    }

    @Test
    void record_storeUnavailable_keepsEntryInMemoryAndReportsFailure() {
        doThrow(new AerospikeException("timeout")).when(auditRepo).save(any());
        AuditTrailService trail = trail(new RegimeConfig());

        boolean persisted = trail.record("message_sent", "B-1", "OUT-1",
                AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());

        assertThat(persisted).isFalse();
        assertThat(trail.recent("B-1", 10)).extracting(AuditEntry::getAction).containsExactly("message_sent");
        verify(metricsConfig).recordPersistenceFailure("audit");
    }

    @Test
    void recent_isNewestFirstFilteredAndLimited() {
        AuditTrailService trail = trail(new RegimeConfig());
        trail.record("action_pending", "B-1", "PA-1", AuditActor.AUTOMATED, AuditOutcome.PENDING, Map.of());
        clock.advance(Duration.ofSeconds(1));
        trail.record("send_authorized", "B-2", "OUT-1", AuditActor.AUTOMATED, AuditOutcome.APPROVED, Map.of());
        clock.advance(Duration.ofSeconds(1));
        trail.record("action_rejected", "B-1", "PA-1", AuditActor.HUMAN, AuditOutcome.REJECTED, Map.of());

        List<AuditEntry> forBuyer = trail.recent("B-1", 10);
        assertThat(forBuyer).extracting(AuditEntry::getAction)
                .containsExactly("action_rejected", "action_pending");
        assertThat(trail.recent(null, 2)).extracting(AuditEntry::getAction)
                .containsExactly("action_rejected", "send_authorized");
    }

    @Test
    void recent_dropsOldestBeyondRetention() {
        engineConfig.setAuditRetention(2);
        AuditTrailService trail = trail(new RegimeConfig());
        trail.record("a1", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());
        trail.record("a2", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());
        trail.record("a3", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());

        assertThat(trail.recent("", 10)).extracting(AuditEntry::getAction).containsExactly("a3", "a2");
    }

    @Test
    void recent_afterEviction_readsOlderEntriesFromStore() {
        engineConfig.setAuditRetention(2);
        AuditTrailService trail = trail(new RegimeConfig());
        trail.record("a1", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());
        clock.advance(Duration.ofSeconds(1));
        trail.record("a2", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());
        clock.advance(Duration.ofSeconds(1));
        trail.record("a3", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());

        ArgumentCaptor<AuditEntry> saved = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditRepo, times(3)).save(saved.capture());
        when(auditRepo.findRecent(isNull(), eq(3))).thenReturn(List.of(
                saved.getAllValues().get(2), saved.getAllValues().get(1), saved.getAllValues().get(0)));

        assertThat(trail.recent(null, 3)).extracting(AuditEntry::getAction).containsExactly("a3", "a2", "a1");
    }

    @Test
    void recent_withinRetention_neverReadsStore() {
        AuditTrailService trail = trail(new RegimeConfig());
        trail.record("a1", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());

        assertThat(trail.recent(null, 50)).hasSize(1);

        verify(auditRepo, never()).findRecent(any(), anyInt());
    }

    @Test
    void recent_storeReadFailure_returnsInMemoryEntries() {
        engineConfig.setAuditRetention(1);
        AuditTrailService trail = trail(new RegimeConfig());
        trail.record("a1", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());
        trail.record("a2", "B-1", null, AuditActor.AUTOMATED, AuditOutcome.SENT, Map.of());
        when(auditRepo.findRecent("B-1", 10)).thenThrow(new AerospikeException("scan timeout"));

        assertThat(trail.recent("B-1", 10)).extracting(AuditEntry::getAction).containsExactly("a2");
        verify(metricsConfig).recordPersistenceFailure("audit_read");
    }
}
