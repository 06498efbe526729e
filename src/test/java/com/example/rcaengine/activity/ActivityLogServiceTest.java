package com.example.rcaengine.activity;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ActivityEvent;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.gateway.GatewayWebSocketHandler;
import com.example.rcaengine.repository.ActivityEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ActivityLogServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ActivityEventRepository repository;
    @Mock
    private GatewayWebSocketHandler gatewayHandler;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ActivityLogService service;

    @BeforeEach
    void setUp() {
        service = new ActivityLogService(repository, gatewayHandler, new RcaProperties(), new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC), transactionManager);
        when(repository.save(any(ActivityEvent.class))).thenAnswer(inv -> {
            ActivityEvent event = inv.getArgument(0);
            event.setSequence(17L);
            return event;
        });
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("Should persist the event and push it to gateway sessions")
    @SuppressWarnings("unchecked")
    void shouldRecordAndBroadcast() {
        service.record(ActivityType.INCIDENT_CREATED, "checkout", "inc-1",
                "Incident in checkout", Map.of("correlation_key", "checkout"));

        ArgumentCaptor<ActivityEvent> saved = ArgumentCaptor.forClass(ActivityEvent.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getTimestamp()).isEqualTo(NOW);
        assertThat(saved.getValue().getMetadata()).isEqualTo("{\"correlation_key\":\"checkout\"}");
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(gatewayHandler).broadcast(eq(ActivityLogService.NOTIFICATION_METHOD), payload.capture());
        assertThat(payload.getValue())
                .containsEntry("sequence", 17L)
                .containsEntry("type", ActivityType.INCIDENT_CREATED.wireName())
                .containsEntry("incident_id", "inc-1");
    }

    @Test
    @DisplayName("Should write in a transaction of its own")
    void shouldAppendInNewTransaction() {
        service.record(ActivityType.ANOMALY_DETECTED, "checkout", null, "Anomaly", null);

        verify(transactionManager).getTransaction(argThat(definition ->
                definition.getPropagationBehavior() == TransactionDefinition.PROPAGATION_REQUIRES_NEW));
    }

    @Test
    @DisplayName("Should hold events recorded inside a transaction until it commits")
    void shouldDeferUntilCommit() {
        TransactionSynchronizationManager.initSynchronization();

        service.record(ActivityType.INCIDENT_CREATED, "checkout", "inc-1", "Incident in checkout", null);

        verify(repository, never()).save(any(ActivityEvent.class));
        verify(gatewayHandler, never()).broadcast(anyString(), anyMap());

        List<TransactionSynchronization> pending = TransactionSynchronizationManager.getSynchronizations();
        assertThat(pending).hasSize(1);
        pending.forEach(TransactionSynchronization::afterCommit);

        verify(repository).save(any(ActivityEvent.class));
        verify(gatewayHandler).broadcast(eq(ActivityLogService.NOTIFICATION_METHOD), anyMap());
    }

    @Test
    @DisplayName("Should drop events of a transaction that rolls back")
    void shouldDiscardOnRollback() {
        TransactionSynchronizationManager.initSynchronization();

        service.record(ActivityType.INCIDENT_CREATED, "checkout", "inc-1", "Incident in checkout", null);
        TransactionSynchronizationManager.getSynchronizations()
                .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        verify(repository, never()).save(any(ActivityEvent.class));
        verify(gatewayHandler, never()).broadcast(anyString(), anyMap());
    }

    @Test
    @DisplayName("Should never fail the caller when the store is unavailable")
    void shouldSwallowStoreFailure() {
        when(repository.save(any(ActivityEvent.class))).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> service.record(ActivityType.RCA_FAILED, null, "inc-1", "RCA failed", null))
                .doesNotThrowAnyException();
        verify(gatewayHandler, never()).broadcast(anyString(), anyMap());
    }

    @Test
    @DisplayName("Should return the newest events with a default and a capped page size")
    void shouldPageRecentEvents() {
        when(repository.findAllByOrderBySequenceDesc(any(Pageable.class))).thenReturn(List.of());

        service.recent(null);
        service.recent(5_000);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(repository, times(2)).findAllByOrderBySequenceDesc(page.capture());
        assertThat(page.getAllValues()).extracting(Pageable::getPageSize).containsExactly(50, 1000);
    }

    @Test
    @DisplayName("Should clamp page sizes and treat negative cursors as the beginning")
    void shouldClampQuery() {
        when(repository.findSince(eq(0L), isNull(), isNull(), any(Pageable.class))).thenReturn(List.of());

        service.since(-5, 50_000, null, null);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(repository).findSince(eq(0L), isNull(), isNull(), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(1000);
    }
}
