package com.example.rcaengine.rca;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ChangeEvent;
import com.example.rcaengine.domain.Incident;
import com.example.rcaengine.domain.SuspectType;
import com.example.rcaengine.repository.ChangeEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateGeneratorTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ChangeEventRepository changeEventRepository;

    private CandidateGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CandidateGenerator(new RcaProperties(), changeEventRepository);
    }

    @Test
    @DisplayName("Should query the lookback/lookahead window around the incident start")
    void shouldQueryConfiguredWindow() {
        Incident incident = incident(null, "checkout");
        when(changeEventRepository.findInWindow(any(), any(), any())).thenReturn(List.of());

        generator.generate(incident);

        verify(changeEventRepository).findInWindow(eq(Set.of("checkout")),
                eq(START.minusSeconds(2 * 3600)), eq(START.plusSeconds(600)));
    }

    @Test
    @DisplayName("Should emit one candidate per change type and key")
    void shouldDeduplicateByTypeAndKey() {
        when(changeEventRepository.findInWindow(any(), any(), any())).thenReturn(List.of(
                change(SuspectType.DEPLOYMENT, "checkout@abc", "checkout", -5),
                change(SuspectType.DEPLOYMENT, "checkout@abc", "checkout", -20),
                change(SuspectType.CONFIG_CHANGE, "checkout@abc", "checkout", -20)));

        List<Candidate> candidates = generator.generate(incident(null, "checkout"));

        assertThat(candidates).hasSize(2);
        assertThat(candidates.get(0).changeTs()).isEqualTo(START.minusSeconds(5 * 60));
        assertThat(candidates).extracting(Candidate::suspectType)
                .containsExactly(SuspectType.DEPLOYMENT, SuspectType.CONFIG_CHANGE);
    }

    @Test
    @DisplayName("Should drop changes after a known incident end and changes on unrelated services")
    void shouldFilterByEndAndService() {
        when(changeEventRepository.findInWindow(any(), any(), any())).thenReturn(List.of(
                change(SuspectType.DEPLOYMENT, "checkout@late", "checkout", 8),
                change(SuspectType.DEPLOYMENT, "search@1", "search", -3),
                change(SuspectType.CONFIG_CHANGE, "checkout:pool", "checkout", 1)));

        List<Candidate> candidates = generator.generate(incident(START.plusSeconds(4 * 60), "checkout"));

        assertThat(candidates).extracting(Candidate::suspectKey).containsExactly("checkout:pool");
    }

    @Test
    @DisplayName("Should include global flag flips and mark them global")
    void shouldIncludeGlobalFlags() {
        when(changeEventRepository.findInWindow(any(), any(), any())).thenReturn(List.of(
                change(SuspectType.FLAG_CHANGE, "new-pricing", null, -2)));

        List<Candidate> candidates = generator.generate(incident(null, "checkout"));

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).isGlobal()).isTrue();
        assertThat(candidates.get(0).incidentId()).isEqualTo("inc-1");
    }

    @Test
    @DisplayName("Should order by time descending, then type priority, then key")
    void shouldOrderDeterministically() {
        when(changeEventRepository.findInWindow(any(), any(), any())).thenReturn(List.of(
                change(SuspectType.FLAG_CHANGE, "flag-b", "checkout", -10),
                change(SuspectType.CONFIG_CHANGE, "cfg-z", "checkout", -10),
                change(SuspectType.DEPLOYMENT, "dep-2", "checkout", -10),
                change(SuspectType.DEPLOYMENT, "dep-1", "checkout", -10),
                change(SuspectType.FLAG_CHANGE, "flag-a", "checkout", -1)));

        List<Candidate> candidates = generator.generate(incident(null, "checkout"));

        assertThat(candidates).extracting(Candidate::suspectKey)
                .containsExactly("flag-a", "dep-1", "dep-2", "cfg-z", "flag-b");
    }

    @Test
    @DisplayName("Should return nothing for an incident without services")
    void shouldSkipIncidentWithoutServices() {
        Incident incident = incident(null);

        assertThat(generator.generate(incident)).isEmpty();
        verify(changeEventRepository, never()).findInWindow(any(), any(), any());
    }

    private static Incident incident(Instant end, String... services) {
        return Incident.builder()
                .id("inc-1")
                .status(Incident.IncidentStatus.OPEN)
                .startTs(START)
                .endTs(end)
                .lastActivityTs(START)
                .correlationKey(services.length > 0 ? services[0] : "none")
                .services(new LinkedHashSet<>(List.of(services)))
                .build();
    }

    private static ChangeEvent change(SuspectType type, String key, String service, int minutesFromStart) {
        return ChangeEvent.builder()
                .changeType(type)
                .identifier(key)
                .service(service)
                .timestamp(START.plusSeconds(minutesFromStart * 60L))
                .build();
    }
}
