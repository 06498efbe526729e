package com.example.rcaengine.feedback;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.Evidence;
import com.example.rcaengine.domain.Label;
import com.example.rcaengine.domain.Suspect;
import com.example.rcaengine.domain.SuspectType;
import com.example.rcaengine.rca.FeatureExtractor;
import com.example.rcaengine.repository.IncidentRepository;
import com.example.rcaengine.repository.LabelRepository;
import com.example.rcaengine.repository.SuspectRepository;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FeedbackServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T13:00:00Z");
    private static final String INCIDENT = "inc-1";
    private static final String SUSPECT = "inc-1:deployment:checkout@abc123";

    @Mock
    private IncidentRepository incidentRepository;
    @Mock
    private SuspectRepository suspectRepository;
    @Mock
    private LabelRepository labelRepository;
    @Mock
    private FeatureExtractor featureExtractor;
    @Mock
    private Retrainer retrainer;
    @Mock
    private ActivityLogService activityLog;

    private RcaProperties properties;
    private FeedbackService service;
    private Suspect suspect;

    @BeforeEach
    void setUp() {
        properties = new RcaProperties();
        service = new FeedbackService(properties, incidentRepository, suspectRepository, labelRepository,
                featureExtractor, retrainer, activityLog, Clock.fixed(NOW, ZoneOffset.UTC));

        suspect = Suspect.builder()
                .id(SUSPECT)
                .incidentId(INCIDENT)
                .suspectType(SuspectType.DEPLOYMENT)
                .suspectKey("checkout@abc123")
                .service("checkout")
                .rank(1)
                .score(9.5)
                .evidence(Evidence.builder().minutesBeforeIncident(5).beforeIncident(true).diffKeywordHit(true).build())
                .build();
        when(incidentRepository.existsById(anyString())).thenReturn(false);
        when(incidentRepository.existsById(INCIDENT)).thenReturn(true);
        when(suspectRepository.findByIdAndIncidentId(anyString(), anyString())).thenReturn(Optional.empty());
        when(suspectRepository.findByIdAndIncidentId(SUSPECT, INCIDENT)).thenReturn(Optional.of(suspect));
        when(labelRepository.save(any(Label.class))).then(returnsFirstArg());
    }

    @Test
    @DisplayName("Should store the label with a snapshot of the suspect and its evidence")
    void shouldRecordLabelSnapshot() {
        Label label = service.submitLabel(INCIDENT, SUSPECT, 1, "oncall", "rolled back, latency recovered");

        assertThat(label.getValue()).isEqualTo(1);
        assertThat(label.isTrueCause()).isTrue();
        assertThat(label.getSuspectType()).isEqualTo(SuspectType.DEPLOYMENT);
        assertThat(label.getSuspectKey()).isEqualTo("checkout@abc123");
        assertThat(label.getService()).isEqualTo("checkout");
        assertThat(label.getEvidence()).isEqualTo(suspect.getEvidence());
        assertThat(label.getCreatedAt()).isEqualTo(NOW);
        verify(featureExtractor).invalidateHistory();
        verify(activityLog).record(eq(ActivityType.LABEL_RECORDED), eq("checkout"), eq(INCIDENT), anyString(), any());
        verify(retrainer).maybeRetrainAsync();
    }

    @Test
    @DisplayName("Labels should never reorder or rewrite suspects")
    void labelDoesNotTouchSuspects() {
        service.submitLabel(INCIDENT, SUSPECT, 0, null, null);

        verify(suspectRepository, never()).save(any());
        verify(suspectRepository, never()).saveAll(any());
        verify(suspectRepository, never()).deleteByIncident(anyString());
        verify(incidentRepository, never()).markRcaCompleted(anyString(), anyInt(), any(), any(), any());
        assertThat(suspect.getRank()).isEqualTo(1);
        assertThat(suspect.getScore()).isEqualTo(9.5);
    }

    @Test
    @DisplayName("Should not trigger retraining when auto-retrain is off")
    void shouldRespectAutoRetrainSwitch() {
        properties.getFeedback().setAutoRetrain(false);

        service.submitLabel(INCIDENT, SUSPECT, 1, null, null);

        verifyNoInteractions(retrainer);
    }

    @Test
    @DisplayName("Should reject label values other than 0 and 1")
    void shouldRejectInvalidValue() {
        assertRejected(() -> service.submitLabel(INCIDENT, SUSPECT, 2, null, null), LabelRejectedException.Reason.INVALID_VALUE);
        assertRejected(() -> service.submitLabel(INCIDENT, SUSPECT, null, null, null), LabelRejectedException.Reason.INVALID_VALUE);
        verify(labelRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject labels for unknown incidents")
    void shouldRejectUnknownIncident() {
        assertRejected(() -> service.submitLabel("inc-404", SUSPECT, 1, null, null), LabelRejectedException.Reason.UNKNOWN_INCIDENT);
        verify(labelRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject suspects that do not belong to the incident")
    void shouldRejectForeignSuspect() {
        when(incidentRepository.existsById("inc-2")).thenReturn(true);

        assertRejected(() -> service.submitLabel("inc-2", SUSPECT, 1, null, null), LabelRejectedException.Reason.UNKNOWN_SUSPECT);
        assertRejected(() -> service.submitLabel(INCIDENT, "nope", 1, null, null), LabelRejectedException.Reason.UNKNOWN_SUSPECT);
        verify(labelRepository, never()).save(any());
        verifyNoInteractions(activityLog);
    }

    private static void assertRejected(ThrowingCallable call, LabelRejectedException.Reason reason) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(LabelRejectedException.class, e -> assertThat(e.getReason()).isEqualTo(reason));
    }
}
