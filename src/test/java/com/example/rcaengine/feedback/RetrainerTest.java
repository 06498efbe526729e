package com.example.rcaengine.feedback;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.Evidence;
import com.example.rcaengine.domain.Label;
import com.example.rcaengine.domain.RankingModelVersion;
import com.example.rcaengine.feedback.Retrainer.Example;
import com.example.rcaengine.feedback.Retrainer.RetrainOutcome;
import com.example.rcaengine.rca.HeuristicScorer;
import com.example.rcaengine.repository.LabelRepository;
import com.example.rcaengine.repository.RankingModelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RetrainerTest {

    private static final Instant NOW = Instant.parse("2024-05-02T09:00:00Z");

    @Mock
    private LabelRepository labelRepository;
    @Mock
    private RankingModelRepository modelRepository;
    @Mock
    private ModelRegistry modelRegistry;

    private RcaProperties properties;
    private Retrainer retrainer;
    private long nextLabelId = 1;

    @BeforeEach
    void setUp() {
        properties = new RcaProperties();
        properties.getFeedback().setTrainingIterations(500);
        retrainer = new Retrainer(properties, labelRepository, modelRepository, modelRegistry,
                new HeuristicScorer(properties), Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC));

        when(modelRegistry.current()).thenReturn(Optional.empty());
        when(modelRegistry.encode(any())).thenReturn("{}");
        when(modelRegistry.promote(any())).thenAnswer(inv -> {
            RankingModelVersion v = inv.getArgument(0);
            v.setVersion(7L);
            v.setStatus(RankingModelVersion.Status.ACTIVE);
            return v;
        });
        when(modelRepository.save(any(RankingModelVersion.class))).thenAnswer(inv -> {
            RankingModelVersion v = inv.getArgument(0);
            v.setVersion(8L);
            return v;
        });
    }

    @Test
    @DisplayName("Should skip retraining below the minimum label count and keep the active model")
    void shouldSkipBelowMinimum() {
        List<Label> labels = new ArrayList<>();
        labels.add(label("inc-1", "a", 1, causeEvidence()));
        labels.add(label("inc-1", "b", 0, noiseEvidence()));
        when(labelRepository.findAllByOrderByIdAsc()).thenReturn(labels);

        RetrainOutcome outcome = retrainer.retrain();

        assertThat(outcome.status()).isEqualTo(Retrainer.Status.SKIPPED);
        assertThat(outcome.labelCount()).isEqualTo(2);
        verify(modelRegistry, never()).promote(any());
        verify(modelRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should activate a model that ranks held-out incidents as well as the heuristic")
    void shouldActivateCompetitiveModel() {
        when(labelRepository.findAllByOrderByIdAsc()).thenReturn(dataset(false));

        RetrainOutcome outcome = retrainer.retrain();

        assertThat(outcome.status()).isEqualTo(Retrainer.Status.ACTIVATED);
        assertThat(outcome.version()).isEqualTo(7L);
        assertThat(outcome.validationScore()).isCloseTo(1.0, within(1e-9));
        assertThat(outcome.validationScore()).isGreaterThanOrEqualTo(outcome.baselineScore());

        ArgumentCaptor<RankingModelVersion> captor = ArgumentCaptor.forClass(RankingModelVersion.class);
        verify(modelRegistry).promote(captor.capture());
        assertThat(captor.getValue().getFeatureSchema()).isEqualTo(Evidence.SCHEMA_ID);
        assertThat(captor.getValue().getLabelCount()).isEqualTo(outcome.labelCount());
        assertThat(captor.getValue().getTrainingExampleCount()).isLessThan(outcome.labelCount());
    }

    @Test
    @DisplayName("Should store but not activate a model that loses to the heuristic")
    void shouldRejectWorseModel() {
        when(labelRepository.findAllByOrderByIdAsc()).thenReturn(dataset(true));

        RetrainOutcome outcome = retrainer.retrain();

        assertThat(outcome.status()).isEqualTo(Retrainer.Status.REJECTED);
        assertThat(outcome.validationScore()).isLessThan(outcome.baselineScore());
        ArgumentCaptor<RankingModelVersion> captor = ArgumentCaptor.forClass(RankingModelVersion.class);
        verify(modelRepository).save(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(RankingModelVersion.Status.REJECTED);
        verify(modelRegistry, never()).promote(any());
    }

    @Test
    @DisplayName("Should retrain automatically only once per new label count")
    void shouldRetrainOncePerLabelCount() {
        when(labelRepository.countLabeledSuspects()).thenReturn(3L);
        retrainer.maybeRetrainAsync();
        verify(labelRepository, never()).findAllByOrderByIdAsc();

        when(labelRepository.countLabeledSuspects()).thenReturn(24L);
        when(labelRepository.findAllByOrderByIdAsc()).thenReturn(dataset(false));
        retrainer.maybeRetrainAsync();
        retrainer.maybeRetrainAsync();

        verify(labelRepository, times(1)).findAllByOrderByIdAsc();
    }

    @Test
    @DisplayName("Should train on the latest label per suspect and skip labels without evidence")
    void shouldUseLatestLabels() {
        List<Example> examples = Retrainer.latestExamples(List.of(
                label("inc-1", "a", 0, causeEvidence()),
                label("inc-1", "b", 0, noiseEvidence()),
                label("inc-1", "a", 1, causeEvidence()),
                label("inc-2", "c", 1, null)));

        assertThat(examples).hasSize(2);
        assertThat(examples).filteredOn(e -> e.suspectKey().equals("a"))
                .singleElement()
                .satisfies(e -> assertThat(e.label()).isEqualTo(1));
    }

    @Test
    @DisplayName("MRR should average 1/rank of the first true cause over incidents with one")
    void shouldComputeMeanReciprocalRank() {
        List<Example> examples = List.of(
                new Example("inc-1", "a", causeEvidence(), 1),
                new Example("inc-1", "b", noiseEvidence(), 0),
                new Example("inc-2", "c", noiseEvidence(), 0),
                new Example("inc-2", "d", causeEvidence(), 1),
                new Example("inc-3", "e", noiseEvidence(), 0));

        // scorer prefers keys later in the alphabet: inc-1 ranks the cause second, inc-2 first
        double mrr = Retrainer.meanReciprocalRank(examples, e -> e.suspectKey().charAt(0));

        assertThat(mrr).isCloseTo((0.5 + 1.0) / 2, within(1e-9));
    }

    @Test
    @DisplayName("Holdout assignment should be stable and disabled for modulus 1")
    void holdoutIsDeterministic() {
        assertThat(Retrainer.isHoldout("inc-42", 5)).isEqualTo(Retrainer.isHoldout("inc-42", 5));
        assertThat(Retrainer.isHoldout("inc-42", 1)).isFalse();
    }

    /**
     * Twenty incidents, each with one true cause and one ruled-out change. When
     * {@code invertTraining} is set the training split labels the opposite of
     * what the evidence suggests, so the model learns the wrong preference.
     */
    private List<Label> dataset(boolean invertTraining) {
        int modulus = properties.getFeedback().getHoldoutModulus();
        List<String> holdoutIds = new ArrayList<>();
        List<String> trainingIds = new ArrayList<>();
        for (int i = 0; holdoutIds.size() < 3 || trainingIds.size() < 9; i++) {
            String id = "inc-" + i;
            if (Retrainer.isHoldout(id, modulus)) {
                if (holdoutIds.size() < 3) holdoutIds.add(id);
            } else if (trainingIds.size() < 9) {
                trainingIds.add(id);
            }
        }

        List<Label> labels = new ArrayList<>();
        for (String id : trainingIds) {
            labels.add(label(id, "cause", invertTraining ? 0 : 1, causeEvidence()));
            labels.add(label(id, "noise", invertTraining ? 1 : 0, noiseEvidence()));
        }
        for (String id : holdoutIds) {
            labels.add(label(id, "cause", 1, causeEvidence()));
            labels.add(label(id, "noise", 0, noiseEvidence()));
        }
        return labels;
    }

    private Label label(String incidentId, String key, int value, Evidence evidence) {
        return Label.builder()
                .id(nextLabelId++)
                .incidentId(incidentId)
                .suspectId(incidentId + ":" + key)
                .suspectKey(key)
                .value(value)
                .evidence(evidence)
                .createdAt(NOW)
                .build();
    }

    private static Evidence causeEvidence() {
        return Evidence.builder()
                .minutesBeforeIncident(5).beforeIncident(true)
                .maxMetricDelta(1.5).metricDeltaCount(2)
                .errorLogDelta(3.0).diffKeywordHit(true)
                .build();
    }

    private static Evidence noiseEvidence() {
        return Evidence.builder()
                .minutesBeforeIncident(-12).beforeIncident(false)
                .build();
    }
}
