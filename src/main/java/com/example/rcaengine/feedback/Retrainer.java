package com.example.rcaengine.feedback;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.config.RcaProperties.FeedbackConfig;
import com.example.rcaengine.domain.Evidence;
import com.example.rcaengine.domain.Label;
import com.example.rcaengine.domain.RankingModelVersion;
import com.example.rcaengine.rca.HeuristicScorer;
import com.example.rcaengine.repository.LabelRepository;
import com.example.rcaengine.repository.RankingModelRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Trains a new learned ranking model from labels and activates it only when
 * it ranks held-out incidents at least as well as the heuristic.
 *
 * <p>Training uses the latest label per (incident, suspect). Incidents are
 * split deterministically: those whose id hash falls on the holdout modulus
 * are used for validation only. Retraining is single-flight and runs on its
 * own executor so it never blocks scoring.
 */
@Slf4j
@Service
public class Retrainer {

    public enum Status {
        ACTIVATED, REJECTED, SKIPPED, BUSY
    }

    public record RetrainOutcome(Status status, Long version, int labelCount,
                                 double validationScore, double baselineScore, String reason) {

        static RetrainOutcome skipped(int labelCount, String reason) {
            return new RetrainOutcome(Status.SKIPPED, null, labelCount, 0, 0, reason);
        }
    }

    /** One labeled suspect as a training example. */
    record Example(String incidentId, String suspectKey, Evidence evidence, int label) {
    }

    private final RcaProperties properties;
    private final LabelRepository labelRepository;
    private final RankingModelRepository modelRepository;
    private final ModelRegistry modelRegistry;
    private final HeuristicScorer heuristicScorer;
    private final Executor retrainExecutor;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong lastAttemptedLabelCount = new AtomicLong(-1);

    public Retrainer(RcaProperties properties,
                     LabelRepository labelRepository,
                     RankingModelRepository modelRepository,
                     ModelRegistry modelRegistry,
                     HeuristicScorer heuristicScorer,
                     @Qualifier("retrainExecutor") Executor retrainExecutor,
                     Clock clock) {
        this.properties = properties;
        this.labelRepository = labelRepository;
        this.modelRepository = modelRepository;
        this.modelRegistry = modelRegistry;
        this.heuristicScorer = heuristicScorer;
        this.retrainExecutor = retrainExecutor;
        this.clock = clock;
    }

    public CompletableFuture<RetrainOutcome> retrainAsync() {
        return CompletableFuture.supplyAsync(this::retrain, retrainExecutor);
    }

    /**
     * Queue a retrain when enough new labels have accumulated since the active
     * version and since the last attempt.
     */
    public void maybeRetrainAsync() {
        long labeled = labelRepository.countLabeledSuspects();
        if (labeled < properties.getFeedback().getMinLabels()) return;
        long activeCount = modelRegistry.current().map(ModelRegistry.ActiveModel::labelCount).orElse(0);
        if (labeled <= activeCount || labeled <= lastAttemptedLabelCount.get()) return;
        if (lock.isLocked()) return;

        log.info("{} labeled suspects available (active model trained on {}), scheduling retrain", labeled, activeCount);
        retrainAsync().whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Automatic retrain failed: {}", error.getMessage(), error);
            }
        });
    }

    @Scheduled(fixedDelayString = "${rca-engine.feedback.retrain-check-interval-ms:300000}",
            initialDelayString = "${rca-engine.feedback.retrain-check-interval-ms:300000}")
    public void checkAutoRetrain() {
        if (properties.getFeedback().isAutoRetrain()) {
            maybeRetrainAsync();
        }
    }

    public RetrainOutcome retrain() {
        if (!lock.tryLock()) {
            log.info("Retrain already in progress, request ignored");
            return new RetrainOutcome(Status.BUSY, null, 0, 0, 0, "retrain already in progress");
        }
        try {
            return doRetrain();
        } finally {
            lock.unlock();
        }
    }

    private RetrainOutcome doRetrain() {
        FeedbackConfig config = properties.getFeedback();
        List<Example> examples = latestExamples(labelRepository.findAllByOrderByIdAsc());
        lastAttemptedLabelCount.set(examples.size());

        if (examples.size() < config.getMinLabels()) {
            log.warn("Retrain skipped: {} labeled examples, {} required", examples.size(), config.getMinLabels());
            return RetrainOutcome.skipped(examples.size(),
                    "need at least " + config.getMinLabels() + " labeled examples, have " + examples.size());
        }

        List<Example> training = new ArrayList<>();
        List<Example> holdout = new ArrayList<>();
        for (Example example : examples) {
            (isHoldout(example.incidentId(), config.getHoldoutModulus()) ? holdout : training).add(example);
        }
        if (!hasBothClasses(training)) {
            log.warn("Retrain skipped: training split needs both positive and negative labels");
            return RetrainOutcome.skipped(examples.size(), "training labels must contain both classes");
        }
        if (holdout.stream().noneMatch(e -> e.label() == 1)) {
            log.warn("Retrain skipped: no held-out incident has a confirmed cause");
            return RetrainOutcome.skipped(examples.size(), "no held-out incident with a confirmed cause");
        }

        LogisticRankingModel model = LogisticRankingModel.fit(
                Evidence.FEATURE_NAMES,
                training.stream().map(e -> e.evidence().toFeatureVector()).toList(),
                training.stream().map(Example::label).toList(),
                config.getTrainingIterations(),
                config.getLearningRate(),
                config.getL2());

        double modelScore = meanReciprocalRank(holdout, e -> model.score(e.evidence().toFeatureVector()));
        double baselineScore = meanReciprocalRank(holdout, e -> heuristicScorer.score(e.evidence()));

        RankingModelVersion candidate = RankingModelVersion.builder()
                .labelCount(examples.size())
                .trainingExampleCount(training.size())
                .featureSchema(Evidence.SCHEMA_ID)
                .parameters(modelRegistry.encode(model))
                .validationScore(modelScore)
                .baselineScore(baselineScore)
                .status(RankingModelVersion.Status.REJECTED)
                .createdAt(clock.instant())
                .build();

        if (modelScore < baselineScore) {
            RankingModelVersion rejected = modelRepository.save(candidate);
            log.warn("Retrained model v{} rejected: holdout MRR {} below heuristic {}", rejected.getVersion(),
                    String.format("%.3f", modelScore), String.format("%.3f", baselineScore));
            return new RetrainOutcome(Status.REJECTED, rejected.getVersion(), examples.size(), modelScore, baselineScore,
                    "validation score below heuristic baseline");
        }

        RankingModelVersion activated = modelRegistry.promote(candidate);
        return new RetrainOutcome(Status.ACTIVATED, activated.getVersion(), examples.size(), modelScore, baselineScore, null);
    }

    /** Latest label per (incident, suspect), skipping labels without evidence. */
    static List<Example> latestExamples(List<Label> labelsOldestFirst) {
        Map<String, Label> latest = new LinkedHashMap<>();
        for (Label label : labelsOldestFirst) {
            latest.put(label.getIncidentId() + '|' + label.getSuspectId(), label);
        }
        return latest.values().stream()
                .filter(l -> l.getEvidence() != null)
                .map(l -> new Example(l.getIncidentId(), l.getSuspectKey(), l.getEvidence(), l.getValue()))
                .toList();
    }

    static boolean isHoldout(String incidentId, int modulus) {
        return modulus > 1 && Math.floorMod(incidentId.hashCode(), modulus) == 0;
    }

    /**
     * Mean over incidents with a confirmed cause of 1 / rank of the first
     * confirmed cause among that incident's labeled suspects.
     */
    static double meanReciprocalRank(List<Example> examples, ToDoubleFunction<Example> scorer) {
        Map<String, List<Example>> byIncident = examples.stream()
                .collect(Collectors.groupingBy(Example::incidentId, LinkedHashMap::new, Collectors.toList()));
        double total = 0;
        int counted = 0;
        for (List<Example> group : byIncident.values()) {
            if (group.stream().noneMatch(e -> e.label() == 1)) continue;
            Map<Example, Double> scores = new LinkedHashMap<>();
            group.forEach(e -> scores.put(e, scorer.applyAsDouble(e)));
            List<Example> ranked = group.stream()
                    .sorted(Comparator.<Example>comparingDouble(scores::get).reversed()
                            .thenComparing(Example::suspectKey))
                    .toList();
            for (int i = 0; i < ranked.size(); i++) {
                if (ranked.get(i).label() == 1) {
                    total += 1.0 / (i + 1);
                    break;
                }
            }
            counted++;
        }
        return counted == 0 ? 0.0 : total / counted;
    }

    private static boolean hasBothClasses(List<Example> examples) {
        boolean positive = examples.stream().anyMatch(e -> e.label() == 1);
        boolean negative = examples.stream().anyMatch(e -> e.label() == 0);
        return positive && negative;
    }
}
