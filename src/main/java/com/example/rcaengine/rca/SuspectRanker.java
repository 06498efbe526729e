package com.example.rcaengine.rca;

import com.example.rcaengine.domain.Evidence;
import com.example.rcaengine.feedback.ModelRegistry;
import com.example.rcaengine.feedback.ModelRegistry.ActiveModel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores and orders candidates. Uses the active learned model when there is
 * one and falls back to {@link HeuristicScorer} for the whole run if the model
 * does not fit the feature schema, throws, or returns a non-finite score.
 *
 * <p>Order: score descending, candidates before the incident first, smaller
 * distance to the incident start, deployment before config change before flag
 * change, suspect key. Ranks are 1..N.
 */
@Slf4j
@Component
public class SuspectRanker {

    static final Comparator<Scored> ORDER = Comparator
            .comparingDouble(Scored::score).reversed()
            .thenComparing(s -> !s.evidence().isBeforeIncident())
            .thenComparingDouble(s -> Math.abs(s.evidence().getMinutesBeforeIncident()))
            .thenComparingInt(s -> s.candidate().suspectType().priority())
            .thenComparing(s -> s.candidate().suspectKey());

    private final HeuristicScorer heuristicScorer;
    private final ModelRegistry modelRegistry;
    private final Counter fallbacks;

    public SuspectRanker(HeuristicScorer heuristicScorer, ModelRegistry modelRegistry, MeterRegistry meterRegistry) {
        this.heuristicScorer = heuristicScorer;
        this.modelRegistry = modelRegistry;
        this.fallbacks = Counter.builder("rca.ranker.fallback")
                .description("Ranking runs that fell back from the learned model to the heuristic")
                .register(meterRegistry);
    }

    public RankingResult rank(Map<Candidate, Evidence> evidence) {
        Optional<ActiveModel> snapshot = modelRegistry.current();
        if (snapshot.isPresent()) {
            try {
                List<Scored> scored = scoreLearned(evidence, snapshot.get());
                return new RankingResult(RankingResult.LEARNED, snapshot.get().version(), order(scored));
            } catch (RuntimeException e) {
                fallbacks.increment();
                log.warn("Learned model v{} unusable for this run, falling back to heuristic: {}",
                        snapshot.get().version(), e.getMessage());
            }
        }
        return new RankingResult(RankingResult.HEURISTIC, null, order(scoreHeuristic(evidence)));
    }

    public RankingResult rankHeuristic(Map<Candidate, Evidence> evidence) {
        return new RankingResult(RankingResult.HEURISTIC, null, order(scoreHeuristic(evidence)));
    }

    private List<Scored> scoreHeuristic(Map<Candidate, Evidence> evidence) {
        List<Scored> scored = new ArrayList<>(evidence.size());
        evidence.forEach((c, e) -> {
            double score = heuristicScorer.score(e);
            scored.add(new Scored(c, e, Double.isFinite(score) ? score : Double.NEGATIVE_INFINITY));
        });
        return scored;
    }

    private List<Scored> scoreLearned(Map<Candidate, Evidence> evidence, ActiveModel active) {
        if (!Evidence.FEATURE_NAMES.equals(active.model().getFeatureNames())) {
            throw new IllegalStateException("feature schema mismatch " + active.model().getFeatureNames());
        }
        List<Scored> scored = new ArrayList<>(evidence.size());
        evidence.forEach((c, e) -> {
            double score = active.model().score(e.toFeatureVector());
            if (!Double.isFinite(score)) {
                throw new IllegalStateException("non-finite score for " + c.suspectKey());
            }
            scored.add(new Scored(c, e, score));
        });
        return scored;
    }

    private static List<RankedSuspect> order(List<Scored> scored) {
        scored.sort(ORDER);
        List<RankedSuspect> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored s = scored.get(i);
            ranked.add(new RankedSuspect(s.candidate(), s.evidence(), s.score(), i + 1));
        }
        return ranked;
    }

    record Scored(Candidate candidate, Evidence evidence, double score) {
    }
}
