package com.example.rcaengine.rca;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.config.RcaProperties.RankingConfig.HeuristicWeights;
import com.example.rcaengine.domain.Evidence;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Weighted sum over evidence features. Used when no learned model is active,
 * when the learned model fails, and as the baseline a retrained model must
 * beat.
 *
 * <pre>
 *   before * w.before
 * + exp(-minutes / decay) * w.recency               (before the incident only)
 * + min(1, max_delta) * w.maxDelta
 * + min(1, delta_count / saturation) * w.deltaCount
 * + clip(error_delta / saturation, 0, 1) * w.errorDelta
 * + new_signature * w.newSignature
 * + keyword_hit * w.keyword
 * + historical_risk * w.history
 * - min(1, minutes_after / ramp) * w.afterPenalty   (after the incident only)
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class HeuristicScorer {

    private final RcaProperties properties;

    public double score(Evidence evidence) {
        HeuristicWeights w = properties.getRanking().getWeights();
        double minutes = evidence.getMinutesBeforeIncident();
        double score = 0.0;

        if (evidence.isBeforeIncident()) {
            score += w.getBeforeIncident();
            score += w.getRecency() * Math.exp(-Math.abs(minutes) / w.getRecencyDecayMinutes());
        } else {
            double minutesAfter = Math.abs(minutes);
            score -= w.getAfterIncidentPenalty() * Math.min(1.0, minutesAfter / w.getAfterIncidentRampMinutes());
        }

        score += w.getMaxMetricDelta() * Math.min(1.0, Math.max(0.0, evidence.getMaxMetricDelta()));
        score += w.getMetricDeltaCount() * Math.min(1.0, evidence.getMetricDeltaCount() / w.getMetricDeltaCountSaturation());
        score += w.getErrorLogDelta() * clip(evidence.getErrorLogDelta() / w.getErrorLogDeltaSaturation());
        if (evidence.isNewErrorSignature()) score += w.getNewErrorSignature();
        if (evidence.isDiffKeywordHit()) score += w.getDiffKeywordHit();
        score += w.getHistoricalRisk() * clip(evidence.getHistoricalRisk());
        return score;
    }

    private static double clip(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.min(1.0, Math.max(0.0, value));
    }
}
