package com.example.rcaengine.rca;

import com.example.rcaengine.domain.Suspect;
import com.example.rcaengine.repository.IncidentRepository;
import com.example.rcaengine.repository.SuspectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists a ranking as the incident's complete suspect list. The previous list
 * is replaced in the same transaction that marks the incident's RCA completed,
 * so readers see either the old list or the new one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuspectStore {

    private static final double SCORE_EPSILON = 1e-9;

    private final SuspectRepository suspectRepository;
    private final IncidentRepository incidentRepository;
    private final Clock clock;

    /**
     * A suspect whose score moved compared to the previous run.
     */
    public record ScoreChange(Suspect suspect, double previousScore) {
    }

    @Transactional
    public List<ScoreChange> replace(String incidentId, RankingResult ranking, RunToken token) {
        if (!token.tryCommit()) {
            throw new RcaRunException(incidentId, "Run aborted before commit");
        }

        Map<String, Double> previousScores = suspectRepository.findByIncidentIdOrderByRankAsc(incidentId).stream()
                .collect(Collectors.toMap(Suspect::getId, Suspect::getScore, (a, b) -> a));
        suspectRepository.deleteByIncident(incidentId);

        Instant now = clock.instant();
        List<Suspect> suspects = new ArrayList<>(ranking.suspects().size());
        for (RankedSuspect ranked : ranking.suspects()) {
            Candidate candidate = ranked.candidate();
            suspects.add(Suspect.builder()
                    .id(Suspect.idFor(incidentId, candidate.suspectType(), candidate.suspectKey()))
                    .incidentId(incidentId)
                    .suspectType(candidate.suspectType())
                    .suspectKey(candidate.suspectKey())
                    .service(candidate.service())
                    .changeTs(candidate.changeTs())
                    .rank(ranked.rank())
                    .score(ranked.score())
                    .evidence(ranked.evidence())
                    .rankingMode(ranking.mode())
                    .modelVersion(ranking.modelVersion())
                    .createdAt(now)
                    .build());
        }
        suspectRepository.saveAll(suspects);
        incidentRepository.markRcaCompleted(incidentId, suspects.size(), now, ranking.mode(), ranking.modelVersion());

        List<ScoreChange> changes = new ArrayList<>();
        for (Suspect suspect : suspects) {
            Double previous = previousScores.get(suspect.getId());
            if (previous != null && Math.abs(previous - suspect.getScore()) > SCORE_EPSILON) {
                changes.add(new ScoreChange(suspect, previous));
            }
        }
        log.debug("Incident {}: stored {} suspects ({} score changes)", incidentId, suspects.size(), changes.size());
        return changes;
    }
}
