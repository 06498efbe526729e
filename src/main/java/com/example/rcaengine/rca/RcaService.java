package com.example.rcaengine.rca;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.Evidence;
import com.example.rcaengine.domain.Incident;
import com.example.rcaengine.domain.RcaStatus;
import com.example.rcaengine.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One RCA pass over an incident: candidates, evidence, ranking, replace-all
 * persistence. Scheduling, mutual exclusion and timeouts belong to
 * {@link RcaRunCoordinator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RcaService {

    private final IncidentRepository incidentRepository;
    private final CandidateGenerator candidateGenerator;
    private final FeatureExtractor featureExtractor;
    private final SuspectRanker suspectRanker;
    private final SuspectStore suspectStore;
    private final ActivityLogService activityLog;

    /**
     * Mark the incident's RCA as in progress. Returns the status to restore if
     * the run fails.
     */
    public RcaStatus begin(String incidentId) {
        Incident incident = incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
        RcaStatus previous = incident.getRcaStatus() == RcaStatus.IN_PROGRESS
                ? RcaStatus.NOT_STARTED
                : incident.getRcaStatus();
        incidentRepository.updateRcaStatus(incidentId, RcaStatus.IN_PROGRESS);
        activityLog.record(ActivityType.RCA_STARTED, null, incidentId, "RCA started for " + incident.getTitle(), null);
        return previous;
    }

    public RankingResult execute(String incidentId, RunToken token) {
        Incident incident = incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));

        List<Candidate> candidates = candidateGenerator.generate(incident);
        Map<Candidate, Evidence> evidence = candidates.isEmpty()
                ? new LinkedHashMap<>()
                : featureExtractor.extractAll(incident, candidates, token);
        if (token.isAborted()) {
            throw new RcaRunException(incidentId, "Run aborted during feature extraction");
        }

        RankingResult ranking = suspectRanker.rank(evidence);
        List<SuspectStore.ScoreChange> changes = suspectStore.replace(incidentId, ranking, token);

        log.info("RCA completed for incident {}: {} suspects ({} of {} candidates, {} ranking{})",
                incidentId, ranking.suspects().size(), evidence.size(), candidates.size(), ranking.mode(),
                ranking.modelVersion() != null ? " v" + ranking.modelVersion() : "");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("suspects_count", ranking.suspects().size());
        metadata.put("ranking_mode", ranking.mode());
        if (ranking.modelVersion() != null) metadata.put("model_version", ranking.modelVersion());
        if (!ranking.suspects().isEmpty()) metadata.put("top_suspect", ranking.suspects().get(0).candidate().suspectKey());
        activityLog.record(ActivityType.SUSPECTS_GENERATED, null, incidentId,
                ranking.suspects().size() + " suspects ranked", metadata);

        for (SuspectStore.ScoreChange change : changes) {
            activityLog.record(ActivityType.SUSPECT_SCORE_UPDATED, change.suspect().getService(), incidentId,
                    "Score changed for " + change.suspect().getSuspectKey(),
                    Map.of("suspect_id", change.suspect().getId(),
                            "previous_score", change.previousScore(),
                            "score", change.suspect().getScore(),
                            "rank", change.suspect().getRank()));
        }
        return ranking;
    }
}
