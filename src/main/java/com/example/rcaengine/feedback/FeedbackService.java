package com.example.rcaengine.feedback;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.Label;
import com.example.rcaengine.domain.Suspect;
import com.example.rcaengine.rca.FeatureExtractor;
import com.example.rcaengine.repository.IncidentRepository;
import com.example.rcaengine.repository.LabelRepository;
import com.example.rcaengine.repository.SuspectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records human feedback on suspects. Labels are appended and never change
 * suspect ranks; only a later RCA run or a retrained model does.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final RcaProperties properties;
    private final IncidentRepository incidentRepository;
    private final SuspectRepository suspectRepository;
    private final LabelRepository labelRepository;
    private final FeatureExtractor featureExtractor;
    private final Retrainer retrainer;
    private final ActivityLogService activityLog;
    private final Clock clock;

    public Label submitLabel(String incidentId, String suspectId, Integer value, String annotator, String notes) {
        if (value == null || (value != 0 && value != 1)) {
            throw new LabelRejectedException(LabelRejectedException.Reason.INVALID_VALUE,
                    "Label must be 0 or 1, got " + value);
        }
        if (incidentId == null || !incidentRepository.existsById(incidentId)) {
            throw new LabelRejectedException(LabelRejectedException.Reason.UNKNOWN_INCIDENT,
                    "Unknown incident: " + incidentId);
        }
        Suspect suspect = suspectId == null ? null
                : suspectRepository.findByIdAndIncidentId(suspectId, incidentId).orElse(null);
        if (suspect == null) {
            throw new LabelRejectedException(LabelRejectedException.Reason.UNKNOWN_SUSPECT,
                    "Suspect " + suspectId + " does not belong to incident " + incidentId);
        }

        Label label = labelRepository.save(Label.builder()
                .incidentId(incidentId)
                .suspectId(suspectId)
                .value(value)
                .annotator(annotator)
                .notes(notes)
                .createdAt(clock.instant())
                .suspectType(suspect.getSuspectType())
                .suspectKey(suspect.getSuspectKey())
                .service(suspect.getService())
                .evidence(suspect.getEvidence())
                .build());
        featureExtractor.invalidateHistory();

        log.info("Label {} recorded for suspect {} (rank {}) of incident {}", value, suspect.getSuspectKey(),
                suspect.getRank(), incidentId);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("suspect_id", suspectId);
        metadata.put("suspect_key", suspect.getSuspectKey());
        metadata.put("label", value);
        if (annotator != null) metadata.put("annotator", annotator);
        activityLog.record(ActivityType.LABEL_RECORDED, suspect.getService(), incidentId,
                (value == 1 ? "Confirmed cause: " : "Ruled out: ") + suspect.getSuspectKey(), metadata);

        if (properties.getFeedback().isAutoRetrain()) {
            retrainer.maybeRetrainAsync();
        }
        return label;
    }

    public List<Label> labelsFor(String incidentId) {
        return labelRepository.findByIncidentIdOrderByIdAsc(incidentId);
    }
}
