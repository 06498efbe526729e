package com.example.rcaengine.rca;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ChangeEvent;
import com.example.rcaengine.domain.Incident;
import com.example.rcaengine.repository.ChangeEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates the changes that could explain an incident: every deployment,
 * config change and flag flip on an affected service (or global flag) inside
 * {@code [start - lookback, start + lookahead]}, excluding changes after a known
 * incident end. One candidate per (type, key); output order is deterministic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateGenerator {

    static final Comparator<Candidate> ORDER = Comparator
            .comparing(Candidate::changeTs, Comparator.reverseOrder())
            .thenComparingInt(c -> c.suspectType().priority())
            .thenComparing(Candidate::suspectKey);

    private final RcaProperties properties;
    private final ChangeEventRepository changeEventRepository;

    public List<Candidate> generate(Incident incident) {
        if (incident.getServices().isEmpty()) return List.of();

        Instant from = incident.getStartTs().minus(properties.getCandidates().getLookback());
        Instant to = incident.getStartTs().plus(properties.getCandidates().getLookahead());
        Instant end = incident.getEndTs();

        Map<String, Candidate> unique = new LinkedHashMap<>();
        for (ChangeEvent change : changeEventRepository.findInWindow(incident.getServices(), from, to)) {
            if (end != null && change.getTimestamp().isAfter(end)) continue;
            if (change.getService() != null && !incident.getServices().contains(change.getService())) continue;
            unique.putIfAbsent(change.getChangeType().name() + '|' + change.getIdentifier(),
                    Candidate.from(incident.getId(), change));
        }

        List<Candidate> candidates = new ArrayList<>(unique.values());
        candidates.sort(ORDER);
        log.debug("Incident {}: {} candidates in [{} .. {}]", incident.getId(), candidates.size(), from, to);
        return candidates;
    }
}
