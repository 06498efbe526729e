package com.example.rcaengine.feedback;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.Evidence;
import com.example.rcaengine.domain.RankingModelVersion;
import com.example.rcaengine.repository.RankingModelRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the active learned ranking model. Readers take one immutable snapshot
 * per RCA run; promotion swaps the pointer only after the new version is
 * committed as ACTIVE. Promotions are serialized so that at most one version
 * is ACTIVE and the pointer names the row that is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRegistry {

    private final RankingModelRepository repository;
    private final ActivityLogService activityLog;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<ActiveModel> active = new AtomicReference<>();
    private final ReentrantLock promotionLock = new ReentrantLock();

    public record ActiveModel(long version, int labelCount, LogisticRankingModel model) {
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadActive() {
        repository.findFirstByStatus(RankingModelVersion.Status.ACTIVE).ifPresentOrElse(v -> {
            try {
                active.set(new ActiveModel(v.getVersion(), v.getLabelCount(), decode(v)));
                log.info("Loaded active ranking model v{}", v.getVersion());
            } catch (RuntimeException e) {
                log.warn("Active ranking model v{} is unusable, ranking stays heuristic: {}", v.getVersion(), e.getMessage());
            }
        }, () -> log.info("No active ranking model, ranking is heuristic"));
    }

    public Optional<ActiveModel> current() {
        return Optional.ofNullable(active.get());
    }

    /**
     * Mark the given version ACTIVE, retire the previous one and swap the
     * in-memory pointer.
     */
    public RankingModelVersion promote(RankingModelVersion candidate) {
        LogisticRankingModel model = decode(candidate);
        RankingModelVersion saved;
        promotionLock.lock();
        try {
            saved = transactionTemplate.execute(status -> {
                for (RankingModelVersion previous : repository.findByStatus(RankingModelVersion.Status.ACTIVE)) {
                    if (!previous.getVersion().equals(candidate.getVersion())) {
                        previous.setStatus(RankingModelVersion.Status.RETIRED);
                        repository.save(previous);
                    }
                }
                candidate.setStatus(RankingModelVersion.Status.ACTIVE);
                candidate.setActivatedAt(clock.instant());
                return repository.save(candidate);
            });
            active.set(new ActiveModel(saved.getVersion(), saved.getLabelCount(), model));
        } finally {
            promotionLock.unlock();
        }

        log.info("Ranking model v{} activated (validation MRR {} vs heuristic {})", saved.getVersion(),
                String.format("%.3f", saved.getValidationScore()), String.format("%.3f", saved.getBaselineScore()));
        activityLog.record(ActivityType.MODEL_ACTIVATED, null, null,
                "Ranking model v" + saved.getVersion() + " activated",
                Map.of("version", saved.getVersion(),
                        "label_count", saved.getLabelCount(),
                        "validation_score", saved.getValidationScore()));
        return saved;
    }

    /**
     * Re-activate a stored version, e.g. to roll back.
     */
    public RankingModelVersion activate(long version) {
        RankingModelVersion stored = repository.findById(version)
                .orElseThrow(() -> new IllegalArgumentException("Unknown model version: " + version));
        if (stored.getStatus() == RankingModelVersion.Status.REJECTED) {
            throw new IllegalArgumentException("Model version " + version + " failed validation and cannot be activated");
        }
        if (stored.getStatus() == RankingModelVersion.Status.ACTIVE && current().map(ActiveModel::version).orElse(-1L) == version) {
            return stored;
        }
        return promote(stored);
    }

    public List<RankingModelVersion> listVersions() {
        return repository.findAllByOrderByVersionDesc();
    }

    public String encode(LogisticRankingModel model) {
        try {
            return objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode ranking model", e);
        }
    }

    LogisticRankingModel decode(RankingModelVersion version) {
        if (!Evidence.SCHEMA_ID.equals(version.getFeatureSchema())) {
            throw new IllegalArgumentException("Model v" + version.getVersion()
                    + " was trained on a different feature schema");
        }
        try {
            return objectMapper.readValue(version.getParameters(), LogisticRankingModel.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt parameters for model v" + version.getVersion(), e);
        }
    }
}
