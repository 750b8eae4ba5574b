package com.sentient.service;

import com.sentient.entity.PlanRecord;
import com.sentient.repository.PlanRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Writes plan records and applies the canvas back-fill.
 *
 * Every call to {@link #put} creates a new row; identical text submitted twice
 * yields two records. {@link #update} resolves the row by {@code recordId}
 * through the secondary index, since the worker does not know the creation
 * timestamp that forms part of the primary key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlanStoreWriter {

    private final PlanRecordRepository planRecordRepository;
    private final Clock clock;

    /**
     * Persist a freshly analysed reflection with a pending canvas.
     *
     * @param userId owning user
     * @param recordId correlation token generated for this ingestion
     * @param text reflection text, truncated to {@link PlanRecord#MAX_TEXT_LENGTH}
     * @param analysis analysis result or fallback
     * @return the stored record
     */
    @Transactional
    public PlanRecord put(String userId, String recordId, String text, PlanAnalysis analysis) {
        // Postgres keeps microsecond precision; truncate so the key reads back identically
        Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MICROS);

        PlanRecord record = PlanRecord.builder()
                .userId(userId)
                .createdAt(createdAt)
                .recordId(recordId)
                .userText(PlanRecord.capText(text))
                .emotion(analysis.emotion())
                .sentimentScore(PlanRecord.clampScore(analysis.sentimentScore()))
                .weeklyPlan(analysis.weeklyPlan())
                .artifactStatus(PlanRecord.ArtifactStatus.PENDING)
                .fallback(analysis.fallback())
                .build();

        PlanRecord saved = planRecordRepository.save(record);
        log.info("Plan record stored: recordId={}, userId={}, emotion={}, fallback={}",
                recordId, userId, analysis.emotion(), analysis.fallback());
        return saved;
    }

    /**
     * Back-fill the canvas location of an existing record.
     *
     * @param userId owning user
     * @param recordId correlation token from the canvas job
     * @param artifactUrl public location of the stored canvas
     * @return true if the record was found and updated, false if no record matched
     */
    @Transactional
    public boolean update(String userId, String recordId, String artifactUrl) {
        Optional<PlanRecord> found = planRecordRepository.findByUserIdAndRecordId(userId, recordId);
        if (found.isEmpty()) {
            log.warn("Plan record not found for back-fill: recordId={}, userId={}", recordId, userId);
            return false;
        }

        PlanRecord record = found.get();
        record.markArtifactCompleted(artifactUrl, clock.instant());
        planRecordRepository.save(record);

        log.info("Plan record back-filled: recordId={}, userId={}, url={}", recordId, userId, artifactUrl);
        return true;
    }
}
