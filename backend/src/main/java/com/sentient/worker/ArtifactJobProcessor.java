package com.sentient.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentient.exception.ProcessingException;
import com.sentient.messaging.ArtifactJobMessage;
import com.sentient.messaging.ReflectionInput;
import com.sentient.service.PlanStoreWriter;
import com.sentient.storage.ArtifactKeys;
import com.sentient.storage.ArtifactStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles a single canvas job: render, upload, back-fill.
 *
 * The upload always completes before the store update is attempted. Any
 * exception thrown from {@link #process(byte[])} means the job must stay on
 * the queue; every returned {@link Outcome} means it can be acknowledged.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ArtifactJobProcessor {

    private final ObjectMapper objectMapper;
    private final CanvasGenerator canvasGenerator;
    private final ArtifactStorage artifactStorage;
    private final PlanStoreWriter planStoreWriter;
    private final Clock clock;

    public enum Outcome {
        /** Canvas stored and record back-filled. */
        COMPLETED,
        /** Canvas stored but no record matched; the job is dropped. */
        RECORD_MISSING,
        /** Job body unusable; the job is dropped. */
        MALFORMED
    }

    /**
     * @param body raw job payload
     * @return terminal outcome of the job
     * @throws ProcessingException if upload or back-fill failed and the job should be retried
     */
    public Outcome process(byte[] body) {
        ArtifactJobMessage job;
        try {
            job = objectMapper.readValue(body, ArtifactJobMessage.class);
        } catch (IOException e) {
            log.error("Dropping malformed canvas job: {}", e.getMessage());
            return Outcome.MALFORMED;
        }

        if (job == null || isBlank(job.recordId())) {
            log.error("Dropping canvas job without record_id: {}", job);
            return Outcome.MALFORMED;
        }

        String userId = isBlank(job.userId()) ? ReflectionInput.ANONYMOUS_USER : job.userId();

        log.info("Processing canvas job: recordId={}, userId={}, emotion={}",
                job.recordId(), userId, job.emotion());

        // Step 1: render
        EmotionCanvas canvas = EmotionCanvas.resolve(job.emotion());
        String content = canvasGenerator.render(canvas, job.recordId());

        // Step 2: upload
        Instant now = clock.instant();
        String key = ArtifactKeys.canvasKey(userId, job.recordId(), now);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("record_id", job.recordId());
        metadata.put("user_id", userId);
        metadata.put("generated_at", now.toString());

        String url = artifactStorage.store(key, content, metadata);

        // Step 3: back-fill
        boolean updated;
        try {
            updated = planStoreWriter.update(userId, job.recordId(), url);
        } catch (DataAccessException e) {
            throw ProcessingException.storeUpdateFailed(job.recordId(), e);
        }

        if (!updated) {
            log.warn("Canvas stored but plan record is missing, dropping job: recordId={}, url={}",
                    job.recordId(), url);
            return Outcome.RECORD_MISSING;
        }

        log.info("Canvas job completed: recordId={}, canvas={}, url={}", job.recordId(), canvas, url);
        return Outcome.COMPLETED;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
