package com.sentient.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

/**
 * PlanRecord entity holding one analysed reflection and its weekly plan.
 *
 * Created exactly once by the stream consumer, before any canvas job is
 * scheduled, and mutated at most once more by the artifact worker when the
 * canvas is stored. Rows are never deleted by the service.
 *
 * Primary key is {@code (user_id, created_at)} so a user's plans are read in
 * creation order. The worker addresses rows by {@code record_id} through the
 * {@code idx_plan_user_record} unique index.
 *
 * Status transitions: PENDING → COMPLETED
 *
 * Database Table: plan_records
 */
@Entity
@Table(name = "plan_records", indexes = {
    @Index(name = "idx_plan_user_record", columnList = "user_id, record_id", unique = true)
})
@IdClass(PlanRecordId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanRecord {

    public static final int MAX_TEXT_LENGTH = 10_000;

    @Id
    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Id
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Opaque correlation token generated at ingestion, carried by the canvas job.
     */
    @Column(name = "record_id", nullable = false, updatable = false, length = 64)
    private String recordId;

    @Column(name = "user_text", nullable = false, columnDefinition = "TEXT")
    private String userText;

    @Column(name = "emotion", nullable = false, length = 64)
    private String emotion;

    /**
     * Always within 0..100.
     */
    @Column(name = "sentiment_score", nullable = false)
    private Integer sentimentScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "weekly_plan", columnDefinition = "jsonb")
    private List<DayPlan> weeklyPlan;

    @Column(name = "artifact_url", length = 1024)
    private String artifactUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "artifact_status", nullable = false, length = 20)
    @Builder.Default
    private ArtifactStatus artifactStatus = ArtifactStatus.PENDING;

    @Column(name = "artifact_generated_at")
    private Instant artifactGeneratedAt;

    /**
     * True when the analysis came from the fixed fallback plan.
     */
    @Column(name = "is_fallback", nullable = false)
    @Builder.Default
    private boolean fallback = false;

    /**
     * Canvas generation state of a plan.
     */
    public enum ArtifactStatus {
        /** Canvas job scheduled or not yet processed. */
        PENDING,
        /** Canvas stored and {@code artifactUrl} set. */
        COMPLETED
    }

    /**
     * Mark the canvas as stored.
     *
     * @param url public location of the stored canvas, must not be blank
     * @param generatedAt when the canvas was stored
     * @throws IllegalArgumentException if url is blank
     */
    public void markArtifactCompleted(String url, Instant generatedAt) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Artifact URL cannot be blank for a completed artifact");
        }
        this.artifactUrl = url;
        this.artifactStatus = ArtifactStatus.COMPLETED;
        this.artifactGeneratedAt = generatedAt;
    }

    public boolean isArtifactPending() {
        return artifactStatus != ArtifactStatus.COMPLETED || artifactUrl == null || artifactUrl.isBlank();
    }

    /**
     * Clamp a score into the 0..100 range.
     */
    public static int clampScore(int score) {
        return Math.max(0, Math.min(100, score));
    }

    /**
     * Truncate reflection text to the stored maximum.
     */
    public static String capText(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }
}
