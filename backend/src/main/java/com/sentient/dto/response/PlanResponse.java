package com.sentient.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentient.entity.DayPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for one stored plan.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "recordId": "9b2f3c1e-6d4a-4f0e-8a51-2c7d9e0b1f34",
 *   "userId": "user-42",
 *   "createdAt": "2025-01-15T10:31:00.123456Z",
 *   "emotion": "anxious",
 *   "sentimentScore": 35,
 *   "weeklyPlan": [ { "day": "Monday", "tasks": ["..."], "focus": "...", "self_care": "..." } ],
 *   "artifact": { "status": "pending", "url": null, "warning": "Visual generation pending. Your plan is ready below." },
 *   "isFallback": false
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanResponse {

    private String recordId;
    private String userId;
    private Instant createdAt;
    private String emotion;
    private Integer sentimentScore;
    private List<DayPlan> weeklyPlan;
    private ArtifactInfo artifact;
    @JsonProperty("isFallback")
    private boolean fallback;
}
