package com.sentient.service;

import com.sentient.dto.response.ArtifactInfo;
import com.sentient.dto.response.PlanListResponse;
import com.sentient.dto.response.PlanResponse;
import com.sentient.entity.PlanRecord;
import com.sentient.exception.PlanNotFoundException;
import com.sentient.repository.PlanRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * Reads a user's most recent plans.
 *
 * Reads never wait on the artifact worker: plans with a pending canvas are
 * returned with a warning instead of being held back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlanQueryService {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;

    private final PlanRecordRepository planRecordRepository;

    /**
     * @param userId owning user
     * @param limit requested number of plans, clamped to 1..50; null means 10
     * @return plans, most recent first
     * @throws PlanNotFoundException if the user has no plans
     */
    @Transactional(readOnly = true)
    public PlanListResponse getRecentPlans(String userId, Integer limit) {
        int effectiveLimit = clampLimit(limit);

        List<PlanRecord> records = planRecordRepository.findRecentByUserId(
                userId, PageRequest.of(0, effectiveLimit));

        if (records.isEmpty()) {
            throw new PlanNotFoundException(userId);
        }

        List<PlanResponse> plans = records.stream()
                .map(this::toResponse)
                .toList();

        long pendingCount = records.stream()
                .filter(r -> r.getArtifactStatus() == PlanRecord.ArtifactStatus.PENDING)
                .count();

        PlanListResponse.PlanListResponseBuilder response = PlanListResponse.builder()
                .userId(userId)
                .planCount(plans.size())
                .plans(plans);

        if (pendingCount > 0) {
            response.notice(pendingCount + " plan(s) have visual generation pending");
        }

        log.info("Returning {} plans for user: {} (pending canvases: {})", plans.size(), userId, pendingCount);
        return response.build();
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    private PlanResponse toResponse(PlanRecord record) {
        ArtifactInfo artifact = ArtifactInfo.builder()
                .status(record.getArtifactStatus().name().toLowerCase(Locale.ROOT))
                .url(record.getArtifactUrl())
                .warning(record.isArtifactPending() ? ArtifactInfo.PENDING_WARNING : null)
                .build();

        return PlanResponse.builder()
                .recordId(record.getRecordId())
                .userId(record.getUserId())
                .createdAt(record.getCreatedAt())
                .emotion(record.getEmotion())
                .sentimentScore(record.getSentimentScore())
                .weeklyPlan(record.getWeeklyPlan())
                .artifact(artifact)
                .fallback(record.isFallback())
                .build();
    }
}
