package com.sentient.service;

import com.sentient.entity.DayPlan;

import java.util.List;

/**
 * Result of analysing one reflection.
 *
 * @param emotion primary emotion label as returned by the model
 * @param sentimentScore score clamped to 0..100
 * @param weeklyPlan seven planned days
 * @param fallback true when the fixed fallback plan was used instead of a model result
 */
public record PlanAnalysis(
        String emotion,
        int sentimentScore,
        List<DayPlan> weeklyPlan,
        boolean fallback
) {
}
