package com.sentient.service;

import com.sentient.entity.DayPlan;

import java.util.List;

/**
 * Fixed plan returned whenever model analysis is unavailable or unusable.
 * Users always get a plan, even a generic one.
 */
public final class FallbackPlan {

    public static final String EMOTION = "neutral";
    public static final int SENTIMENT_SCORE = 50;

    public static final PlanAnalysis PAYLOAD = new PlanAnalysis(
            EMOTION,
            SENTIMENT_SCORE,
            List.of(
                    new DayPlan("Monday",
                            List.of("Review weekly goals", "Organize workspace", "Plan the week ahead"),
                            "Organization and clarity",
                            "Take a 15-minute walk"),
                    new DayPlan("Tuesday",
                            List.of("Focus on priority tasks", "Respond to pending messages", "Document progress"),
                            "Productivity",
                            "Practice deep breathing exercises"),
                    new DayPlan("Wednesday",
                            List.of("Midweek review", "Adjust plans if needed", "Connect with a colleague"),
                            "Adaptation and connection",
                            "Enjoy a healthy lunch mindfully"),
                    new DayPlan("Thursday",
                            List.of("Continue priority work", "Prepare for end of week", "Learn something new"),
                            "Growth and momentum",
                            "Listen to calming music"),
                    new DayPlan("Friday",
                            List.of("Complete weekly tasks", "Review accomplishments", "Set intentions for next week"),
                            "Completion and reflection",
                            "Celebrate small wins"),
                    new DayPlan("Saturday",
                            List.of("Rest and recharge", "Pursue a hobby", "Spend time with loved ones"),
                            "Personal time",
                            "Sleep in if needed"),
                    new DayPlan("Sunday",
                            List.of("Gentle preparation for the week", "Meal prep", "Relaxation"),
                            "Renewal",
                            "Practice gratitude journaling")
            ),
            true
    );

    private FallbackPlan() {
    }
}
