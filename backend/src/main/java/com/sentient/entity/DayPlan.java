package com.sentient.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One day of a weekly plan, stored inside {@link PlanRecord#getWeeklyPlan()} as JSON.
 */
public record DayPlan(
        String day,
        List<String> tasks,
        String focus,
        @JsonProperty("self_care") String selfCare
) {
}
