package com.sentient.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for GET /api/plans/{userId}.
 *
 * {@code notice} is only present when at least one plan still waits for its canvas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanListResponse {

    private String userId;
    private int planCount;
    private List<PlanResponse> plans;
    private String notice;
}
