package com.sentient.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an accepted reflection.
 *
 * Analysis happens asynchronously; clients poll GET /api/plans/{userId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeResponse {

    private String requestId;
    private String userId;
    private String status;
    private String message;
}
