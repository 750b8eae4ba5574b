package com.sentient.controller;

import com.sentient.dto.response.PlanListResponse;
import com.sentient.exception.UnauthorizedException;
import com.sentient.service.PlanQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for reading plans.
 *
 * Endpoints:
 * - GET /api/plans/{userId}?limit=10 - most recent plans first, limit capped at 50
 *
 * Plans with a pending canvas are returned immediately with a warning.
 */
@RestController
@RequestMapping("/api/plans")
@RequiredArgsConstructor
@Slf4j
public class PlanController {

    private final PlanQueryService planQueryService;

    @GetMapping("/{userId}")
    public ResponseEntity<PlanListResponse> getPlans(
            @PathVariable String userId,
            @RequestParam(required = false) Integer limit,
            Authentication authentication) {

        String callerId = authentication.getName();
        if (!userId.equals(callerId)) {
            throw UnauthorizedException.crossUserAccess(callerId, userId);
        }

        log.info("Plans requested by user: {}, limit: {}", userId, limit);
        return ResponseEntity.ok(planQueryService.getRecentPlans(userId, limit));
    }
}
