package com.sentient.controller;

import com.sentient.dto.request.AnalyzeRequest;
import com.sentient.dto.response.AnalyzeResponse;
import com.sentient.exception.UnauthorizedException;
import com.sentient.messaging.ReflectionStreamProducer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for submitting reflections.
 *
 * Endpoints:
 * - POST /api/analyze - queue a reflection for analysis
 *
 * The reflection is only published here; the plan appears in
 * GET /api/plans/{userId} once the stream consumer has processed it.
 */
@RestController
@RequestMapping("/api/analyze")
@RequiredArgsConstructor
@Slf4j
public class AnalyzeController {

    private final ReflectionStreamProducer reflectionStreamProducer;

    /**
     * Queue a reflection.
     *
     * @param request reflection text and optional user id
     * @param authentication caller identity from the bearer token
     * @return 202 Accepted with the request id
     * @throws UnauthorizedException if the request names a different user
     */
    @PostMapping
    public ResponseEntity<AnalyzeResponse> analyze(
            @Valid @RequestBody AnalyzeRequest request,
            Authentication authentication) {

        String callerId = authentication.getName();
        String userId = request.getUserId() == null || request.getUserId().isBlank()
                ? callerId
                : request.getUserId().strip();

        if (!userId.equals(callerId)) {
            throw UnauthorizedException.crossUserAccess(callerId, userId);
        }

        log.info("Reflection submitted by user: {} ({} characters)", userId, request.getText().length());

        String requestId = reflectionStreamProducer.publish(request.getText(), userId);

        AnalyzeResponse response = AnalyzeResponse.builder()
                .requestId(requestId)
                .userId(userId)
                .status("ACCEPTED")
                .message("Reflection received. Your plan will be ready shortly.")
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
