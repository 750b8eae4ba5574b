package com.sentient.service;

import com.sentient.dto.response.ArtifactInfo;
import com.sentient.dto.response.PlanListResponse;
import com.sentient.dto.response.PlanResponse;
import com.sentient.entity.PlanRecord;
import com.sentient.exception.PlanNotFoundException;
import com.sentient.repository.PlanRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PlanQueryService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PlanQueryService Unit Tests")
class PlanQueryServiceTest {

    private static final String USER_ID = "user-1";

    @Mock
    private PlanRecordRepository planRecordRepository;

    @InjectMocks
    private PlanQueryService planQueryService;

    private static PlanRecord completedRecord() {
        PlanRecord record = PlanRecord.builder()
                .userId(USER_ID)
                .recordId("rec-completed")
                .createdAt(Instant.parse("2025-03-14T10:00:00Z"))
                .emotion("happy")
                .sentimentScore(80)
                .weeklyPlan(FallbackPlan.PAYLOAD.weeklyPlan())
                .build();
        record.markArtifactCompleted("http://localhost:4566/sentient-artifacts/a.txt", Instant.parse("2025-03-14T10:00:05Z"));
        return record;
    }

    private static PlanRecord pendingRecord() {
        return PlanRecord.builder()
                .userId(USER_ID)
                .recordId("rec-pending")
                .createdAt(Instant.parse("2025-03-15T10:00:00Z"))
                .emotion("neutral")
                .sentimentScore(50)
                .weeklyPlan(FallbackPlan.PAYLOAD.weeklyPlan())
                .fallback(true)
                .build();
    }

    @Test
    @DisplayName("getRecentPlans should mark pending canvases with a warning and notice")
    void testGetRecentPlans_MixedStatuses() {
        // Arrange
        when(planRecordRepository.findRecentByUserId(eq(USER_ID), any(Pageable.class)))
                .thenReturn(List.of(pendingRecord(), completedRecord()));

        // Act
        PlanListResponse response = planQueryService.getRecentPlans(USER_ID, null);

        // Assert
        assertEquals(USER_ID, response.getUserId());
        assertEquals(2, response.getPlanCount());
        assertEquals("1 plan(s) have visual generation pending", response.getNotice());

        PlanResponse pending = response.getPlans().get(0);
        assertEquals("pending", pending.getArtifact().getStatus());
        assertNull(pending.getArtifact().getUrl());
        assertEquals(ArtifactInfo.PENDING_WARNING, pending.getArtifact().getWarning());
        assertTrue(pending.isFallback());

        PlanResponse completed = response.getPlans().get(1);
        assertEquals("completed", completed.getArtifact().getStatus());
        assertNotNull(completed.getArtifact().getUrl());
        assertNull(completed.getArtifact().getWarning());
        assertFalse(completed.isFallback());
    }

    @Test
    @DisplayName("getRecentPlans should omit the notice when nothing is pending")
    void testGetRecentPlans_NoPending() {
        // Arrange
        when(planRecordRepository.findRecentByUserId(eq(USER_ID), any(Pageable.class)))
                .thenReturn(List.of(completedRecord()));

        // Act
        PlanListResponse response = planQueryService.getRecentPlans(USER_ID, 5);

        // Assert
        assertNull(response.getNotice());
    }

    @Test
    @DisplayName("getRecentPlans should throw when the user has no plans")
    void testGetRecentPlans_NotFound() {
        // Arrange
        when(planRecordRepository.findRecentByUserId(eq(USER_ID), any(Pageable.class)))
                .thenReturn(Collections.emptyList());

        // Act & Assert
        PlanNotFoundException ex = assertThrows(PlanNotFoundException.class,
                () -> planQueryService.getRecentPlans(USER_ID, 10));
        assertEquals(USER_ID, ex.getUserId());
    }

    @Test
    @DisplayName("getRecentPlans should request a clamped page size")
    void testGetRecentPlans_ClampsLimit() {
        // Arrange
        when(planRecordRepository.findRecentByUserId(eq(USER_ID), any(Pageable.class)))
                .thenReturn(List.of(completedRecord()));

        // Act
        planQueryService.getRecentPlans(USER_ID, 500);

        // Assert
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(planRecordRepository).findRecentByUserId(eq(USER_ID), captor.capture());
        assertEquals(PlanQueryService.MAX_LIMIT, captor.getValue().getPageSize());
    }

    @Test
    @DisplayName("clampLimit should default and bound the limit")
    void testClampLimit() {
        assertEquals(10, PlanQueryService.clampLimit(null));
        assertEquals(1, PlanQueryService.clampLimit(0));
        assertEquals(1, PlanQueryService.clampLimit(-3));
        assertEquals(25, PlanQueryService.clampLimit(25));
        assertEquals(50, PlanQueryService.clampLimit(51));
    }
}
