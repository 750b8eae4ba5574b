package com.sentient.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Composite primary key of {@link PlanRecord}: owning user plus creation instant.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanRecordId implements Serializable {

    private String userId;
    private Instant createdAt;
}
