package com.sentient.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canvas state attached to each returned plan.
 *
 * A plan is always returned even while its canvas is pending; the warning
 * tells the client the visual is still on its way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ArtifactInfo {

    public static final String PENDING_WARNING = "Visual generation pending. Your plan is ready below.";

    /** "pending" or "completed". */
    private String status;

    /** Public canvas location, null while pending. */
    private String url;

    /** Set when the canvas is not available yet. */
    private String warning;
}
