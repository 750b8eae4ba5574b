package com.sentient.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a reflection.
 *
 * {@code userId} is optional; when omitted the caller's token subject is used.
 * Text longer than 10 000 characters is accepted and truncated on storage.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

    @NotBlank(message = "Reflection text is required")
    private String text;

    private String userId;
}
