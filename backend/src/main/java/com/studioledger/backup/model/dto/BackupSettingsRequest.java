package com.studioledger.backup.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of backup settings; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupSettingsRequest {

    @Pattern(regexp = "daily|weekly|none", message = "Schedule must be daily, weekly or none")
    private String schedule;

    @Min(value = 1, message = "Retention must be at least 1 day")
    @Max(value = 3650, message = "Retention cannot exceed 3650 days")
    private Integer retentionDays;

    private String googleClientId;

    private String googleClientSecret;
}
