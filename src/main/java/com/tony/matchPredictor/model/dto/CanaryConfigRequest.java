package com.tony.matchPredictor.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CanaryConfigRequest {
    @NotNull
    @Min(0)
    @Max(100)
    private Integer canaryPercentage;

    private Long canaryVersionId; // null = désactive le canary
}
