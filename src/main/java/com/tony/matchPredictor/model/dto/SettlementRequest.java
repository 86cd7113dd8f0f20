package com.tony.matchPredictor.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettlementRequest {
    @NotNull
    @Min(0)
    private Integer homeGoals;
    @NotNull
    @Min(0)
    private Integer awayGoals;
}
