package com.tony.matchPredictor.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.LocalDate;

@Data
public class RegisterModelRequest {
    @NotBlank
    private String modelName;
    @NotBlank
    private String versionLabel;
    private LocalDate trainedOn;

    // Métriques hors ligne
    private Double accuracy;
    private Double logLoss;
    private Double brierScore;

    // Paramètres (null = valeur par défaut)
    private Double rho;
    private Double homeAdvantage;
    private Double eloWeight;
    private Double refereeBiasWeight;
}
