package com.tony.matchPredictor.model;

/**
 * Grille normalisée P(buts domicile = h, buts extérieur = a), h et a dans [0, maxGoals].
 *
 * @param grid           grille [h][a], somme = 1 (à 1e-6 près)
 * @param lambdaHome     espérance de buts domicile après ajustements
 * @param lambdaAway     espérance de buts extérieur après ajustements
 * @param truncatedMass  masse perdue par la troncature avant renormalisation
 */
public record ScorelineDistribution(double[][] grid, double lambdaHome, double lambdaAway, double truncatedMass) {

    public double total() {
        double sum = 0.0;
        for (int h = 0; h < grid.length; h++) {
            for (int a = 0; a < grid[h].length; a++) {
                sum += grid[h][a];
            }
        }
        return sum;
    }
}
