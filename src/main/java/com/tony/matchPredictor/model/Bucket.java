package com.tony.matchPredictor.model;

/**
 * A = modèle actif (production), B = canary.
 */
public enum Bucket {
    A, B
}
