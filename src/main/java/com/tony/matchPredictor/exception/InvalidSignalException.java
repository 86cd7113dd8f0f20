package com.tony.matchPredictor.exception;

/**
 * Entrée numérique hors domaine (xG <= 0, cote <= 1.0, pourcentage hors [0,100]...).
 */
public class InvalidSignalException extends RuntimeException {

    public InvalidSignalException(String message) {
        super(message);
    }
}
