package com.tony.matchPredictor.exception;

/**
 * Signaux absents ou incomplets pour un match : la requête échoue, aucune valeur par défaut n'est substituée.
 */
public class InsufficientInputException extends RuntimeException {

    public InsufficientInputException(String message) {
        super(message);
    }
}
