package com.safejob.matching.exceptions;

/**
 * Raised while loading the scoring weight vector when it is incomplete, negative or does not sum
 * to 1.0. Fails application start-up before any score is computed.
 */
public class InvalidScoringConfigurationException extends RuntimeException {

    public InvalidScoringConfigurationException(String message) {
        super(message);
    }
}
