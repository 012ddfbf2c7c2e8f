package com.williamcallahan.skillcatalog.service.classification;

/**
 * One failed attempt of the AI classification chain: transport error, empty reply or an
 * unusable response body. The chain catches it and moves on to the next attempt.
 */
public class AiClassificationException extends RuntimeException {

    public AiClassificationException(String message) {
        super(message);
    }

    public AiClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
