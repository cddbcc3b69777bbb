package com.z254.vigil.warden.classification;

/**
 * Baseline state was corrupted or produced an out-of-range score.
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }
}
