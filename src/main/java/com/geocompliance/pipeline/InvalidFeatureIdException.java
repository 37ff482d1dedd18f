package com.geocompliance.pipeline;

/**
 * A feature id that cannot be used as a document key.
 */
public class InvalidFeatureIdException extends IllegalArgumentException {

    public InvalidFeatureIdException(String featureId) {
        super("invalid feature id: '" + featureId + "'");
    }
}
