package org.arenamap;

/**
 * Base type for failures that abort an analysis run.
 */
public class MapAnalysisException extends RuntimeException {
    public MapAnalysisException(String message) {
        super(message);
    }
}
