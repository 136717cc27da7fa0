package org.arenamap;

public final class GeometryException extends MapAnalysisException {
    public GeometryException(String message) {
        super(message);
    }
}
