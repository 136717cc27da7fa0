package org.arenamap;

/**
 * The level cannot satisfy the requested analysis: a degenerate visibility matrix,
 * or no candidate room/tile left for a resource.
 */
public final class ConfigurationException extends MapAnalysisException {
    private final String resource;
    private final int iteration;

    public ConfigurationException(String message) {
        this(message, null, -1);
    }

    public ConfigurationException(String message, String resource, int iteration) {
        super(resource == null ? message : message + " (resource " + resource + ", unit " + iteration + ")");
        this.resource = resource;
        this.iteration = iteration;
    }

    /** Resource kind being placed, or null when the failure is not tied to placement. */
    public String resource() { return resource; }

    /** Zero-based unit index within the resource kind, -1 if not applicable. */
    public int iteration() { return iteration; }
}
