package org.arenamap.genome;

import org.arenamap.MapAnalysisException;

public final class GenomeParseException extends MapAnalysisException {
    private final int position;

    public GenomeParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /** Zero-based index of the offending character in the genome line. */
    public int position() { return position; }
}
