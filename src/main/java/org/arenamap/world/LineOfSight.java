package org.arenamap.world;

public final class LineOfSight {
    private LineOfSight() {}

    /**
     * Straight-line visibility between two tiles. Axis-aligned segments check every tile
     * between the endpoints; sloped segments sample the line once per step along the
     * longer axis and truncate the other coordinate toward zero. The sampling is coarse
     * on purpose: visibility is only ever compared relative to other tiles.
     */
    public static boolean visible(GridView g, int x1, int y1, int x2, int y2) {
        // Canonical endpoint order keeps visible(p, q) == visible(q, p) under rounding.
        if (x2 < x1 || (x2 == x1 && y2 < y1)) {
            int tx = x1, ty = y1;
            x1 = x2; y1 = y2;
            x2 = tx; y2 = ty;
        }

        int dx = x2 - x1;
        int dy = y2 - y1;

        if (dx == 0) {
            for (int y = Math.min(y1, y2); y < Math.max(y1, y2); y++) {
                if (g.isWall(x1, y)) return false;
            }
        } else if (dy == 0) {
            for (int x = x1; x < x2; x++) {
                if (g.isWall(x, y1)) return false;
            }
        } else {
            double m = (double) dy / dx;
            double c = y1 - m * x1;

            if (Math.abs(dx) > Math.abs(dy)) {
                for (int x = x1; x < x2; x++) {
                    if (g.isWall(x, (int) (c + m * x))) return false;
                }
            } else {
                for (int y = Math.min(y1, y2); y < Math.max(y1, y2); y++) {
                    if (g.isWall((int) (y / m - c / m), y)) return false;
                }
            }
        }
        return true;
    }
}
