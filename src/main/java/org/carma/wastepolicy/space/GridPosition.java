package org.carma.wastepolicy.space;

/**
 * A cell on the simulation grid.
 */
public record GridPosition(int x, int y) {

    /**
     * Euclidean distance between cell coordinates.
     */
    public double distanceTo(GridPosition other) {
        int dx = x - other.x;
        int dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
