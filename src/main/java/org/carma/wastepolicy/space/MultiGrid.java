package org.carma.wastepolicy.space;

import java.util.*;

/**
 * Bounded (non-toroidal) grid allowing several agents per cell.
 *
 * Neighbourhoods are scanned column by column, then row by row, and agents
 * inside a cell are kept in arrival order, so all queries are deterministic.
 */
public class MultiGrid<T> implements SpatialIndex<T> {

    private final int width;
    private final int height;
    private final Map<GridPosition, List<T>> cells;
    private final Map<T, GridPosition> positions;

    public MultiGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                "Grid dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new HashMap<>();
        this.positions = new HashMap<>();
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public boolean contains(GridPosition pos) {
        return pos.x() >= 0 && pos.x() < width && pos.y() >= 0 && pos.y() < height;
    }

    @Override
    public List<T> neighbors(GridPosition pos, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius cannot be negative");
        }
        List<T> found = new ArrayList<>();
        int minX = Math.max(0, pos.x() - radius);
        int maxX = Math.min(width - 1, pos.x() + radius);
        int minY = Math.max(0, pos.y() - radius);
        int maxY = Math.min(height - 1, pos.y() + radius);
        for (int x = minX; x <= maxX; x++) {
            for (int y = minY; y <= maxY; y++) {
                List<T> occupants = cells.get(new GridPosition(x, y));
                if (occupants != null) {
                    found.addAll(occupants);
                }
            }
        }
        return found;
    }

    @Override
    public List<GridPosition> legalMoves(GridPosition pos) {
        List<GridPosition> moves = new ArrayList<>(8);
        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                if (dx == 0 && dy == 0) continue;
                GridPosition candidate = new GridPosition(pos.x() + dx, pos.y() + dy);
                if (contains(candidate)) {
                    moves.add(candidate);
                }
            }
        }
        return moves;
    }

    @Override
    public GridPosition positionOf(T agent) {
        return positions.get(agent);
    }

    @Override
    public int getAgentCount() {
        return positions.size();
    }

    // ========================================================================
    // Placement
    // ========================================================================

    @Override
    public void place(T agent, GridPosition pos) {
        Objects.requireNonNull(agent, "Agent cannot be null");
        requireInBounds(pos);
        if (positions.containsKey(agent)) {
            throw new IllegalStateException("Agent already placed: " + agent);
        }
        cells.computeIfAbsent(pos, k -> new ArrayList<>()).add(agent);
        positions.put(agent, pos);
    }

    @Override
    public void move(T agent, GridPosition pos) {
        requireInBounds(pos);
        GridPosition current = positions.get(agent);
        if (current == null) {
            throw new IllegalStateException("Agent is not placed: " + agent);
        }
        if (current.equals(pos)) return;
        detach(agent, current);
        cells.computeIfAbsent(pos, k -> new ArrayList<>()).add(agent);
        positions.put(agent, pos);
    }

    @Override
    public void remove(T agent) {
        GridPosition current = positions.remove(agent);
        if (current != null) {
            detach(agent, current);
        }
    }

    private void detach(T agent, GridPosition pos) {
        List<T> occupants = cells.get(pos);
        if (occupants != null) {
            occupants.remove(agent);
            if (occupants.isEmpty()) {
                cells.remove(pos);
            }
        }
    }

    private void requireInBounds(GridPosition pos) {
        Objects.requireNonNull(pos, "Position cannot be null");
        if (!contains(pos)) {
            throw new IllegalArgumentException(
                "Position " + pos + " outside grid " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return String.format("MultiGrid[%dx%d, %d agents]", width, height, positions.size());
    }
}
