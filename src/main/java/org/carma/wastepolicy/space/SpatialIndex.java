package org.carma.wastepolicy.space;

import java.util.List;

/**
 * Spatial capability used by the engine for placement and movement.
 *
 * The engine never inspects cell storage directly; it only asks for
 * neighbours, legal single-step moves, and placement changes. Every
 * query must return results in a deterministic order so that seeded
 * runs reproduce exactly.
 *
 * @param <T> type of the placed agents
 */
public interface SpatialIndex<T> {

    int getWidth();

    int getHeight();

    /**
     * Agents within the Moore neighbourhood of {@code pos} (Chebyshev
     * distance &lt;= radius), including agents sharing the centre cell.
     */
    List<T> neighbors(GridPosition pos, int radius);

    /**
     * Cells reachable in one step from {@code pos}, excluding the cell itself.
     */
    List<GridPosition> legalMoves(GridPosition pos);

    void place(T agent, GridPosition pos);

    void move(T agent, GridPosition pos);

    void remove(T agent);

    /**
     * Current cell of an agent, or {@code null} if it is not placed.
     */
    GridPosition positionOf(T agent);

    boolean contains(GridPosition pos);

    /**
     * Number of agents currently placed.
     */
    int getAgentCount();
}
