package org.carma.wastepolicy.model;

import org.carma.wastepolicy.space.GridPosition;
import org.carma.wastepolicy.space.SpatialIndex;

import java.util.*;

/**
 * A patrol officer working for one region.
 *
 * State machine per step:
 * <ol>
 *   <li>Pick a target according to the {@link TargetingMode}.</li>
 *   <li>Pursuit: move one cell toward the target, choosing among legal moves
 *       the one with the smallest Euclidean distance to it. A pursuing unit
 *       never holds position while a legal move exists.
 *       Patrol (no target): take one uniformly random legal move.</li>
 *   <li>Fine every non-compliant household of the region within the catch
 *       radius. Detection is certain here; the deterrence probability lives in
 *       the region's enforcement intensity.</li>
 * </ol>
 *
 * Units only pursue and fine households of their own region. Ties between
 * equally distant households go to the lexicographically smaller id, and ties
 * between equally good moves go to the first move in grid scan order.
 */
public class EnforcementUnit implements SteppingAgent {

    private static final Comparator<String> ID_ORDER = Comparator.naturalOrder();

    private final String id;
    private final String regionId;
    private final TargetingMode targetingMode;
    private final int patrolRange;
    private final int catchRadius;
    private final Set<String> visited;

    private int finesIssued;

    public EnforcementUnit(String id, String regionId, BehaviorProfile profile) {
        this(id, regionId, profile.getTargetingMode(), profile.getPatrolRange(), profile.getCatchRadius());
    }

    public EnforcementUnit(String id, String regionId, TargetingMode targetingMode,
                           int patrolRange, int catchRadius) {
        this.id = Objects.requireNonNull(id, "Unit ID cannot be null");
        this.regionId = Objects.requireNonNull(regionId, "Region ID cannot be null");
        this.targetingMode = Objects.requireNonNull(targetingMode, "Targeting mode cannot be null");
        if (patrolRange < 1) throw new IllegalArgumentException("Patrol range must be >= 1");
        if (catchRadius < 0) throw new IllegalArgumentException("Catch radius cannot be negative");
        this.patrolRange = patrolRange;
        this.catchRadius = catchRadius;
        this.visited = new HashSet<>();
    }

    // ========================================================================
    // Step
    // ========================================================================

    @Override
    public void step(StepContext context) {
        SpatialIndex<SteppingAgent> space = context.getSpace();
        GridPosition pos = space.positionOf(this);
        if (pos == null) return;

        RegionPolicy region = context.region(regionId);
        Household target = targetingMode == TargetingMode.SYSTEMATIC_SWEEP
            ? nearestUnvisited(space, pos, region)
            : nearestViolator(space, pos);

        GridPosition next;
        if (target != null) {
            next = pursue(space, pos, space.positionOf(target));
        } else {
            next = patrol(space, pos, context.getRandom());
        }
        if (!next.equals(pos)) {
            space.move(this, next);
        }

        enforce(context, next);
    }

    // ========================================================================
    // Targeting
    // ========================================================================

    /**
     * Nearest non-compliant household of this region within patrol range.
     */
    Household nearestViolator(SpatialIndex<SteppingAgent> space, GridPosition pos) {
        Household best = null;
        double bestDistance = Double.MAX_VALUE;
        for (SteppingAgent agent : space.neighbors(pos, patrolRange)) {
            if (!(agent instanceof Household)) continue;
            Household h = (Household) agent;
            if (h.isCompliant() || !h.getRegionId().equals(regionId)) continue;
            double d = pos.distanceTo(space.positionOf(h));
            if (d < bestDistance || (d == bestDistance && ID_ORDER.compare(h.getId(), best.getId()) < 0)) {
                best = h;
                bestDistance = d;
            }
        }
        return best;
    }

    /**
     * Nearest household of this region not yet visited in the current sweep.
     * When every household has been visited the memory is cleared and the unit
     * patrols for this step.
     */
    Household nearestUnvisited(SpatialIndex<SteppingAgent> space, GridPosition pos, RegionPolicy region) {
        Household best = null;
        double bestDistance = Double.MAX_VALUE;
        for (Household h : region.getHouseholds()) {
            if (visited.contains(h.getId())) continue;
            GridPosition hp = space.positionOf(h);
            if (hp == null) continue;
            double d = pos.distanceTo(hp);
            if (d < bestDistance || (d == bestDistance && ID_ORDER.compare(h.getId(), best.getId()) < 0)) {
                best = h;
                bestDistance = d;
            }
        }
        if (best == null) {
            visited.clear();
        }
        return best;
    }

    // ========================================================================
    // Movement
    // ========================================================================

    /**
     * Best legal move toward the target. The unit always steps, even when
     * already beside or on the target; it stays only when no move exists.
     */
    private GridPosition pursue(SpatialIndex<SteppingAgent> space, GridPosition pos, GridPosition targetPos) {
        GridPosition best = pos;
        double bestDistance = Double.MAX_VALUE;
        for (GridPosition move : space.legalMoves(pos)) {
            double d = move.distanceTo(targetPos);
            if (d < bestDistance) {
                best = move;
                bestDistance = d;
            }
        }
        return best;
    }

    private GridPosition patrol(SpatialIndex<SteppingAgent> space, GridPosition pos, Random random) {
        List<GridPosition> moves = space.legalMoves(pos);
        if (moves.isEmpty()) return pos;
        return moves.get(random.nextInt(moves.size()));
    }

    // ========================================================================
    // Enforcement
    // ========================================================================

    private void enforce(StepContext context, GridPosition pos) {
        for (SteppingAgent agent : context.getSpace().neighbors(pos, catchRadius)) {
            if (!(agent instanceof Household)) continue;
            Household h = (Household) agent;
            if (!h.getRegionId().equals(regionId)) continue;
            if (targetingMode == TargetingMode.SYSTEMATIC_SWEEP) {
                visited.add(h.getId());
            }
            if (!h.isCompliant() && h.getFined(context)) {
                finesIssued++;
            }
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    @Override
    public String getId() {
        return id;
    }

    public String getRegionId() {
        return regionId;
    }

    public TargetingMode getTargetingMode() {
        return targetingMode;
    }

    public int getPatrolRange() {
        return patrolRange;
    }

    public int getCatchRadius() {
        return catchRadius;
    }

    public int getFinesIssued() {
        return finesIssued;
    }

    public Set<String> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((EnforcementUnit) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("EnforcementUnit[%s@%s, %s, fines=%d]", id, regionId, targetingMode, finesIssued);
    }
}
