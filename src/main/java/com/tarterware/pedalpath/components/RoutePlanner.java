package com.tarterware.pedalpath.components;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.pedalpath.models.CalculatedRoute;
import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.FailureReason;
import com.tarterware.pedalpath.models.HistoryEntry;
import com.tarterware.pedalpath.models.OperationResult;
import com.tarterware.pedalpath.models.PlanningMode;
import com.tarterware.pedalpath.models.PlanningState;
import com.tarterware.pedalpath.models.RouteInstruction;
import com.tarterware.pedalpath.models.RoutingProfile;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.models.SegmentInfo;
import com.tarterware.pedalpath.models.Waypoint;
import com.tarterware.pedalpath.models.WaypointKind;
import com.tarterware.pedalpath.services.DirectionsService;
import com.tarterware.pedalpath.services.RoutingException;
import com.tarterware.pedalpath.utilities.GeoUtilities;
import com.tarterware.pedalpath.utilities.StringUtilities;
import com.tarterware.pedalpath.utilities.WaypointUtilities;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Owns the route being planned: its waypoints, the geometry calculated through
 * them and the undo/redo history of edits.
 *
 * <p>
 * The planner is either not planning, or planning in one {@link PlanningMode}.
 * Every structural edit records exactly one history entry. Dragging a waypoint
 * is the exception: {@link #moveWaypoint(String, Coordinate)} may be called any
 * number of times during a gesture and {@link #finishMoveWaypoint()} records
 * the single entry for it.
 * </p>
 *
 * <p>
 * Methods are synchronized on the planner. {@link #calculateRoute()} releases
 * the monitor while it waits for the routing service, so overlapping
 * calculations are not coalesced and the last one to complete wins.
 * </p>
 */
@Component
public class RoutePlanner
{
    public static final String ROUTE_CALCULATION_ERROR = "Failed to calculate route. Please try again.";

    public static final String ENDPOINT_ROUTING_FAILURES = "pedalpath.routing.failures";

    private static final Logger logger = LoggerFactory.getLogger(RoutePlanner.class);

    private final DirectionsService directionsService;

    private final RouteSegmentEditor segmentEditor;

    private final RoutingProfile routingProfile;

    private final Counter routingFailureCounter;

    private final RouteHistory history = new RouteHistory();

    private boolean planning = false;

    private PlanningMode mode;

    private List<Waypoint> waypoints = List.of();

    private List<Coordinate> geometry = List.of();

    private double distance = 0.0;

    private Double duration;

    private List<RouteInstruction> instructions = List.of();

    private String baseRouteId;

    private String error;

    // Route calculations currently waiting on the routing service.
    private int pendingCalculations = 0;

    // Bumped on every change to the waypoints or a reset, so a routing result
    // can tell whether it still describes the planner.
    private long revision = 0;

    // True between the first moveWaypoint() of a drag and finishMoveWaypoint().
    private boolean movePending = false;

    /**
     * @param directionsService Routing service client.
     * @param segmentEditor     Maps presses on the route to segments.
     * @param meterRegistry     Registry for the routing failure counter.
     * @param routingProfile    Travel profile used for calculated routes.
     */
    public RoutePlanner(DirectionsService directionsService, RouteSegmentEditor segmentEditor,
            MeterRegistry meterRegistry,
            @Value("${com.tarterware.pedalpath.routing-profile:CYCLING}") RoutingProfile routingProfile)
    {
        this.directionsService = directionsService;
        this.segmentEditor = segmentEditor;
        this.routingProfile = routingProfile;
        this.routingFailureCounter = meterRegistry.counter(ENDPOINT_ROUTING_FAILURES);
    }

    /**
     * Begin planning a new route. Any route in progress is discarded and the
     * history starts out empty.
     *
     * @param newMode How the route will be built.
     */
    public synchronized void startPlanning(PlanningMode newMode)
    {
        resetRoute();
        planning = true;
        mode = newMode;

        logger.info("Started planning in {} mode.", newMode);
    }

    /**
     * Stop planning and discard the route in progress.
     */
    public synchronized void cancelPlanning()
    {
        resetRoute();
        planning = false;
        mode = null;

        logger.info("Planning cancelled.");
    }

    /**
     * Start editing a saved route. The history is seeded with the loaded route,
     * so there is nothing to undo until the first edit.
     *
     * @param route The route to edit.
     * @return the planner state after loading.
     */
    public synchronized OperationResult<PlanningState> loadExistingRoute(SavedRoute route)
    {
        if (route == null)
        {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "No route to load");
        }

        resetRoute();
        planning = true;
        mode = PlanningMode.MODIFY_EXISTING;
        waypoints = WaypointUtilities.assignKinds(nullToEmpty(route.getWaypoints()));
        geometry = List.copyOf(nullToEmpty(route.getGeometry()));
        distance = GeoUtilities.pathDistance(geometry);
        duration = route.getDuration();
        baseRouteId = route.getId();
        history.seed(new HistoryEntry(waypoints, geometry, System.currentTimeMillis()));

        logger.info("Loaded route {} with {} waypoints for editing.", route.getId(), waypoints.size());

        return OperationResult.ok(buildState());
    }

    /**
     * Append a waypoint. The previous end becomes a via-waypoint and the new one
     * becomes the end, or the start when it is the first.
     *
     * @param coordinate Position of the waypoint.
     * @param name       Optional display name.
     * @return the new waypoint.
     */
    public synchronized OperationResult<Waypoint> addWaypoint(Coordinate coordinate, String name)
    {
        if (!planning)
        {
            return notPlanning();
        }
        if (coordinate == null)
        {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "A waypoint needs a coordinate");
        }

        List<Waypoint> updated = WaypointUtilities.demoteEnd(waypoints);
        WaypointKind kind = updated.isEmpty() ? WaypointKind.START : WaypointKind.END;
        Waypoint waypoint = WaypointUtilities.createWaypoint(coordinate, name, kind, updated.size());
        updated.add(waypoint);

        waypoints = List.copyOf(updated);
        pushHistory();

        return OperationResult.ok(waypoint);
    }

    /**
     * Insert a via-waypoint between existing waypoints. The index is clamped so
     * the start and end keep their places; with fewer than two waypoints the new
     * one is appended.
     *
     * @param coordinate Position of the waypoint.
     * @param index      Requested position in the waypoint list.
     * @return the new waypoint, with its final kind and order.
     */
    public synchronized OperationResult<Waypoint> insertViaWaypoint(Coordinate coordinate, int index)
    {
        if (!planning)
        {
            return notPlanning();
        }
        if (coordinate == null)
        {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "A waypoint needs a coordinate");
        }

        List<Waypoint> updated = new ArrayList<>(waypoints);
        int insertAt = (updated.size() < 2) ? updated.size() : Math.max(1, Math.min(index, updated.size() - 1));

        Waypoint waypoint = WaypointUtilities.createWaypoint(coordinate, null, WaypointKind.VIA, insertAt);
        updated.add(insertAt, waypoint);

        waypoints = WaypointUtilities.assignKinds(updated);
        pushHistory();

        return OperationResult.ok(waypoints.get(insertAt));
    }

    /**
     * Remove a waypoint and re-derive the kinds of the rest.
     *
     * @param id Identifier of the waypoint.
     * @return the removed waypoint.
     */
    public synchronized OperationResult<Waypoint> removeWaypoint(String id)
    {
        if (!planning)
        {
            return notPlanning();
        }

        int index = WaypointUtilities.indexOf(waypoints, id);
        if (index < 0)
        {
            return OperationResult.failure(FailureReason.WAYPOINT_NOT_FOUND, "No waypoint with id " + id);
        }

        Waypoint removed = waypoints.get(index);
        List<Waypoint> updated = new ArrayList<>(waypoints);
        updated.remove(index);

        waypoints = WaypointUtilities.assignKinds(updated);
        pushHistory();

        return OperationResult.ok(removed);
    }

    /**
     * Move a waypoint as part of a drag. Nothing is recorded in the history until
     * {@link #finishMoveWaypoint()}.
     *
     * @param id         Identifier of the waypoint.
     * @param coordinate New position.
     * @return the moved waypoint.
     */
    public synchronized OperationResult<Waypoint> moveWaypoint(String id, Coordinate coordinate)
    {
        if (!planning)
        {
            return notPlanning();
        }
        if (coordinate == null)
        {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "A waypoint needs a coordinate");
        }

        int index = WaypointUtilities.indexOf(waypoints, id);
        if (index < 0)
        {
            return OperationResult.failure(FailureReason.WAYPOINT_NOT_FOUND, "No waypoint with id " + id);
        }

        List<Waypoint> updated = new ArrayList<>(waypoints);
        Waypoint moved = updated.get(index).withCoordinate(coordinate);
        updated.set(index, moved);

        waypoints = List.copyOf(updated);
        movePending = true;
        revision++;

        return OperationResult.ok(moved);
    }

    /**
     * End a drag gesture, recording one history entry for it.
     *
     * @return false when no move was pending.
     */
    public synchronized boolean finishMoveWaypoint()
    {
        if (!planning || !movePending)
        {
            return false;
        }

        movePending = false;
        pushHistory();

        return true;
    }

    /**
     * Move the waypoint at one position to another and re-derive kinds.
     *
     * @param fromIndex Current position.
     * @param toIndex   New position.
     * @return the reordered waypoints.
     */
    public synchronized OperationResult<List<Waypoint>> reorderWaypoints(int fromIndex, int toIndex)
    {
        if (!planning)
        {
            return notPlanning();
        }
        if ((fromIndex < 0) || (fromIndex >= waypoints.size()) || (toIndex < 0) || (toIndex >= waypoints.size()))
        {
            return OperationResult.failure(FailureReason.INVALID_INDEX,
                    "Cannot move waypoint " + fromIndex + " to " + toIndex + " of " + waypoints.size());
        }

        List<Waypoint> updated = new ArrayList<>(waypoints);
        Waypoint moved = updated.remove(fromIndex);
        updated.add(toIndex, moved);

        waypoints = WaypointUtilities.assignKinds(updated);
        pushHistory();

        return OperationResult.ok(waypoints);
    }

    /**
     * Remove every waypoint and the geometry.
     *
     * @return the planner state after clearing.
     */
    public synchronized OperationResult<PlanningState> clearWaypoints()
    {
        if (!planning)
        {
            return notPlanning();
        }

        waypoints = List.of();
        geometry = List.of();
        distance = 0.0;
        duration = null;
        instructions = List.of();
        movePending = false;
        pushHistory();

        return OperationResult.ok(buildState());
    }

    /**
     * Restore the previous history entry.
     *
     * @return false when there is nothing to undo.
     */
    public synchronized boolean undo()
    {
        HistoryEntry entry = history.undo();
        if (entry == null)
        {
            return false;
        }

        restore(entry);
        return true;
    }

    /**
     * Restore the next history entry.
     *
     * @return false when there is nothing to redo.
     */
    public synchronized boolean redo()
    {
        HistoryEntry entry = history.redo();
        if (entry == null)
        {
            return false;
        }

        restore(entry);
        return true;
    }

    public synchronized boolean canUndo()
    {
        return history.canUndo();
    }

    public synchronized boolean canRedo()
    {
        return history.canRedo();
    }

    /**
     * Calculate the geometry through the current waypoints. Freeform routes join
     * the waypoints with straight lines; every other mode asks the routing
     * service. On failure the previous geometry is kept and the error is set.
     * When the waypoints change or planning restarts while the routing service
     * is working, the result is dropped and {@link FailureReason#ROUTE_CHANGED}
     * is returned.
     *
     * @return the calculated route.
     */
    public OperationResult<CalculatedRoute> calculateRoute()
    {
        List<Waypoint> routeWaypoints;
        PlanningMode routeMode;
        long routeRevision;
        synchronized (this)
        {
            if (!planning)
            {
                return notPlanning();
            }
            if (waypoints.size() < 2)
            {
                return OperationResult.failure(FailureReason.INSUFFICIENT_WAYPOINTS,
                        "At least 2 waypoints are needed to calculate a route");
            }

            routeWaypoints = waypoints;
            routeMode = mode;
            routeRevision = revision;
            error = null;

            if (routeMode == PlanningMode.FREEFORM)
            {
                List<Coordinate> points = WaypointUtilities.coordinatesOf(routeWaypoints);
                CalculatedRoute route = CalculatedRoute.builder()
                        .geometry(points)
                        .distanceMeters(GeoUtilities.pathDistance(points))
                        .build();
                applyRoute(route, null);
                return OperationResult.ok(route);
            }

            pendingCalculations++;
        }

        List<Coordinate> coordinates = WaypointUtilities.coordinatesOf(routeWaypoints);

        CalculatedRoute route;
        try
        {
            route = directionsService.getRoute(coordinates, routingProfile);
        }
        catch (RoutingException e)
        {
            logger.error("Route calculation failed through {} waypoints.", coordinates.size(), e);
            routingFailureCounter.increment();
            synchronized (this)
            {
                pendingCalculations--;
                if (revision == routeRevision)
                {
                    error = ROUTE_CALCULATION_ERROR;
                }
            }
            return OperationResult.failure(FailureReason.ROUTING_FAILED, e.getMessage());
        }

        synchronized (this)
        {
            pendingCalculations--;
            if (revision != routeRevision)
            {
                logger.info("Dropping route through {} waypoints; the route changed while it was calculated.",
                        coordinates.size());
                return OperationResult.failure(FailureReason.ROUTE_CHANGED,
                        "The route changed while it was being calculated");
            }

            applyRoute(route, route.getDurationSeconds());
        }

        logger.info("Calculated {} m route through {} waypoints.", route.getDistanceMeters(), coordinates.size());

        return OperationResult.ok(route);
    }

    /**
     * Reshape the route by dragging its line: a via-waypoint is inserted at the
     * point of the route nearest to the press, between the waypoints whose
     * segment contains it.
     *
     * @param pressed Where the user pressed.
     * @return the new waypoint.
     */
    public synchronized OperationResult<Waypoint> modifyRouteAt(Coordinate pressed)
    {
        if (!planning)
        {
            return notPlanning();
        }
        if (pressed == null)
        {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "No position given");
        }

        Optional<SegmentInfo> segmentInfo = segmentEditor.findSegmentForInsertion(pressed, waypoints, geometry);
        if (segmentInfo.isEmpty())
        {
            return OperationResult.failure(FailureReason.NOT_ON_ROUTE, "The position is not on the route");
        }

        return insertViaWaypoint(segmentInfo.get().getNearestCoordinate(), segmentInfo.get().getInsertAtIndex());
    }

    /**
     * Build a self-contained record of the current route.
     *
     * @param name        Display name; must not be blank.
     * @param description Optional description.
     * @return the record, with a fresh id.
     */
    public synchronized OperationResult<SavedRoute> prepareForSave(String name, String description)
    {
        if (!planning)
        {
            return notPlanning();
        }
        if (StringUtilities.isNullEmptyOrBlank(name))
        {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "A route needs a name");
        }
        if (waypoints.size() < 2)
        {
            return OperationResult.failure(FailureReason.INSUFFICIENT_WAYPOINTS,
                    "At least 2 waypoints are needed to save a route");
        }

        long now = System.currentTimeMillis();
        SavedRoute savedRoute = SavedRoute.builder()
                .id(UUID.randomUUID().toString())
                .name(name.trim())
                .description(description)
                .mode(mode)
                .waypoints(waypoints)
                .geometry(geometry)
                .distance(GeoUtilities.pathDistance(geometry))
                .duration(duration)
                .baseRouteId(baseRouteId)
                .createdAtEpochMillis(now)
                .updatedAtEpochMillis(now)
                .build();

        return OperationResult.ok(savedRoute);
    }

    public synchronized void clearError()
    {
        error = null;
    }

    /**
     * @return a read-only projection of the planner.
     */
    public synchronized PlanningState getState()
    {
        return buildState();
    }

    private PlanningState buildState()
    {
        return PlanningState.builder()
                .planning(planning)
                .mode(mode)
                .waypoints(waypoints)
                .geometry(geometry)
                .distance(distance)
                .duration(duration)
                .instructions(instructions)
                .canUndo(history.canUndo())
                .canRedo(history.canRedo())
                .historySize(history.size())
                .calculating(pendingCalculations > 0)
                .baseRouteId(baseRouteId)
                .error(error)
                .build();
    }

    private void applyRoute(CalculatedRoute route, Double routeDuration)
    {
        geometry = List.copyOf(route.getGeometry());
        distance = route.getDistanceMeters();
        duration = routeDuration;
        instructions = List.copyOf(route.getInstructions());
        error = null;

        // Keep the entry at the cursor in step with what is displayed.
        HistoryEntry current = history.current();
        if (current != null)
        {
            history.replaceCurrent(current.withGeometry(geometry));
        }
    }

    private void restore(HistoryEntry entry)
    {
        waypoints = entry.getWaypoints();
        geometry = entry.getGeometry();
        distance = GeoUtilities.pathDistance(geometry);
        duration = null;
        instructions = List.of();
        movePending = false;
        revision++;
    }

    private void pushHistory()
    {
        history.push(new HistoryEntry(waypoints, geometry, System.currentTimeMillis()));

        // A structural edit ends any drag in progress.
        movePending = false;
        revision++;
    }

    private void resetRoute()
    {
        waypoints = List.of();
        geometry = List.of();
        distance = 0.0;
        duration = null;
        instructions = List.of();
        baseRouteId = null;
        error = null;
        movePending = false;
        revision++;
        history.clear();
    }

    private static <T> OperationResult<T> notPlanning()
    {
        return OperationResult.failure(FailureReason.NOT_PLANNING, "Not planning a route");
    }

    private static <T> List<T> nullToEmpty(List<T> list)
    {
        return (list == null) ? List.of() : list;
    }
}
