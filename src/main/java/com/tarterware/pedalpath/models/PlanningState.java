package com.tarterware.pedalpath.models;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only projection of the route planner.
 */
@Value
@Builder
public class PlanningState
{
    boolean planning;

    PlanningMode mode;

    List<Waypoint> waypoints;

    List<Coordinate> geometry;

    double distance;

    Double duration;

    List<RouteInstruction> instructions;

    boolean canUndo;

    boolean canRedo;

    int historySize;

    boolean calculating;

    String baseRouteId;

    String error;
}
