package com.tarterware.pedalpath.models;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A complete, self-contained route record as handed to persistence and to
 * the navigation engine.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SavedRoute
{
    String id;

    String name;

    String description;

    PlanningMode mode;

    List<Waypoint> waypoints;

    List<Coordinate> geometry;

    // Meters along the geometry.
    double distance;

    // Seconds, when the routing service supplied an estimate.
    Double duration;

    // The route this one was derived from, when it is an edited copy.
    String baseRouteId;

    long createdAtEpochMillis;

    long updatedAtEpochMillis;
}
