package com.tarterware.pedalpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteSummary
{
    String id;

    String name;

    String description;

    PlanningMode mode;

    double distance;

    int waypointCount;

    // Bounds of the geometry, for fitting a map viewport.
    double south;

    double west;

    double north;

    double east;

    long createdAtEpochMillis;

    long updatedAtEpochMillis;
}
