package com.tarterware.pedalpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A user-placed routing anchor. Instances are immutable; structural edits
 * produce copies through the {@code with*} methods.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Waypoint
{
    String id;

    Coordinate coordinate;

    // Optional display name.
    String name;

    WaypointKind kind;

    // Position within the route's waypoint list.
    int order;
}
