package com.tarterware.pedalpath.models;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of a routing service call.
 */
@Value
@Builder
public class CalculatedRoute
{
    @Singular("geometryPoint")
    List<Coordinate> geometry;

    // Total distance in meters.
    double distanceMeters;

    // Estimated duration in seconds.
    double durationSeconds;

    @Singular
    List<RouteInstruction> instructions;
}
