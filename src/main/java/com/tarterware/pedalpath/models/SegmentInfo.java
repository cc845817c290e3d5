package com.tarterware.pedalpath.models;

import lombok.Builder;
import lombok.Value;

/**
 * Where a press on the route geometry falls relative to the waypoints.
 */
@Value
@Builder
public class SegmentInfo
{
    // 0 is the segment between waypoint 0 and waypoint 1.
    int segmentIndex;

    // Position in the waypoint list for a new via-waypoint.
    int insertAtIndex;

    int nearestGeometryIndex;

    // Meters from the pressed point to the route.
    double distanceToRoute;

    Coordinate nearestCoordinate;

    // Meters from the route start to the projected point.
    double distanceAlongRoute;
}
