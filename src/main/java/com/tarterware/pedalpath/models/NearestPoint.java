package com.tarterware.pedalpath.models;

import lombok.Value;

/**
 * Result of projecting a point onto a polyline.
 */
@Value
public class NearestPoint
{
    // Index of the segment start that precedes the closest point.
    int index;

    // Meters from the query point to the closest point.
    double distance;

    Coordinate point;
}
