package com.tarterware.pedalpath.models;

import lombok.Value;

@Value
public class SegmentProjection
{
    double distance;

    Coordinate closestPoint;
}
