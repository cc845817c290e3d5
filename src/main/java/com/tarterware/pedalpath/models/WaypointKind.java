package com.tarterware.pedalpath.models;

/**
 * Role of a waypoint within an ordered route.
 */
public enum WaypointKind
{
    START, VIA, END
}
