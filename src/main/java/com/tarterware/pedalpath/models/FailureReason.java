package com.tarterware.pedalpath.models;

public enum FailureReason
{
    NOT_PLANNING,
    INSUFFICIENT_WAYPOINTS,
    INSUFFICIENT_GEOMETRY,
    WAYPOINT_NOT_FOUND,
    INVALID_INDEX,
    INVALID_INPUT,
    NOT_ON_ROUTE,
    ROUTING_FAILED,
    // The waypoints changed while a route was being calculated.
    ROUTE_CHANGED,
    LOCATION_UNAVAILABLE,
    NOT_NAVIGATING,
    ROUTE_NOT_FOUND
}
