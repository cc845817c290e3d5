package com.tarterware.pedalpath.models;

public enum PlanningMode
{
    // Road-following geometry from the routing service.
    POINT_TO_POINT,

    // Geometry is the straight connection of the waypoints.
    FREEFORM,

    // Editing a previously saved route.
    MODIFY_EXISTING
}
