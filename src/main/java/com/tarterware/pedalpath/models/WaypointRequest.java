package com.tarterware.pedalpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WaypointRequest
{
    double latitude;

    double longitude;

    String name;

    // Only used when inserting a via-waypoint.
    int index;
}
