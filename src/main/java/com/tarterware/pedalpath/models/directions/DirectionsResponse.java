package com.tarterware.pedalpath.models.directions;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body shared by the Mapbox Directions and OSRM route endpoints.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DirectionsResponse
{
    // "Ok" on success.
    String code;

    String message;

    List<DirectionsRoute> routes = new ArrayList<DirectionsRoute>();

    List<DirectionsWaypoint> waypoints = new ArrayList<DirectionsWaypoint>();
}
