package com.tarterware.pedalpath.models.directions;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DirectionsWaypoint
{
    String name;

    double distance;

    // [longitude, latitude]
    List<Double> location;
}
