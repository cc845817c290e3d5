package com.tarterware.pedalpath.models.directions;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DirectionsRoute
{
    double distance;

    double duration;

    Geometry geometry;

    List<RouteLeg> legs = new ArrayList<RouteLeg>();
}
