package com.tarterware.pedalpath.models.directions;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteLeg
{
    double distance;

    double duration;

    List<RouteStep> steps = new ArrayList<RouteStep>();
}
