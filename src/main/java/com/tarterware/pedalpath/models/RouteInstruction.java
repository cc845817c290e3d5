package com.tarterware.pedalpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteInstruction
{
    // Maneuver type, e.g. "turn" or "depart".
    String type;

    String text;

    double distance;

    double duration;

    String modifier;
}
