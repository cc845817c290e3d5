package com.tarterware.pedalpath.models.directions;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Maneuver
{
    String type;

    String modifier;

    // Only Mapbox supplies a human readable instruction.
    String instruction;

    // [longitude, latitude]
    List<Double> location;
}
