package com.tarterware.pedalpath.models.directions;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GeoJSON LineString; each coordinate is [longitude, latitude].
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Geometry
{
    @JsonProperty("type")
    String theType;

    List<List<Double>> coordinates = new ArrayList<List<Double>>();
}
