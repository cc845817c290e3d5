package com.tarterware.pedalpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A WGS84 position in degrees.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Coordinate
{
    double latitude;

    double longitude;

    public static Coordinate of(double latitude, double longitude)
    {
        return new Coordinate(latitude, longitude);
    }
}
