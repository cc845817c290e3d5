package com.tarterware.pedalpath.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single GPS fix from the location provider.
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocationUpdate
{
    double latitude;

    double longitude;

    // Meters per second; absent on some devices.
    Double speed;

    // Degrees clockwise from north; absent when not moving.
    Double heading;

    long timestamp;

    @JsonIgnore
    public Coordinate getCoordinate()
    {
        return Coordinate.of(latitude, longitude);
    }
}
