package com.tarterware.pedalpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NavigationViewModel
{
    boolean navigating;

    boolean paused;

    String routeName;

    double currentSpeedKmh;

    String formattedSpeed;

    double distanceTraveled;

    double distanceRemaining;

    double progressPercent;

    String formattedDistanceTraveled;

    String formattedDistanceRemaining;

    Double estimatedTimeRemaining;

    String formattedTimeRemaining;

    boolean offRoute;

    double distanceFromRoute;

    String error;
}
