package com.tarterware.pedalpath.models;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of the navigation session, published after every change.
 */
@Value
@Builder(toBuilder = true)
public class NavigationSnapshot
{
    public static final NavigationSnapshot IDLE = NavigationSnapshot.builder().status(NavigationStatus.IDLE).build();

    NavigationStatus status;

    String routeId;

    String routeName;

    double totalDistance;

    Coordinate currentLocation;

    // Raw GPS speed in meters per second, if the fix had one.
    Double currentSpeed;

    Double currentHeading;

    double smoothedSpeed;

    int nearestIndex;

    double distanceFromRoute;

    boolean offRoute;

    double distanceTraveled;

    double distanceRemaining;

    double progressPercent;

    // Null when the rider is stopped or no fix has arrived.
    Double etaSeconds;

    // Timestamp of the last processed fix, 0 before the first one.
    long lastFixTimestamp;

    String error;
}
