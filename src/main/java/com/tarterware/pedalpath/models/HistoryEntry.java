package com.tarterware.pedalpath.models;

import java.util.List;

import lombok.Value;

/**
 * Snapshot of the planned route used for undo and redo. The lists are
 * unmodifiable copies holding immutable values, so an entry never shares
 * mutable state with the live route.
 */
@Value
public class HistoryEntry
{
    List<Waypoint> waypoints;

    List<Coordinate> geometry;

    long timestamp;

    public HistoryEntry(List<Waypoint> waypoints, List<Coordinate> geometry, long timestamp)
    {
        this.waypoints = List.copyOf(waypoints);
        this.geometry = List.copyOf(geometry);
        this.timestamp = timestamp;
    }

    /**
     * Returns a copy of this entry with its geometry replaced.
     *
     * @param newGeometry the geometry to store.
     * @return a new entry with the same waypoints and timestamp.
     */
    public HistoryEntry withGeometry(List<Coordinate> newGeometry)
    {
        return new HistoryEntry(waypoints, newGeometry, timestamp);
    }
}
