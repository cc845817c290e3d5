package com.tarterware.pedalpath.utilities;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.Waypoint;
import com.tarterware.pedalpath.models.WaypointKind;

public class WaypointUtilities
{
    /**
     * Re-derive kind and order for an ordered waypoint list: the first waypoint
     * is START, the last is END, everything between is VIA, and order matches
     * the list position. A single waypoint is START.
     *
     * @param waypoints Waypoints in route order.
     * @return A new unmodifiable list with the kinds and orders assigned.
     */
    static public List<Waypoint> assignKinds(List<Waypoint> waypoints)
    {
        List<Waypoint> assigned = new ArrayList<>(waypoints.size());
        int lastIndex = waypoints.size() - 1;
        for (int i = 0; i < waypoints.size(); ++i)
        {
            WaypointKind kind;
            if (i == 0)
            {
                kind = WaypointKind.START;
            }
            else if (i == lastIndex)
            {
                kind = WaypointKind.END;
            }
            else
            {
                kind = WaypointKind.VIA;
            }

            assigned.add(waypoints.get(i).withKind(kind).withOrder(i));
        }

        return List.copyOf(assigned);
    }

    /**
     * Demote the current END waypoint to VIA, ahead of appending a new end.
     *
     * @param waypoints Waypoints in route order.
     * @return A new list in which no waypoint is END.
     */
    static public List<Waypoint> demoteEnd(List<Waypoint> waypoints)
    {
        List<Waypoint> demoted = new ArrayList<>(waypoints.size());
        for (Waypoint waypoint : waypoints)
        {
            demoted.add((waypoint.getKind() == WaypointKind.END) ? waypoint.withKind(WaypointKind.VIA) : waypoint);
        }

        return demoted;
    }

    /**
     * Create a waypoint with a fresh identifier.
     *
     * @param coordinate Position of the waypoint.
     * @param name       Optional display name.
     * @param kind       Role in the route.
     * @param order      Position in the route.
     * @return The new waypoint.
     */
    static public Waypoint createWaypoint(Coordinate coordinate, String name, WaypointKind kind, int order)
    {
        return Waypoint.builder()
                .id(UUID.randomUUID().toString())
                .coordinate(coordinate)
                .name(name)
                .kind(kind)
                .order(order)
                .build();
    }

    /**
     * The coordinates of the waypoints in route order.
     *
     * @param waypoints Waypoints in route order.
     * @return One coordinate per waypoint.
     */
    static public List<Coordinate> coordinatesOf(List<Waypoint> waypoints)
    {
        List<Coordinate> coordinates = new ArrayList<>(waypoints.size());
        for (Waypoint waypoint : waypoints)
        {
            coordinates.add(waypoint.getCoordinate());
        }

        return List.copyOf(coordinates);
    }

    /**
     * Find the position of a waypoint by identifier.
     *
     * @param waypoints Waypoints in route order.
     * @param id        Identifier to look for.
     * @return The index, or -1 when there is no such waypoint.
     */
    static public int indexOf(List<Waypoint> waypoints, String id)
    {
        for (int i = 0; i < waypoints.size(); ++i)
        {
            if (waypoints.get(i).getId().equals(id))
            {
                return i;
            }
        }

        return -1;
    }
}
