package com.tarterware.pedalpath.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.SegmentInfo;
import com.tarterware.pedalpath.models.Waypoint;
import com.tarterware.pedalpath.models.WaypointKind;
import com.tarterware.pedalpath.utilities.WaypointUtilities;

class RouteSegmentEditorTest
{
    // Five geometry points about 111 m apart along the equator.
    private static final List<Coordinate> GEOMETRY = List.of(Coordinate.of(0, 0), Coordinate.of(0, 0.001),
            Coordinate.of(0, 0.002), Coordinate.of(0, 0.003), Coordinate.of(0, 0.004));

    private final RouteSegmentEditor editor = new RouteSegmentEditor(50.0);

    private static List<Waypoint> waypointsAt(double... longitudes)
    {
        Waypoint[] waypoints = new Waypoint[longitudes.length];
        for (int i = 0; i < longitudes.length; i++)
        {
            waypoints[i] = WaypointUtilities.createWaypoint(Coordinate.of(0, longitudes[i]), null, WaypointKind.VIA, i);
        }
        return WaypointUtilities.assignKinds(List.of(waypoints));
    }

    @Test
    void testPressBetweenSecondAndThirdWaypoint()
    {
        List<Waypoint> waypoints = waypointsAt(0, 0.002, 0.004);

        Optional<SegmentInfo> info = editor.findSegmentForInsertion(Coordinate.of(0.0001, 0.003), waypoints,
                GEOMETRY);

        assertTrue(info.isPresent());
        assertEquals(1, info.get().getSegmentIndex());
        assertEquals(2, info.get().getInsertAtIndex());
        assertEquals(2, info.get().getNearestGeometryIndex());
        assertEquals(0.003, info.get().getNearestCoordinate().getLongitude(), 1e-9);
        assertEquals(11.1, info.get().getDistanceToRoute(), 0.1);
        assertEquals(333.6, info.get().getDistanceAlongRoute(), 0.1);
    }

    @Test
    void testPressOnFirstSegment()
    {
        List<Waypoint> waypoints = waypointsAt(0, 0.002, 0.004);

        Optional<SegmentInfo> info = editor.findSegmentForInsertion(Coordinate.of(0, 0.0005), waypoints, GEOMETRY);

        assertTrue(info.isPresent());
        assertEquals(0, info.get().getSegmentIndex());
        assertEquals(1, info.get().getInsertAtIndex());
    }

    @Test
    void testPressOutsideWaypointSpanIsClamped()
    {
        // The geometry runs past both end waypoints.
        List<Waypoint> waypoints = waypointsAt(0.001, 0.002, 0.003);

        Optional<SegmentInfo> before = editor.findSegmentForInsertion(Coordinate.of(0, 0.0002), waypoints, GEOMETRY);
        assertEquals(0, before.get().getSegmentIndex());

        Optional<SegmentInfo> after = editor.findSegmentForInsertion(Coordinate.of(0, 0.0038), waypoints, GEOMETRY);
        assertEquals(1, after.get().getSegmentIndex());
        assertEquals(2, after.get().getInsertAtIndex());
    }

    @Test
    void testPressTooFarFromRoute()
    {
        List<Waypoint> waypoints = waypointsAt(0, 0.004);

        // About 111 m north of the line.
        assertTrue(editor.findSegmentForInsertion(Coordinate.of(0.001, 0.002), waypoints, GEOMETRY).isEmpty());
    }

    @Test
    void testNotEnoughRoute()
    {
        assertTrue(editor.findSegmentForInsertion(Coordinate.of(0, 0), waypointsAt(0), GEOMETRY).isEmpty());
        assertTrue(editor.findSegmentForInsertion(Coordinate.of(0, 0), waypointsAt(0, 0.004),
                List.of(Coordinate.of(0, 0))).isEmpty());
    }
}
