package com.tarterware.pedalpath.components;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.NearestPoint;
import com.tarterware.pedalpath.models.SegmentInfo;
import com.tarterware.pedalpath.models.Waypoint;
import com.tarterware.pedalpath.utilities.GeoUtilities;

/**
 * Maps a pressed coordinate onto the waypoint-to-waypoint segment of the route
 * geometry it falls on, so a drag on the line can insert a via-waypoint in the
 * right place.
 */
@Component
public class RouteSegmentEditor
{
    private static final Logger logger = LoggerFactory.getLogger(RouteSegmentEditor.class);

    private final double metersSelectionThreshold;

    public RouteSegmentEditor(
            @Value("${com.tarterware.pedalpath.segment-selection-threshold-meters:50}") double metersSelectionThreshold)
    {
        this.metersSelectionThreshold = metersSelectionThreshold;
    }

    /**
     * Find the segment a press on the route belongs to.
     *
     * @param pressed   Where the user pressed.
     * @param waypoints Waypoints in route order.
     * @param geometry  Route geometry through the waypoints.
     * @return The segment, or empty when there is no route or the press is
     *         further from it than the selection threshold.
     */
    public Optional<SegmentInfo> findSegmentForInsertion(Coordinate pressed, List<Waypoint> waypoints,
            List<Coordinate> geometry)
    {
        if ((waypoints.size() < 2) || (geometry.size() < 2))
        {
            return Optional.empty();
        }

        double[] cumulativeDistances = GeoUtilities.cumulativeDistances(geometry);

        NearestPoint nearest = GeoUtilities.nearestPointOnPolyline(pressed, geometry);
        if (nearest.getDistance() > metersSelectionThreshold)
        {
            logger.debug("Press is {} m from the route; threshold is {} m.", nearest.getDistance(),
                    metersSelectionThreshold);
            return Optional.empty();
        }

        double pressedAlong = GeoUtilities.distanceAlongPolyline(nearest, geometry, cumulativeDistances);

        double[] waypointAlong = new double[waypoints.size()];
        for (int i = 0; i < waypoints.size(); ++i)
        {
            NearestPoint waypointNearest = GeoUtilities.nearestPointOnPolyline(waypoints.get(i).getCoordinate(),
                    geometry);
            waypointAlong[i] = GeoUtilities.distanceAlongPolyline(waypointNearest, geometry, cumulativeDistances);
        }

        int segmentIndex = -1;
        for (int i = 0; i < waypoints.size() - 1; ++i)
        {
            if ((waypointAlong[i] <= pressedAlong) && (pressedAlong <= waypointAlong[i + 1]))
            {
                segmentIndex = i;
            }
        }

        if (segmentIndex < 0)
        {
            // Before the first waypoint or past the last one.
            segmentIndex = (pressedAlong < waypointAlong[0]) ? 0 : waypoints.size() - 2;
        }

        SegmentInfo segmentInfo = SegmentInfo.builder()
                .segmentIndex(segmentIndex)
                .insertAtIndex(segmentIndex + 1)
                .nearestGeometryIndex(nearest.getIndex())
                .distanceToRoute(nearest.getDistance())
                .nearestCoordinate(nearest.getPoint())
                .distanceAlongRoute(pressedAlong)
                .build();

        return Optional.of(segmentInfo);
    }

    public double getMetersSelectionThreshold()
    {
        return metersSelectionThreshold;
    }
}
