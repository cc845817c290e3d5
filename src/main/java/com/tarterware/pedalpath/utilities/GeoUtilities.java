package com.tarterware.pedalpath.utilities;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Envelope;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.NearestPoint;
import com.tarterware.pedalpath.models.SegmentProjection;

/**
 * Stateless geometry functions shared by route planning and navigation. All
 * distances are great-circle distances from {@link #haversineDistance}.
 */
public class GeoUtilities
{
    public static double METERS_EARTH_RADIUS = 6371000.0;
    public static double KMH_PER_MPS = 3.6;

    /**
     * Great-circle distance between two positions.
     *
     * @param degLatitude1  Latitude of the first position in degrees.
     * @param degLongitude1 Longitude of the first position in degrees.
     * @param degLatitude2  Latitude of the second position in degrees.
     * @param degLongitude2 Longitude of the second position in degrees.
     * @return Distance in meters.
     */
    static public double haversineDistance(double degLatitude1, double degLongitude1, double degLatitude2,
            double degLongitude2)
    {
        double radDeltaLatitude = Math.toRadians(degLatitude2 - degLatitude1);
        double radDeltaLongitude = Math.toRadians(degLongitude2 - degLongitude1);
        double a = Math.sin(radDeltaLatitude / 2) * Math.sin(radDeltaLatitude / 2)
                + Math.cos(Math.toRadians(degLatitude1)) * Math.cos(Math.toRadians(degLatitude2))
                        * Math.sin(radDeltaLongitude / 2) * Math.sin(radDeltaLongitude / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return METERS_EARTH_RADIUS * c;
    }

    /**
     * Great-circle distance between two Coordinates.
     *
     * @param a First Coordinate.
     * @param b Second Coordinate.
     * @return Distance in meters.
     */
    static public double haversineDistance(Coordinate a, Coordinate b)
    {
        return haversineDistance(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }

    /**
     * Find the point on a segment closest to the given point. The projection is
     * done in longitude/latitude space with the projection parameter clamped to
     * [0, 1], so the result never lies outside the segment.
     *
     * @param point        Point to project.
     * @param segmentStart First end of the segment.
     * @param segmentEnd   Second end of the segment.
     * @return The closest point and its distance in meters from the given point.
     */
    static public SegmentProjection projectPointOntoSegment(Coordinate point, Coordinate segmentStart,
            Coordinate segmentEnd)
    {
        double px = point.getLongitude();
        double py = point.getLatitude();
        double x1 = segmentStart.getLongitude();
        double y1 = segmentStart.getLatitude();
        double dx = segmentEnd.getLongitude() - x1;
        double dy = segmentEnd.getLatitude() - y1;

        // Zero-length segment.
        if ((dx == 0.0) && (dy == 0.0))
        {
            return new SegmentProjection(haversineDistance(point, segmentStart), segmentStart);
        }

        double t = ((px - x1) * dx + (py - y1) * dy) / (dx * dx + dy * dy);
        t = Math.max(0.0, Math.min(1.0, t));

        Coordinate closestPoint = Coordinate.of(y1 + t * dy, x1 + t * dx);

        return new SegmentProjection(haversineDistance(point, closestPoint), closestPoint);
    }

    /**
     * Find the point on a polyline closest to the given point by checking every
     * segment. When two segments are equally close the earlier one wins.
     *
     * @param point    Point to project.
     * @param polyline Ordered path.
     * @return Index of the segment start, distance in meters and the closest
     *         point.
     */
    static public NearestPoint nearestPointOnPolyline(Coordinate point, List<Coordinate> polyline)
    {
        if (polyline.isEmpty())
        {
            return new NearestPoint(0, Double.POSITIVE_INFINITY, point);
        }

        if (polyline.size() == 1)
        {
            return new NearestPoint(0, haversineDistance(point, polyline.get(0)), polyline.get(0));
        }

        int nearestIndex = 0;
        double nearestDistance = Double.POSITIVE_INFINITY;
        Coordinate nearestCoordinate = polyline.get(0);
        for (int i = 0; i < polyline.size() - 1; ++i)
        {
            SegmentProjection projection = projectPointOntoSegment(point, polyline.get(i), polyline.get(i + 1));
            if (projection.getDistance() < nearestDistance)
            {
                nearestDistance = projection.getDistance();
                nearestCoordinate = projection.getClosestPoint();
                nearestIndex = i;
            }
        }

        return new NearestPoint(nearestIndex, nearestDistance, nearestCoordinate);
    }

    /**
     * Running distance from the start of a polyline to each of its points.
     *
     * @param polyline Ordered path.
     * @return One entry per point; the first is always 0.
     */
    static public double[] cumulativeDistances(List<Coordinate> polyline)
    {
        double[] distances = new double[polyline.size()];
        for (int i = 1; i < polyline.size(); ++i)
        {
            distances[i] = distances[i - 1] + haversineDistance(polyline.get(i - 1), polyline.get(i));
        }

        return distances;
    }

    /**
     * Total length of a polyline.
     *
     * @param polyline Ordered path.
     * @return Length in meters, 0 for fewer than two points.
     */
    static public double pathDistance(List<Coordinate> polyline)
    {
        double total = 0.0;
        for (int i = 1; i < polyline.size(); ++i)
        {
            total += haversineDistance(polyline.get(i - 1), polyline.get(i));
        }

        return total;
    }

    /**
     * Distance along a polyline to the given projection onto it.
     *
     * @param nearestPoint        Projection from
     *                            {@link #nearestPointOnPolyline(Coordinate, List)}.
     * @param polyline            The polyline that was projected onto.
     * @param cumulativeDistances Table from {@link #cumulativeDistances(List)}.
     * @return Meters from the start of the polyline.
     */
    static public double distanceAlongPolyline(NearestPoint nearestPoint, List<Coordinate> polyline,
            double[] cumulativeDistances)
    {
        if (polyline.isEmpty())
        {
            return 0.0;
        }

        int index = nearestPoint.getIndex();
        return cumulativeDistances[index] + haversineDistance(polyline.get(index), nearestPoint.getPoint());
    }

    /**
     * Find the coordinate at a given distance along a polyline, interpolating
     * linearly inside the containing segment.
     *
     * @param polyline            Ordered path.
     * @param metersTarget        Distance from the start.
     * @param cumulativeDistances Precomputed table, or null to compute it here.
     * @return The coordinate, the last point when the distance is beyond the end,
     *         or null for an empty polyline.
     */
    static public Coordinate coordinateAtDistance(List<Coordinate> polyline, double metersTarget,
            double[] cumulativeDistances)
    {
        if (polyline.isEmpty())
        {
            return null;
        }
        if (polyline.size() == 1)
        {
            return polyline.get(0);
        }

        double[] distances = (cumulativeDistances != null) ? cumulativeDistances : cumulativeDistances(polyline);

        for (int i = 1; i < distances.length; ++i)
        {
            if (distances[i] >= metersTarget)
            {
                double segmentLength = distances[i] - distances[i - 1];
                if (segmentLength == 0.0)
                {
                    return polyline.get(i - 1);
                }

                double ratio = Math.max(0.0, (metersTarget - distances[i - 1]) / segmentLength);
                Coordinate start = polyline.get(i - 1);
                Coordinate end = polyline.get(i);
                return Coordinate.of(start.getLatitude() + (end.getLatitude() - start.getLatitude()) * ratio,
                        start.getLongitude() + (end.getLongitude() - start.getLongitude()) * ratio);
            }
        }

        return polyline.get(polyline.size() - 1);
    }

    /**
     * Sample a polyline at a fixed spacing.
     *
     * @param polyline    Ordered path.
     * @param metersStep  Spacing between samples; must be positive.
     * @return Samples from the first to the last point inclusive.
     * @throws IllegalArgumentException if metersStep is not positive.
     */
    static public List<Coordinate> samplePath(List<Coordinate> polyline, double metersStep)
    {
        if (metersStep <= 0.0)
        {
            throw new IllegalArgumentException("metersStep must be positive: " + metersStep);
        }

        List<Coordinate> samples = new ArrayList<>();
        if (polyline.isEmpty())
        {
            return samples;
        }

        double[] distances = cumulativeDistances(polyline);
        double metersTotal = distances[distances.length - 1];
        for (double meters = 0.0; meters < metersTotal; meters += metersStep)
        {
            samples.add(coordinateAtDistance(polyline, meters, distances));
        }
        samples.add(polyline.get(polyline.size() - 1));

        return samples;
    }

    /**
     * Bounding box of a polyline, optionally grown by a buffer.
     *
     * @param polyline     Ordered path.
     * @param metersBuffer Distance to grow every side by.
     * @return Envelope with x as longitude and y as latitude, or null when the
     *         polyline is empty.
     */
    static public Envelope boundingBox(List<Coordinate> polyline, double metersBuffer)
    {
        if (polyline.isEmpty())
        {
            return null;
        }

        Envelope envelope = new Envelope();
        for (Coordinate coordinate : polyline)
        {
            envelope.expandToInclude(coordinate.getLongitude(), coordinate.getLatitude());
        }

        if (metersBuffer > 0.0)
        {
            // Measure the buffer at the center latitude, where longitude degrees are
            // representative of the box.
            Coordinate center = Coordinate.of(envelope.centre().y, envelope.centre().x);
            Coordinate north = getCoordinateAtBearingAndRange(center, metersBuffer, 0.0);
            Coordinate east = getCoordinateAtBearingAndRange(center, metersBuffer, 90.0);
            envelope.expandBy(east.getLongitude() - center.getLongitude(),
                    north.getLatitude() - center.getLatitude());
        }

        return envelope;
    }

    /**
     * Get the Coordinate at the bearing and range from the given Coordinate.
     *
     * @param coordinate  Starting position.
     * @param metersRange Distance to travel.
     * @param degBearing  Initial bearing, degrees clockwise from north.
     * @return destination Coordinate
     */
    static public Coordinate getCoordinateAtBearingAndRange(Coordinate coordinate, double metersRange,
            double degBearing)
    {
        double radLatitude = Math.toRadians(coordinate.getLatitude());
        double radLongitude = Math.toRadians(coordinate.getLongitude());
        double radBearing = Math.toRadians(degBearing);
        double radAngularRange = metersRange / METERS_EARTH_RADIUS;

        double radLatitudeDest = Math.asin(Math.sin(radLatitude) * Math.cos(radAngularRange)
                + Math.cos(radLatitude) * Math.sin(radAngularRange) * Math.cos(radBearing));
        double radLongitudeDest = radLongitude
                + Math.atan2(Math.sin(radBearing) * Math.sin(radAngularRange) * Math.cos(radLatitude),
                        Math.cos(radAngularRange) - Math.sin(radLatitude) * Math.sin(radLatitudeDest));

        return Coordinate.of(Math.toDegrees(radLatitudeDest), Math.toDegrees(radLongitudeDest));
    }

    /**
     * Convert speed in meters per second to kilometers per hour.
     *
     * @param mps Speed in meters per second.
     * @return Speed in kilometers per hour.
     */
    static public double convertMetersPerSecondToKmh(double mps)
    {
        return mps * KMH_PER_MPS;
    }
}
