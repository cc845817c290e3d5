package com.tarterware.pedalpath.components;

import java.util.List;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.LocationUpdate;
import com.tarterware.pedalpath.models.NavigationSnapshot;
import com.tarterware.pedalpath.models.NavigationStatus;
import com.tarterware.pedalpath.models.NearestPoint;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.utilities.GeoUtilities;
import com.tarterware.pedalpath.utilities.SpeedSmoother;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Live state of one navigation run along a saved route.
 *
 * <p>
 * A session is mutable and owned by the {@link NavigationEngine}, which only
 * touches it from its event loop. Readers get an immutable copy from
 * {@link #toSnapshot()}.
 * </p>
 *
 * <p>
 * Each accepted fix is projected onto the route geometry; the projection gives
 * distance traveled, distance remaining, progress and the off-route flag. ETA
 * uses the raw GPS speed, and only while the rider is moving faster than
 * {@link #MPS_MINIMUM_ETA_SPEED}.
 * </p>
 */
@ToString(exclude = { "geometry", "cumulativeDistances", "speedSmoother" })
public class NavigationSession
{
    public static final int SPEED_SAMPLE_CAPACITY = 5;

    public static final double MPS_MINIMUM_ETA_SPEED = 0.5;

    @Getter
    private final String routeId;

    @Getter
    private final String routeName;

    @Getter
    private final List<Coordinate> geometry;

    // Distance from the start of the geometry to each of its points.
    private double[] cumulativeDistances;

    @Getter
    private final double totalDistance;

    @Getter
    @Setter
    private NavigationStatus status = NavigationStatus.ACTIVE;

    @Getter
    private Coordinate currentLocation;

    @Getter
    private Double currentSpeed;

    @Getter
    private Double currentHeading;

    private final SpeedSmoother speedSmoother = new SpeedSmoother(SPEED_SAMPLE_CAPACITY);

    @Getter
    private int nearestIndex = 0;

    @Getter
    private double distanceFromRoute = 0.0;

    @Getter
    private boolean offRoute = false;

    @Getter
    private double distanceTraveled = 0.0;

    @Getter
    private double distanceRemaining;

    @Getter
    private double progressPercent = 0.0;

    @Getter
    private Double etaSeconds;

    // Stays 0 until the first fix; hasFix tells an unset value from a fix at 0.
    @Getter
    private long lastFixTimestamp = 0;

    @Getter
    private boolean hasFix = false;

    @Getter
    @Setter
    private String error;

    /**
     * Create a session for the given route. The cumulative distance table is
     * computed here, once.
     *
     * @param route Route to follow; its geometry must have at least 2 points.
     * @throws IllegalArgumentException if the geometry is too short.
     */
    public NavigationSession(SavedRoute route)
    {
        if ((route.getGeometry() == null) || (route.getGeometry().size() < 2))
        {
            throw new IllegalArgumentException("Route geometry must have at least 2 points");
        }

        this.routeId = route.getId();
        this.routeName = route.getName();
        this.geometry = List.copyOf(route.getGeometry());
        this.cumulativeDistances = GeoUtilities.cumulativeDistances(geometry);
        this.totalDistance = cumulativeDistances[cumulativeDistances.length - 1];
        this.distanceRemaining = totalDistance;
    }

    /**
     * Fold a GPS fix into the session.
     *
     * @param update                  The fix.
     * @param metersOffRouteThreshold Distance from the route beyond which the
     *                                rider is off route.
     * @return true when this fix took the rider off the route.
     */
    public boolean applyLocation(LocationUpdate update, double metersOffRouteThreshold)
    {
        Coordinate location = update.getCoordinate();

        NearestPoint nearest = GeoUtilities.nearestPointOnPolyline(location, geometry);
        double traveled = GeoUtilities.distanceAlongPolyline(nearest, geometry, cumulativeDistances);

        currentLocation = location;
        currentSpeed = update.getSpeed();
        currentHeading = update.getHeading();
        lastFixTimestamp = update.getTimestamp();
        hasFix = true;

        speedSmoother.recordReading(update.getSpeed());

        nearestIndex = nearest.getIndex();
        distanceFromRoute = nearest.getDistance();
        distanceTraveled = traveled;
        distanceRemaining = Math.max(0.0, totalDistance - traveled);
        progressPercent = (totalDistance > 0.0) ? Math.min(100.0, traveled / totalDistance * 100.0) : 0.0;

        if ((currentSpeed != null) && (currentSpeed > MPS_MINIMUM_ETA_SPEED))
        {
            etaSeconds = distanceRemaining / currentSpeed;
        }
        else
        {
            etaSeconds = null;
        }

        boolean wasOffRoute = offRoute;
        offRoute = distanceFromRoute > metersOffRouteThreshold;

        return offRoute && !wasOffRoute;
    }

    /**
     * @param update A fix.
     * @return true when the fix carries the same timestamp as the last one
     *         applied.
     */
    public boolean isRepeatOf(LocationUpdate update)
    {
        return hasFix && (update.getTimestamp() == lastFixTimestamp);
    }

    /**
     * @return the weighted moving average of recent speeds, in meters per second.
     */
    public double getSmoothedSpeed()
    {
        return speedSmoother.getSmoothedSpeed();
    }

    /**
     * Drop the cumulative distance table once the session is over.
     */
    public void release()
    {
        cumulativeDistances = null;
        speedSmoother.reset();
    }

    /**
     * @return an immutable copy of the session.
     */
    public NavigationSnapshot toSnapshot()
    {
        return NavigationSnapshot.builder()
                .status(status)
                .routeId(routeId)
                .routeName(routeName)
                .totalDistance(totalDistance)
                .currentLocation(currentLocation)
                .currentSpeed(currentSpeed)
                .currentHeading(currentHeading)
                .smoothedSpeed(speedSmoother.getSmoothedSpeed())
                .nearestIndex(nearestIndex)
                .distanceFromRoute(distanceFromRoute)
                .offRoute(offRoute)
                .distanceTraveled(distanceTraveled)
                .distanceRemaining(distanceRemaining)
                .progressPercent(progressPercent)
                .etaSeconds(etaSeconds)
                .lastFixTimestamp(lastFixTimestamp)
                .error(error)
                .build();
    }
}
