package com.tarterware.pedalpath.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import com.tarterware.pedalpath.models.RouteSummary;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.utilities.GeoUtilities;

/**
 * Keeps saved routes in Redis.
 *
 * <p>
 * Each route is stored under "route:{id}" through the template's JSON value
 * serializer. The ids are also kept in
 * the {@link #SAVED_ROUTE_REGISTRY} sorted set, scored by last update time, so
 * listings come back newest first.
 * </p>
 */
@Service
public class RouteStorageService
{
    public static final String SAVED_ROUTE_REGISTRY = "SavedRouteRegistry";

    private final RedisTemplate<String, Object> redisTemplate;

    private static final Logger logger = LoggerFactory.getLogger(RouteStorageService.class);

    public RouteStorageService(RedisTemplate<String, Object> redisTemplate)
    {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Store a route, replacing any route with the same id.
     *
     * @param route The route to store.
     * @return the stored route.
     */
    public SavedRoute save(SavedRoute route)
    {
        if ((route == null) || (route.getId() == null))
        {
            throw new IllegalArgumentException("route and its id cannot be null!");
        }

        redisTemplate.opsForValue().set(getRouteKey(route.getId()), route);
        redisTemplate.opsForZSet().add(SAVED_ROUTE_REGISTRY, route.getId(), route.getUpdatedAtEpochMillis());

        logger.info("Saved route {} \"{}\".", route.getId(), route.getName());

        return route;
    }

    /**
     * Retrieves a saved route by its id.
     *
     * @param routeId Identifier of the route.
     * @return the route, or empty when there is none.
     */
    public Optional<SavedRoute> findById(String routeId)
    {
        SavedRoute route = (SavedRoute) redisTemplate.opsForValue().get(getRouteKey(routeId));

        return Optional.ofNullable(route);
    }

    /**
     * Gets a page of saved routes, most recently updated first.
     *
     * @param page     page number to retrieve.
     * @param pageSize number of routes in each page.
     * @return The routes on the page.
     */
    public List<SavedRoute> findAll(int page, int pageSize)
    {
        if ((page < 0) || (pageSize < 1))
        {
            throw new IllegalArgumentException("Page " + page + " of page size " + pageSize + " is invalid!");
        }

        long start = (long) page * pageSize;
        Set<Object> ids = redisTemplate.opsForZSet().reverseRange(SAVED_ROUTE_REGISTRY, start, start + pageSize - 1);
        List<SavedRoute> routes = new ArrayList<>();
        if ((ids == null) || ids.isEmpty())
        {
            return routes;
        }

        List<String> idList = ids.stream().map(Object::toString).collect(Collectors.toList());
        List<String> keys = idList.stream().map(this::getRouteKey).collect(Collectors.toList());
        List<Object> values = redisTemplate.opsForValue().multiGet(keys);

        for (int i = 0; i < idList.size(); i++)
        {
            Object value = (values != null) ? values.get(i) : null;
            String id = idList.get(i);
            if (value == null)
            {
                // The record is gone; clean up the registry.
                logger.info("Route ID {} no longer exists. Removing from registry.", id);
                redisTemplate.opsForZSet().remove(SAVED_ROUTE_REGISTRY, id);
            }
            else
            {
                routes.add((SavedRoute) value);
            }
        }

        return routes;
    }

    /**
     * Delete a saved route.
     *
     * @param routeId Identifier of the route.
     * @return true when a route was deleted.
     */
    public boolean delete(String routeId)
    {
        Boolean deleted = redisTemplate.delete(getRouteKey(routeId));
        redisTemplate.opsForZSet().remove(SAVED_ROUTE_REGISTRY, routeId);

        if (Boolean.TRUE.equals(deleted))
        {
            logger.info("Deleted route {}.", routeId);
            return true;
        }

        return false;
    }

    /**
     * @return the number of saved routes.
     */
    public long count()
    {
        Long size = redisTemplate.opsForZSet().zCard(SAVED_ROUTE_REGISTRY);
        return (size != null) ? size : 0;
    }

    /**
     * Project a route onto its listing summary.
     *
     * @param route The route.
     * @return Summary with the bounds of its geometry.
     */
    public RouteSummary toSummary(SavedRoute route)
    {
        RouteSummary summary = new RouteSummary();
        summary.setId(route.getId());
        summary.setName(route.getName());
        summary.setDescription(route.getDescription());
        summary.setMode(route.getMode());
        summary.setDistance(route.getDistance());
        summary.setWaypointCount((route.getWaypoints() != null) ? route.getWaypoints().size() : 0);
        summary.setCreatedAtEpochMillis(route.getCreatedAtEpochMillis());
        summary.setUpdatedAtEpochMillis(route.getUpdatedAtEpochMillis());

        Envelope bounds = (route.getGeometry() != null) ? GeoUtilities.boundingBox(route.getGeometry(), 0.0) : null;
        if (bounds != null)
        {
            summary.setSouth(bounds.getMinY());
            summary.setWest(bounds.getMinX());
            summary.setNorth(bounds.getMaxY());
            summary.setEast(bounds.getMaxX());
        }

        return summary;
    }

    /**
     * Returns the Redis key used to store a route. The key is formatted as
     * "route:{routeId}".
     *
     * @param routeId Identifier of the route.
     * @return The formatted Redis key.
     */
    public String getRouteKey(String routeId)
    {
        return String.format("route:%s", routeId);
    }
}
