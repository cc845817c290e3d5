package com.tarterware.pedalpath.services;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.tarterware.pedalpath.models.CalculatedRoute;
import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.RouteInstruction;
import com.tarterware.pedalpath.models.RoutingProfile;
import com.tarterware.pedalpath.models.directions.DirectionsResponse;
import com.tarterware.pedalpath.models.directions.DirectionsRoute;
import com.tarterware.pedalpath.models.directions.RouteLeg;
import com.tarterware.pedalpath.models.directions.RouteStep;
import com.tarterware.pedalpath.utilities.StringUtilities;

/**
 * Client for the routing services. Cycling routes come from Mapbox Directions;
 * driving and foot routes come from OSRM. Raw responses are cached in Redis
 * under the request path.
 */
@Service
public class DirectionsService
{
    public static final long HOURS_CACHE_LIFETIME = 100;

    private final RestTemplate restTemplate;

    private final RedisTemplate<String, Object> redisTemplate;

    private final String mapBoxApiUrl;

    private final String mapBoxApiKey;

    private final String osrmApiUrl;

    private static final Logger logger = LoggerFactory.getLogger(DirectionsService.class);

    public DirectionsService(RestTemplate restTemplate, RedisTemplate<String, Object> redisTemplate,
            @Value("${mapbox.api.url}") String mapBoxApiUrl, @Value("${mapbox.api.key}") String mapBoxApiKey,
            @Value("${osrm.api.url}") String osrmApiUrl)
    {
        this.restTemplate = restTemplate;
        this.redisTemplate = redisTemplate;
        this.mapBoxApiUrl = withTrailingSlash(mapBoxApiUrl);
        this.mapBoxApiKey = mapBoxApiKey;
        this.osrmApiUrl = withTrailingSlash(osrmApiUrl);
    }

    /**
     * Calculate a route through the given coordinates.
     *
     * @param coordinates Ordered positions the route must pass through.
     * @param profile     Travel profile.
     * @return The first route of the response.
     * @throws IllegalArgumentException if fewer than 2 coordinates are given.
     * @throws RoutingException         if the service fails or finds no route.
     */
    public CalculatedRoute getRoute(List<Coordinate> coordinates, RoutingProfile profile)
    {
        if ((coordinates == null) || (coordinates.size() < 2))
        {
            throw new IllegalArgumentException("There must be at least 2 coordinates to route between!");
        }

        DirectionsResponse response = getDirections(coordinates, profile);

        if (!"Ok".equals(response.getCode()))
        {
            throw new RoutingException("Routing failed with code " + response.getCode()
                    + (StringUtilities.isNullEmptyOrBlank(response.getMessage()) ? "" : ": " + response.getMessage()));
        }

        if ((response.getRoutes() == null) || response.getRoutes().isEmpty())
        {
            throw new RoutingException("No " + profile.getPathName() + " route found");
        }

        return toCalculatedRoute(response.getRoutes().get(0), profile);
    }

    /**
     * Fetch the raw routing response, from the cache when possible.
     *
     * @param coordinates Ordered positions the route must pass through.
     * @param profile     Travel profile.
     * @return The response body.
     * @throws RoutingException if the HTTP call fails or returns no body.
     */
    public DirectionsResponse getDirections(List<Coordinate> coordinates, RoutingProfile profile)
    {
        String directionsCacheKey = getCacheKey(coordinates, profile);

        DirectionsResponse cached = readCache(directionsCacheKey);
        if (cached != null)
        {
            logger.info("Directions via redis cache: {}", directionsCacheKey);
            return cached;
        }

        StringBuilder sb = new StringBuilder(isMapBox(profile) ? mapBoxApiUrl : osrmApiUrl);
        sb.append(directionsCacheKey);

        // Log the URL used to get the route, without token
        logger.info("Directions via REST: {}", sb);

        if (isMapBox(profile))
        {
            sb.append("&access_token=");
            sb.append(mapBoxApiKey);
        }

        DirectionsResponse directions;
        try
        {
            ResponseEntity<DirectionsResponse> respDirections = restTemplate.getForEntity(sb.toString(),
                    DirectionsResponse.class);
            directions = respDirections.getBody();
        }
        catch (RestClientException e)
        {
            throw new RoutingException("Routing request failed for " + directionsCacheKey, e);
        }

        if (directions == null)
        {
            throw new RoutingException("Routing service returned an empty body for " + directionsCacheKey);
        }

        // Only successful responses are worth keeping.
        if ("Ok".equals(directions.getCode()))
        {
            writeCache(directionsCacheKey, directions);
        }

        return directions;
    }

    /**
     * The request path, relative to the service base URL and without the access
     * token. Doubles as the cache key.
     *
     * @param coordinates Ordered positions the route must pass through.
     * @param profile     Travel profile.
     * @return The path and query.
     */
    public String getCacheKey(List<Coordinate> coordinates, RoutingProfile profile)
    {
        StringBuilder sb = new StringBuilder();
        if (isMapBox(profile))
        {
            sb.append("directions/v5/mapbox/");
        }
        else
        {
            sb.append("route/v1/");
        }
        sb.append(profile.getPathName());
        sb.append("/");

        for (Coordinate coordinate : coordinates)
        {
            sb.append(coordinate.getLongitude());
            sb.append(",");
            sb.append(coordinate.getLatitude());
            sb.append(";");
        }

        // Remove the trailing separator
        sb.deleteCharAt(sb.length() - 1);

        sb.append("?alternatives=false");
        sb.append("&geometries=geojson");
        sb.append("&overview=full");
        sb.append("&steps=true");
        if (isMapBox(profile))
        {
            sb.append("&language=en");
        }

        return sb.toString();
    }

    private CalculatedRoute toCalculatedRoute(DirectionsRoute route, RoutingProfile profile)
    {
        CalculatedRoute.CalculatedRouteBuilder builder = CalculatedRoute.builder()
                .distanceMeters(route.getDistance())
                .durationSeconds(route.getDuration());

        if (route.getGeometry() != null)
        {
            for (List<Double> lonLat : route.getGeometry().getCoordinates())
            {
                builder.geometryPoint(Coordinate.of(lonLat.get(1), lonLat.get(0)));
            }
        }

        if (route.getLegs() != null)
        {
            for (RouteLeg leg : route.getLegs())
            {
                if (leg.getSteps() == null)
                {
                    continue;
                }
                for (RouteStep step : leg.getSteps())
                {
                    builder.instruction(toInstruction(step, profile));
                }
            }
        }

        return builder.build();
    }

    private RouteInstruction toInstruction(RouteStep step, RoutingProfile profile)
    {
        String type = (step.getManeuver() != null) ? step.getManeuver().getType() : null;
        String modifier = (step.getManeuver() != null) ? step.getManeuver().getModifier() : null;

        // Mapbox writes a sentence per maneuver; OSRM only names the road.
        String text = null;
        if (isMapBox(profile) && (step.getManeuver() != null))
        {
            text = step.getManeuver().getInstruction();
        }
        if (StringUtilities.isNullEmptyOrBlank(text))
        {
            text = StringUtilities.isNullEmptyOrBlank(step.getName()) ? type : step.getName();
        }

        return new RouteInstruction(type, text, step.getDistance(), step.getDuration(), modifier);
    }

    private DirectionsResponse readCache(String directionsCacheKey)
    {
        try
        {
            return (DirectionsResponse) redisTemplate.opsForValue().get(directionsCacheKey);
        }
        catch (RuntimeException e)
        {
            logger.warn("Unable to read directions cache for {}", directionsCacheKey, e);
            return null;
        }
    }

    private void writeCache(String directionsCacheKey, DirectionsResponse directions)
    {
        try
        {
            redisTemplate.opsForValue().set(directionsCacheKey, directions, HOURS_CACHE_LIFETIME, TimeUnit.HOURS);
        }
        catch (RuntimeException e)
        {
            logger.warn("Unable to cache directions for {}", directionsCacheKey, e);
        }
    }

    private static boolean isMapBox(RoutingProfile profile)
    {
        return profile == RoutingProfile.CYCLING;
    }

    private static String withTrailingSlash(String url)
    {
        return url.endsWith("/") ? url : url + "/";
    }
}
