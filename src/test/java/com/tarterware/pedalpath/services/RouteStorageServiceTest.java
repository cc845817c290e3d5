package com.tarterware.pedalpath.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.PlanningMode;
import com.tarterware.pedalpath.models.RouteSummary;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.models.Waypoint;
import com.tarterware.pedalpath.models.WaypointKind;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RouteStorageServiceTest
{
    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    @Mock
    private ZSetOperations<String, Object> zSetOperations;

    private RouteStorageService routeStorageService;

    @BeforeEach
    void setup()
    {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);

        routeStorageService = new RouteStorageService(redisTemplate);
    }

    private static SavedRoute route(String id, long updatedAt)
    {
        return SavedRoute.builder()
                .id(id)
                .name("Route " + id)
                .mode(PlanningMode.POINT_TO_POINT)
                .waypoints(List.of(
                        Waypoint.builder().id(id + "-a").coordinate(Coordinate.of(48.1, 11.5))
                                .kind(WaypointKind.START).order(0).build(),
                        Waypoint.builder().id(id + "-b").coordinate(Coordinate.of(48.2, 11.7))
                                .kind(WaypointKind.END).order(1).build()))
                .geometry(List.of(Coordinate.of(48.1, 11.5), Coordinate.of(48.25, 11.6), Coordinate.of(48.2, 11.7)))
                .distance(15234.5)
                .duration(3120.0)
                .createdAtEpochMillis(updatedAt - 1000)
                .updatedAtEpochMillis(updatedAt)
                .build();
    }

    @Test
    void testSaveThenFind()
    {
        SavedRoute route = route("a", 5000);

        routeStorageService.save(route);
        verify(valueOperations).set("route:a", route);
        verify(zSetOperations).add(RouteStorageService.SAVED_ROUTE_REGISTRY, "a", 5000.0);

        when(valueOperations.get("route:a")).thenReturn(route);
        Optional<SavedRoute> found = routeStorageService.findById("a");

        assertTrue(found.isPresent());
        assertEquals(route, found.get());
    }

    @Test
    void testRouteSurvivesValueSerializer()
    {
        // The same value serializer RedisConfig installs on the template.
        GenericJackson2JsonRedisSerializer serializer = new GenericJackson2JsonRedisSerializer();
        SavedRoute route = route("a", 5000);

        Object restored = serializer.deserialize(serializer.serialize(route));

        assertEquals(route, restored);
    }

    @Test
    void testFindMissingRoute()
    {
        assertTrue(routeStorageService.findById("nope").isEmpty());
    }

    @Test
    void testSaveRejectsNull()
    {
        assertThrows(IllegalArgumentException.class, () -> routeStorageService.save(null));
    }

    @Test
    void testFindAllNewestFirstAndCleansRegistry()
    {
        SavedRoute route = route("b", 9000);
        when(zSetOperations.reverseRange(RouteStorageService.SAVED_ROUTE_REGISTRY, 0, 9))
                .thenReturn(new LinkedHashSet<Object>(List.of("b", "gone")));
        when(valueOperations.multiGet(List.of("route:b", "route:gone"))).thenReturn(Arrays.asList(route, null));

        List<SavedRoute> routes = routeStorageService.findAll(0, 10);

        assertEquals(1, routes.size());
        assertEquals("b", routes.get(0).getId());
        verify(zSetOperations).remove(RouteStorageService.SAVED_ROUTE_REGISTRY, "gone");
        verify(zSetOperations, never()).remove(RouteStorageService.SAVED_ROUTE_REGISTRY, "b");
    }

    @Test
    void testFindAllSecondPage()
    {
        when(zSetOperations.reverseRange(RouteStorageService.SAVED_ROUTE_REGISTRY, 5, 9))
                .thenReturn(new LinkedHashSet<Object>());

        assertTrue(routeStorageService.findAll(1, 5).isEmpty());
        verify(valueOperations, never()).multiGet(anyList());
    }

    @Test
    void testFindAllRejectsBadPaging()
    {
        assertThrows(IllegalArgumentException.class, () -> routeStorageService.findAll(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> routeStorageService.findAll(0, 0));
    }

    @Test
    void testDelete()
    {
        when(redisTemplate.delete("route:a")).thenReturn(true);
        when(redisTemplate.delete("route:b")).thenReturn(false);

        assertTrue(routeStorageService.delete("a"));
        assertFalse(routeStorageService.delete("b"));
        verify(zSetOperations).remove(RouteStorageService.SAVED_ROUTE_REGISTRY, "a");
        verify(zSetOperations).remove(RouteStorageService.SAVED_ROUTE_REGISTRY, "b");
    }

    @Test
    void testCount()
    {
        when(zSetOperations.zCard(RouteStorageService.SAVED_ROUTE_REGISTRY)).thenReturn(3L);

        assertEquals(3, routeStorageService.count());
    }

    @Test
    void testSummaryBounds()
    {
        RouteSummary summary = routeStorageService.toSummary(route("a", 5000));

        assertEquals("Route a", summary.getName());
        assertEquals(2, summary.getWaypointCount());
        assertEquals(15234.5, summary.getDistance(), 1e-9);
        assertEquals(48.1, summary.getSouth(), 1e-9);
        assertEquals(48.25, summary.getNorth(), 1e-9);
        assertEquals(11.5, summary.getWest(), 1e-9);
        assertEquals(11.7, summary.getEast(), 1e-9);
    }

    @Test
    void testRouteKey()
    {
        assertEquals("route:abc", routeStorageService.getRouteKey("abc"));
        verify(valueOperations, never()).get(anyString());
    }
}
