package com.tarterware.pedalpath.controllers;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.tarterware.pedalpath.components.RoutePlanner;
import com.tarterware.pedalpath.components.RouteSegmentEditor;
import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.PlanningMode;
import com.tarterware.pedalpath.models.RoutingProfile;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.services.DirectionsService;
import com.tarterware.pedalpath.services.RouteStorageService;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class PlanningControllerTest
{
    private RouteStorageService routeStorageService;

    private RoutePlanner routePlanner;

    private MockMvc mockMvc;

    @BeforeEach
    void setup()
    {
        routeStorageService = mock(RouteStorageService.class);
        routePlanner = new RoutePlanner(mock(DirectionsService.class), new RouteSegmentEditor(50.0),
                new SimpleMeterRegistry(), RoutingProfile.CYCLING);

        mockMvc = MockMvcBuilders.standaloneSetup(new PlanningController(routePlanner, routeStorageService))
                .build();
    }

    private void addWaypoint(double latitude, double longitude, String name) throws Exception
    {
        mockMvc.perform(post("/api/planning/waypoints").contentType(MediaType.APPLICATION_JSON)
                .content(String.format("{\"latitude\": %s, \"longitude\": %s, \"name\": \"%s\"}", latitude,
                        longitude, name)))
                .andExpect(status().isOk());
    }

    @Test
    void testEditingRequiresPlanning() throws Exception
    {
        mockMvc.perform(post("/api/planning/waypoints").contentType(MediaType.APPLICATION_JSON)
                .content("{\"latitude\": 48.1, \"longitude\": 11.5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.failure").value("NOT_PLANNING"));
    }

    @Test
    void testStartAndAddWaypoints() throws Exception
    {
        mockMvc.perform(post("/api/planning/start").param("mode", "FREEFORM"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.planning").value(true))
                .andExpect(jsonPath("$.mode").value("FREEFORM"));

        addWaypoint(48.1, 11.5, "Home");
        addWaypoint(48.2, 11.6, "Lake");

        mockMvc.perform(get("/api/planning/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.waypoints", hasSize(2)))
                .andExpect(jsonPath("$.waypoints[0].kind").value("START"))
                .andExpect(jsonPath("$.waypoints[1].kind").value("END"))
                .andExpect(jsonPath("$.canUndo").value(true));
    }

    @Test
    void testFailuresMapToStatusCodes() throws Exception
    {
        mockMvc.perform(post("/api/planning/start"));
        addWaypoint(48.1, 11.5, "Home");

        mockMvc.perform(post("/api/planning/calculate"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.failure").value("INSUFFICIENT_WAYPOINTS"));

        mockMvc.perform(post("/api/planning/waypoints/reorder").contentType(MediaType.APPLICATION_JSON)
                .content("{\"fromIndex\": 0, \"toIndex\": 5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.failure").value("INVALID_INDEX"));

        mockMvc.perform(delete("/api/planning/waypoints/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.failure").value("WAYPOINT_NOT_FOUND"));

        mockMvc.perform(put("/api/planning/waypoints/missing/position").contentType(MediaType.APPLICATION_JSON)
                .content("{\"latitude\": 48.3, \"longitude\": 11.7}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testFreeformCalculateUndoAndRedo() throws Exception
    {
        mockMvc.perform(post("/api/planning/start").param("mode", "FREEFORM"));
        addWaypoint(48.1, 11.5, "Home");
        addWaypoint(48.2, 11.6, "Lake");

        mockMvc.perform(post("/api/planning/calculate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value.geometry", hasSize(2)));

        mockMvc.perform(post("/api/planning/undo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.waypoints", hasSize(1)))
                .andExpect(jsonPath("$.canRedo").value(true));

        mockMvc.perform(post("/api/planning/redo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.waypoints", hasSize(2)));
    }

    @Test
    void testSaveStoresRoute() throws Exception
    {
        mockMvc.perform(post("/api/planning/start").param("mode", "FREEFORM"));
        addWaypoint(48.1, 11.5, "Home");
        addWaypoint(48.2, 11.6, "Lake");
        mockMvc.perform(post("/api/planning/calculate"));

        mockMvc.perform(post("/api/planning/save").contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"  Lake loop \", \"description\": \"Sunday\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.value.name").value("Lake loop"))
                .andExpect(jsonPath("$.value.waypoints", hasSize(2)));

        verify(routeStorageService).save(any(SavedRoute.class));
    }

    @Test
    void testSaveWithoutNameIsRejected() throws Exception
    {
        mockMvc.perform(post("/api/planning/start"));

        mockMvc.perform(post("/api/planning/save").contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.failure").value("INVALID_INPUT"));

        verify(routeStorageService, never()).save(any(SavedRoute.class));
    }

    @Test
    void testLoadRoute() throws Exception
    {
        SavedRoute saved = SavedRoute.builder()
                .id("r1")
                .name("Commute")
                .mode(PlanningMode.POINT_TO_POINT)
                .waypoints(List.of())
                .geometry(List.of(Coordinate.of(48.1, 11.5), Coordinate.of(48.2, 11.6)))
                .distance(13000.0)
                .build();
        when(routeStorageService.findById("r1")).thenReturn(Optional.of(saved));
        when(routeStorageService.findById("r2")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/planning/load/r2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.failure").value("ROUTE_NOT_FOUND"));

        mockMvc.perform(post("/api/planning/load/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value.planning").value(true))
                .andExpect(jsonPath("$.value.baseRouteId").value("r1"))
                .andExpect(jsonPath("$.value.geometry", hasSize(2)));
    }

    @Test
    void testCancel() throws Exception
    {
        mockMvc.perform(post("/api/planning/start"));
        addWaypoint(48.1, 11.5, "Home");

        mockMvc.perform(post("/api/planning/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.planning").value(false))
                .andExpect(jsonPath("$.waypoints", hasSize(0)));
    }
}
