package com.tarterware.pedalpath.controllers;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.PlanningMode;
import com.tarterware.pedalpath.models.RouteSummary;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.services.GpxExportService;
import com.tarterware.pedalpath.services.RouteStorageService;

class RouteControllerTest
{
    private static final SavedRoute ROUTE = SavedRoute.builder()
            .id("r1")
            .name("Commute")
            .mode(PlanningMode.POINT_TO_POINT)
            .waypoints(List.of())
            .geometry(List.of(Coordinate.of(0, 0), Coordinate.of(0, 0.001), Coordinate.of(0, 0.002)))
            .distance(222.4)
            .build();

    private RouteStorageService routeStorageService;

    private MockMvc mockMvc;

    @BeforeEach
    void setup()
    {
        routeStorageService = mock(RouteStorageService.class);
        when(routeStorageService.findById("r1")).thenReturn(Optional.of(ROUTE));
        when(routeStorageService.findById("missing")).thenReturn(Optional.empty());

        mockMvc = MockMvcBuilders
                .standaloneSetup(new RouteController(routeStorageService, new GpxExportService())).build();
    }

    @Test
    void testGetRoute() throws Exception
    {
        mockMvc.perform(get("/api/routes/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Commute"))
                .andExpect(jsonPath("$.geometry", hasSize(3)));

        mockMvc.perform(get("/api/routes/missing")).andExpect(status().isNotFound());
    }

    @Test
    void testGpxDownload() throws Exception
    {
        mockMvc.perform(get("/api/routes/r1/gpx"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", containsString("application/gpx+xml")))
                .andExpect(header().string("Content-Disposition", containsString("r1.gpx")))
                .andExpect(content().string(containsString("<trkseg>")));
    }

    @Test
    void testSamples() throws Exception
    {
        mockMvc.perform(get("/api/routes/r1/samples").param("stepMeters", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].latitude").value(0.0))
                .andExpect(jsonPath("$[0].longitude").value(0.0));

        mockMvc.perform(get("/api/routes/r1/samples").param("stepMeters", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testListing() throws Exception
    {
        RouteSummary summary = new RouteSummary();
        summary.setId("r1");
        summary.setName("Commute");
        when(routeStorageService.findAll(0, 10)).thenReturn(List.of(ROUTE));
        when(routeStorageService.toSummary(ROUTE)).thenReturn(summary);
        when(routeStorageService.count()).thenReturn(1L);

        mockMvc.perform(get("/api/routes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].name").value("Commute"))
                .andExpect(jsonPath("$.page.totalElements").value(1));
    }

    @Test
    void testListingRejectsBadPaging() throws Exception
    {
        mockMvc.perform(get("/api/routes").param("page", "-1")).andExpect(status().isBadRequest());

        verify(routeStorageService, never()).findAll(anyInt(), anyInt());
    }

    @Test
    void testDelete() throws Exception
    {
        when(routeStorageService.delete(anyString())).thenReturn(false);
        when(routeStorageService.delete("r1")).thenReturn(true);

        mockMvc.perform(delete("/api/routes/r1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/routes/missing")).andExpect(status().isNotFound());
    }
}
