package com.tarterware.pedalpath.controllers;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.hateoas.PagedModel;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.RouteSummary;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.services.GpxExportService;
import com.tarterware.pedalpath.services.RouteStorageService;
import com.tarterware.pedalpath.utilities.GeoUtilities;

@RestController
@RequestMapping("/api/routes")
public class RouteController
{
    public static final MediaType GPX_MEDIA_TYPE = MediaType.parseMediaType("application/gpx+xml");

    private final RouteStorageService routeStorageService;

    private final GpxExportService gpxExportService;

    public RouteController(RouteStorageService routeStorageService, GpxExportService gpxExportService)
    {
        this.routeStorageService = routeStorageService;
        this.gpxExportService = gpxExportService;
    }

    @GetMapping
    ResponseEntity<PagedModel<RouteSummary>> getRoutes(@RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int pageSize)
    {
        if ((page < 0) || (pageSize < 1))
        {
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }

        // Get the routes for the current page
        List<RouteSummary> listSummaries = routeStorageService.findAll(page, pageSize).stream()
                .map(routeStorageService::toSummary).collect(Collectors.toList());

        // Create a Page object
        Page<RouteSummary> summaryPage = new PageImpl<>(listSummaries, PageRequest.of(page, pageSize),
                routeStorageService.count());

        // Create a PagedModel object
        PagedModel<RouteSummary> pagedModel = PagedModel.of(summaryPage.getContent(), new PagedModel.PageMetadata(
                summaryPage.getSize(), summaryPage.getNumber(), summaryPage.getTotalElements()));

        return new ResponseEntity<>(pagedModel, HttpStatus.OK);
    }

    @GetMapping("/{routeId}")
    ResponseEntity<SavedRoute> getRoute(@PathVariable String routeId)
    {
        Optional<SavedRoute> route = routeStorageService.findById(routeId);
        if (route.isEmpty())
        {
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }

        return new ResponseEntity<SavedRoute>(route.get(), HttpStatus.OK);
    }

    @GetMapping("/{routeId}/gpx")
    ResponseEntity<String> getRouteGpx(@PathVariable String routeId)
    {
        Optional<SavedRoute> route = routeStorageService.findById(routeId);
        if (route.isEmpty())
        {
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(GPX_MEDIA_TYPE);
        headers.setContentDispositionFormData("attachment", routeId + ".gpx");

        return new ResponseEntity<String>(gpxExportService.toGpx(route.get()), headers, HttpStatus.OK);
    }

    @GetMapping("/{routeId}/samples")
    ResponseEntity<List<Coordinate>> getRouteSamples(@PathVariable String routeId,
            @RequestParam(defaultValue = "100") double stepMeters)
    {
        if (stepMeters <= 0.0)
        {
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }

        Optional<SavedRoute> route = routeStorageService.findById(routeId);
        if (route.isEmpty())
        {
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }

        List<Coordinate> samples = GeoUtilities.samplePath(route.get().getGeometry(), stepMeters);

        return new ResponseEntity<List<Coordinate>>(samples, HttpStatus.OK);
    }

    @DeleteMapping("/{routeId}")
    ResponseEntity<Void> deleteRoute(@PathVariable String routeId)
    {
        if (!routeStorageService.delete(routeId))
        {
            return new ResponseEntity<>(HttpStatus.NOT_FOUND);
        }

        return new ResponseEntity<>(HttpStatus.NO_CONTENT);
    }
}
