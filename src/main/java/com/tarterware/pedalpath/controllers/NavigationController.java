package com.tarterware.pedalpath.controllers;

import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.pedalpath.components.NavigationEngine;
import com.tarterware.pedalpath.components.PushLocationProvider;
import com.tarterware.pedalpath.models.FailureReason;
import com.tarterware.pedalpath.models.LocationUpdate;
import com.tarterware.pedalpath.models.NavigationSnapshot;
import com.tarterware.pedalpath.models.NavigationStatus;
import com.tarterware.pedalpath.models.NavigationViewModel;
import com.tarterware.pedalpath.models.OperationResult;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.services.RouteStorageService;
import com.tarterware.pedalpath.utilities.GeoUtilities;
import com.tarterware.pedalpath.utilities.StringUtilities;

@RestController
@RequestMapping("/api/navigation")
public class NavigationController
{
    private final NavigationEngine navigationEngine;

    private final PushLocationProvider pushLocationProvider;

    private final RouteStorageService routeStorageService;

    public NavigationController(NavigationEngine navigationEngine, PushLocationProvider pushLocationProvider,
            RouteStorageService routeStorageService)
    {
        this.navigationEngine = navigationEngine;
        this.pushLocationProvider = pushLocationProvider;
        this.routeStorageService = routeStorageService;
    }

    @PostMapping("/start/{routeId}")
    ResponseEntity<OperationResult<NavigationSnapshot>> startNavigation(@PathVariable String routeId)
    {
        Optional<SavedRoute> route = routeStorageService.findById(routeId);
        if (route.isEmpty())
        {
            return ResultResponses
                    .toResponse(OperationResult.failure(FailureReason.ROUTE_NOT_FOUND, "No route with id " + routeId));
        }

        return ResultResponses.toResponse(navigationEngine.startNavigation(route.get()));
    }

    @PostMapping("/pause")
    ResponseEntity<OperationResult<NavigationSnapshot>> pauseNavigation()
    {
        return ResultResponses.toResponse(navigationEngine.pauseNavigation());
    }

    @PostMapping("/resume")
    ResponseEntity<OperationResult<NavigationSnapshot>> resumeNavigation()
    {
        return ResultResponses.toResponse(navigationEngine.resumeNavigation());
    }

    @PostMapping("/stop")
    ResponseEntity<OperationResult<NavigationSnapshot>> stopNavigation()
    {
        return ResultResponses.toResponse(navigationEngine.stopNavigation());
    }

    /**
     * Accept a fix from the rider's device. Processing is asynchronous, so the
     * response only says whether a session was listening.
     */
    @PostMapping("/location")
    ResponseEntity<OperationResult<Integer>> pushLocation(@RequestBody LocationUpdate update)
    {
        int delivered = pushLocationProvider.publish(update);
        if (delivered == 0)
        {
            return ResultResponses.toResponse(
                    OperationResult.failure(FailureReason.NOT_NAVIGATING, "No navigation session is listening"));
        }

        return ResultResponses.toResponse(OperationResult.ok(delivered), HttpStatus.ACCEPTED);
    }

    @GetMapping("/state")
    ResponseEntity<NavigationViewModel> getViewModel()
    {
        NavigationViewModel viewModel = createViewModelFor(navigationEngine.getSnapshot());

        return new ResponseEntity<NavigationViewModel>(viewModel, HttpStatus.OK);
    }

    @GetMapping("/snapshot")
    ResponseEntity<NavigationSnapshot> getSnapshot()
    {
        return new ResponseEntity<NavigationSnapshot>(navigationEngine.getSnapshot(), HttpStatus.OK);
    }

    /**
     * Format a snapshot for display.
     *
     * @param snapshot The navigation state.
     * @return the view model.
     */
    NavigationViewModel createViewModelFor(NavigationSnapshot snapshot)
    {
        NavigationViewModel viewModel = new NavigationViewModel();

        viewModel.setNavigating(snapshot.getStatus() != NavigationStatus.IDLE);
        viewModel.setPaused(snapshot.getStatus() == NavigationStatus.PAUSED);
        viewModel.setRouteName(snapshot.getRouteName());

        // Display the smoothed speed; raw GPS speed jitters from fix to fix.
        double speed = Math.max(0.0, snapshot.getSmoothedSpeed());
        viewModel.setCurrentSpeedKmh(GeoUtilities.convertMetersPerSecondToKmh(speed));
        viewModel.setFormattedSpeed(StringUtilities.formatSpeed(speed));

        viewModel.setDistanceTraveled(snapshot.getDistanceTraveled());
        viewModel.setDistanceRemaining(snapshot.getDistanceRemaining());
        viewModel.setProgressPercent(snapshot.getProgressPercent());
        viewModel.setFormattedDistanceTraveled(StringUtilities.formatDistance(snapshot.getDistanceTraveled()));
        viewModel.setFormattedDistanceRemaining(StringUtilities.formatDistance(snapshot.getDistanceRemaining()));

        viewModel.setEstimatedTimeRemaining(snapshot.getEtaSeconds());
        viewModel.setFormattedTimeRemaining(StringUtilities.formatDuration(snapshot.getEtaSeconds()));

        viewModel.setOffRoute(snapshot.isOffRoute());
        viewModel.setDistanceFromRoute(snapshot.getDistanceFromRoute());
        viewModel.setError(snapshot.getError());

        return viewModel;
    }
}
