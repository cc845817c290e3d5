package com.tarterware.pedalpath.controllers;

import java.util.List;
import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.pedalpath.components.RoutePlanner;
import com.tarterware.pedalpath.models.CalculatedRoute;
import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.FailureReason;
import com.tarterware.pedalpath.models.OperationResult;
import com.tarterware.pedalpath.models.PlanningMode;
import com.tarterware.pedalpath.models.PlanningState;
import com.tarterware.pedalpath.models.ReorderRequest;
import com.tarterware.pedalpath.models.SaveRouteRequest;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.models.Waypoint;
import com.tarterware.pedalpath.models.WaypointRequest;
import com.tarterware.pedalpath.services.RouteStorageService;

@RestController
@RequestMapping("/api/planning")
public class PlanningController
{
    private final RoutePlanner routePlanner;

    private final RouteStorageService routeStorageService;

    public PlanningController(RoutePlanner routePlanner, RouteStorageService routeStorageService)
    {
        this.routePlanner = routePlanner;
        this.routeStorageService = routeStorageService;
    }

    @PostMapping("/start")
    ResponseEntity<PlanningState> startPlanning(@RequestParam(defaultValue = "POINT_TO_POINT") PlanningMode mode)
    {
        routePlanner.startPlanning(mode);

        return new ResponseEntity<PlanningState>(routePlanner.getState(), HttpStatus.OK);
    }

    @PostMapping("/cancel")
    ResponseEntity<PlanningState> cancelPlanning()
    {
        routePlanner.cancelPlanning();

        return new ResponseEntity<PlanningState>(routePlanner.getState(), HttpStatus.OK);
    }

    @PostMapping("/load/{routeId}")
    ResponseEntity<OperationResult<PlanningState>> loadExistingRoute(@PathVariable String routeId)
    {
        Optional<SavedRoute> route = routeStorageService.findById(routeId);
        if (route.isEmpty())
        {
            return ResultResponses
                    .toResponse(OperationResult.failure(FailureReason.ROUTE_NOT_FOUND, "No route with id " + routeId));
        }

        return ResultResponses.toResponse(routePlanner.loadExistingRoute(route.get()));
    }

    @GetMapping("/state")
    ResponseEntity<PlanningState> getState()
    {
        return new ResponseEntity<PlanningState>(routePlanner.getState(), HttpStatus.OK);
    }

    @PostMapping("/waypoints")
    ResponseEntity<OperationResult<Waypoint>> addWaypoint(@RequestBody WaypointRequest request)
    {
        Coordinate coordinate = Coordinate.of(request.getLatitude(), request.getLongitude());

        return ResultResponses.toResponse(routePlanner.addWaypoint(coordinate, request.getName()));
    }

    @PostMapping("/waypoints/insert")
    ResponseEntity<OperationResult<Waypoint>> insertViaWaypoint(@RequestBody WaypointRequest request)
    {
        Coordinate coordinate = Coordinate.of(request.getLatitude(), request.getLongitude());

        return ResultResponses.toResponse(routePlanner.insertViaWaypoint(coordinate, request.getIndex()));
    }

    @PutMapping("/waypoints/{waypointId}/position")
    ResponseEntity<OperationResult<Waypoint>> moveWaypoint(@PathVariable String waypointId,
            @RequestBody Coordinate coordinate)
    {
        return ResultResponses.toResponse(routePlanner.moveWaypoint(waypointId, coordinate));
    }

    @PostMapping("/waypoints/finish-move")
    ResponseEntity<PlanningState> finishMoveWaypoint()
    {
        routePlanner.finishMoveWaypoint();

        return new ResponseEntity<PlanningState>(routePlanner.getState(), HttpStatus.OK);
    }

    @PostMapping("/waypoints/reorder")
    ResponseEntity<OperationResult<List<Waypoint>>> reorderWaypoints(@RequestBody ReorderRequest request)
    {
        return ResultResponses
                .toResponse(routePlanner.reorderWaypoints(request.getFromIndex(), request.getToIndex()));
    }

    @DeleteMapping("/waypoints/{waypointId}")
    ResponseEntity<OperationResult<Waypoint>> removeWaypoint(@PathVariable String waypointId)
    {
        return ResultResponses.toResponse(routePlanner.removeWaypoint(waypointId));
    }

    @DeleteMapping("/waypoints")
    ResponseEntity<OperationResult<PlanningState>> clearWaypoints()
    {
        return ResultResponses.toResponse(routePlanner.clearWaypoints());
    }

    @PostMapping("/modify-at")
    ResponseEntity<OperationResult<Waypoint>> modifyRouteAt(@RequestBody Coordinate pressed)
    {
        return ResultResponses.toResponse(routePlanner.modifyRouteAt(pressed));
    }

    @PostMapping("/undo")
    ResponseEntity<PlanningState> undo()
    {
        routePlanner.undo();

        return new ResponseEntity<PlanningState>(routePlanner.getState(), HttpStatus.OK);
    }

    @PostMapping("/redo")
    ResponseEntity<PlanningState> redo()
    {
        routePlanner.redo();

        return new ResponseEntity<PlanningState>(routePlanner.getState(), HttpStatus.OK);
    }

    @PostMapping("/calculate")
    ResponseEntity<OperationResult<CalculatedRoute>> calculateRoute()
    {
        return ResultResponses.toResponse(routePlanner.calculateRoute());
    }

    @PostMapping("/clear-error")
    ResponseEntity<PlanningState> clearError()
    {
        routePlanner.clearError();

        return new ResponseEntity<PlanningState>(routePlanner.getState(), HttpStatus.OK);
    }

    @PostMapping("/save")
    ResponseEntity<OperationResult<SavedRoute>> saveRoute(@RequestBody SaveRouteRequest request)
    {
        OperationResult<SavedRoute> result = routePlanner.prepareForSave(request.getName(), request.getDescription());
        if (result.isSuccess())
        {
            routeStorageService.save(result.getValue());
        }

        return ResultResponses.toResponse(result, HttpStatus.CREATED);
    }
}
