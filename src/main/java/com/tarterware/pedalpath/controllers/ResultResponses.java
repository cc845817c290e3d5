package com.tarterware.pedalpath.controllers;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.tarterware.pedalpath.models.FailureReason;
import com.tarterware.pedalpath.models.OperationResult;

/**
 * Turns engine results into HTTP responses. The result itself is the body, so
 * clients always see the failure reason and message.
 */
final class ResultResponses
{
    private ResultResponses()
    {
    }

    static <T> ResponseEntity<OperationResult<T>> toResponse(OperationResult<T> result)
    {
        return toResponse(result, HttpStatus.OK);
    }

    static <T> ResponseEntity<OperationResult<T>> toResponse(OperationResult<T> result, HttpStatus successStatus)
    {
        HttpStatus status = result.isSuccess() ? successStatus : statusFor(result.getFailure());
        return new ResponseEntity<OperationResult<T>>(result, status);
    }

    static HttpStatus statusFor(FailureReason failure)
    {
        switch (failure)
        {
        case INVALID_INDEX:
        case INVALID_INPUT:
            return HttpStatus.BAD_REQUEST;
        case WAYPOINT_NOT_FOUND:
        case ROUTE_NOT_FOUND:
            return HttpStatus.NOT_FOUND;
        case NOT_PLANNING:
        case NOT_NAVIGATING:
        case LOCATION_UNAVAILABLE:
        case ROUTE_CHANGED:
            return HttpStatus.CONFLICT;
        case INSUFFICIENT_WAYPOINTS:
        case INSUFFICIENT_GEOMETRY:
        case NOT_ON_ROUTE:
            return HttpStatus.UNPROCESSABLE_ENTITY;
        case ROUTING_FAILED:
            return HttpStatus.BAD_GATEWAY;
        default:
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
