package com.tarterware.pedalpath.services;

/**
 * Thrown when the routing service cannot produce a route: a transport error,
 * a timeout, a non-Ok response code or an empty route list.
 */
public class RoutingException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public RoutingException(String message)
    {
        super(message);
    }

    public RoutingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
