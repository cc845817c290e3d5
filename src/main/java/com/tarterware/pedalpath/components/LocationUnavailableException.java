package com.tarterware.pedalpath.components;

/**
 * Thrown when a location provider cannot deliver fixes, for example because
 * the user denied location permission.
 */
public class LocationUnavailableException extends Exception
{
    private static final long serialVersionUID = 1L;

    public LocationUnavailableException(String message)
    {
        super(message);
    }
}
