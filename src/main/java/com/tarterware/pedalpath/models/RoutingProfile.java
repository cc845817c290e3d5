package com.tarterware.pedalpath.models;

/**
 * Travel profile requested from the routing service. Cycling is served by
 * Mapbox, the other profiles by OSRM.
 */
public enum RoutingProfile
{
    CYCLING("cycling"), DRIVING("driving"), FOOT("foot");

    private final String pathName;

    RoutingProfile(String pathName)
    {
        this.pathName = pathName;
    }

    /**
     * @return the profile name as it appears in the routing service URL.
     */
    public String getPathName()
    {
        return pathName;
    }
}
