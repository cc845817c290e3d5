package com.tarterware.pedalpath.components;

import com.tarterware.pedalpath.models.NavigationSnapshot;

/**
 * Receives navigation events. Callbacks run on the navigation event loop and
 * should return quickly.
 */
public interface NavigationListener
{
    /**
     * Called after every processed location update.
     *
     * @param snapshot the state after the update.
     */
    void onProgress(NavigationSnapshot snapshot);

    /**
     * Called once each time the rider leaves the route.
     *
     * @param snapshot the state that triggered the alert.
     */
    default void onOffRoute(NavigationSnapshot snapshot)
    {
    }
}
