package com.tarterware.pedalpath.components;

import java.util.function.Consumer;

import com.tarterware.pedalpath.models.LocationUpdate;

/**
 * Source of GPS fixes for active navigation.
 */
public interface LocationProvider
{
    /**
     * Start delivering fixes to the given consumer.
     *
     * @param consumer Receives each fix, on the provider's thread.
     * @return a handle that stops delivery when closed.
     * @throws LocationUnavailableException if location access is refused.
     */
    LocationSubscription subscribe(Consumer<LocationUpdate> consumer) throws LocationUnavailableException;
}
