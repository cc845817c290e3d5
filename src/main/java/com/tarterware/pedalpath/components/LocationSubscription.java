package com.tarterware.pedalpath.components;

/**
 * Handle on a {@link LocationProvider} subscription. Closing it more than once
 * has no further effect.
 */
public interface LocationSubscription extends AutoCloseable
{
    @Override
    void close();
}
