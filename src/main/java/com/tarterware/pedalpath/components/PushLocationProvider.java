package com.tarterware.pedalpath.components;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.pedalpath.models.LocationUpdate;

/**
 * Location provider fed from outside: the device posts its fixes and they are
 * handed to every current subscriber.
 */
@Component
public class PushLocationProvider implements LocationProvider
{
    private static final Logger logger = LoggerFactory.getLogger(PushLocationProvider.class);

    private final List<Consumer<LocationUpdate>> subscribers = new CopyOnWriteArrayList<>();

    private volatile boolean locationEnabled;

    public PushLocationProvider(@Value("${com.tarterware.pedalpath.location.enabled:true}") boolean locationEnabled)
    {
        this.locationEnabled = locationEnabled;
    }

    @Override
    public LocationSubscription subscribe(Consumer<LocationUpdate> consumer) throws LocationUnavailableException
    {
        if (!locationEnabled)
        {
            throw new LocationUnavailableException("Location access has not been granted");
        }

        subscribers.add(consumer);
        logger.info("Location subscriber added; {} active.", subscribers.size());

        return new LocationSubscription()
        {
            private boolean closed = false;

            @Override
            public synchronized void close()
            {
                if (!closed)
                {
                    closed = true;
                    subscribers.remove(consumer);
                    logger.info("Location subscriber removed; {} active.", subscribers.size());
                }
            }
        };
    }

    /**
     * Deliver a fix to every subscriber.
     *
     * @param update The fix.
     * @return the number of subscribers it was delivered to.
     */
    public int publish(LocationUpdate update)
    {
        int delivered = 0;
        for (Consumer<LocationUpdate> subscriber : subscribers)
        {
            subscriber.accept(update);
            delivered++;
        }

        return delivered;
    }

    public int getSubscriberCount()
    {
        return subscribers.size();
    }

    public boolean isLocationEnabled()
    {
        return locationEnabled;
    }

    public void setLocationEnabled(boolean locationEnabled)
    {
        this.locationEnabled = locationEnabled;
    }
}
