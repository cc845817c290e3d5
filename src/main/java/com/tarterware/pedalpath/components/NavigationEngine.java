package com.tarterware.pedalpath.components;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.pedalpath.models.FailureReason;
import com.tarterware.pedalpath.models.LocationUpdate;
import com.tarterware.pedalpath.models.NavigationSnapshot;
import com.tarterware.pedalpath.models.NavigationStatus;
import com.tarterware.pedalpath.models.OperationResult;
import com.tarterware.pedalpath.models.SavedRoute;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;

/**
 * Runs active navigation along a saved route.
 *
 * <p>
 * The engine owns at most one {@link NavigationSession}. The session is only
 * ever touched on a dedicated single-thread event loop: location fixes from
 * the {@link LocationProvider} are queued onto it, and commands (start, pause,
 * resume, stop, direct location updates) run on it while the caller waits. So
 * every event completes before the next one starts.
 * </p>
 *
 * <p>
 * After each change the engine publishes an immutable
 * {@link NavigationSnapshot}; {@link #getSnapshot()} is safe to call from any
 * thread.
 * </p>
 */
@Component
public class NavigationEngine
{
    public static final String EVENT_LOOP_THREAD_NAME = "navigation-event-loop";

    public static final String ENDPOINT_SMOOTHED_SPEED = "pedalpath.navigation.smoothed.speed.mps";
    public static final String ENDPOINT_PROGRESS_PERCENT = "pedalpath.navigation.progress.percent";
    public static final String ENDPOINT_OFF_ROUTE_ALERTS = "pedalpath.navigation.off.route.alerts";

    private static final Logger logger = LoggerFactory.getLogger(NavigationEngine.class);

    private final LocationProvider locationProvider;

    private final double metersOffRouteThreshold;

    private final ExecutorService eventLoop;

    // Set by the event loop thread when it starts.
    private volatile Thread eventLoopThread;

    private final AtomicReference<NavigationSnapshot> snapshot = new AtomicReference<>(NavigationSnapshot.IDLE);

    private final List<NavigationListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicReference<Double> smoothedSpeed = new AtomicReference<>(0.0);
    private final AtomicReference<Double> progressPercent = new AtomicReference<>(0.0);
    private final Counter offRouteCounter;

    // Only accessed on the event loop.
    private NavigationSession session;

    // Only accessed on the event loop.
    private LocationSubscription subscription;

    /**
     * @param locationProvider        Source of GPS fixes.
     * @param meterRegistry           Registry for navigation gauges and counters.
     * @param metersOffRouteThreshold Distance from the route beyond which the
     *                                rider is off route.
     */
    public NavigationEngine(LocationProvider locationProvider, MeterRegistry meterRegistry,
            @Value("${com.tarterware.pedalpath.off-route-threshold-meters:50}") double metersOffRouteThreshold)
    {
        this.locationProvider = locationProvider;
        this.metersOffRouteThreshold = metersOffRouteThreshold;

        this.eventLoop = Executors.newSingleThreadExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, EVENT_LOOP_THREAD_NAME);
            thread.setDaemon(true);
            eventLoopThread = thread;
            return thread;
        });

        meterRegistry.gauge(ENDPOINT_SMOOTHED_SPEED, smoothedSpeed, AtomicReference::get);
        meterRegistry.gauge(ENDPOINT_PROGRESS_PERCENT, progressPercent, AtomicReference::get);
        this.offRouteCounter = meterRegistry.counter(ENDPOINT_OFF_ROUTE_ALERTS);
    }

    /**
     * Start navigating along a route. Any running session is stopped first.
     *
     * @param route The route to follow.
     * @return the first snapshot of the new session.
     */
    public OperationResult<NavigationSnapshot> startNavigation(SavedRoute route)
    {
        return runOnEventLoop(() -> doStart(route));
    }

    /**
     * Pause an active session. Fixes are dropped while paused.
     *
     * @return the paused snapshot.
     */
    public OperationResult<NavigationSnapshot> pauseNavigation()
    {
        return runOnEventLoop(() -> doChangeStatus(NavigationStatus.ACTIVE, NavigationStatus.PAUSED));
    }

    /**
     * Resume a paused session.
     *
     * @return the resumed snapshot.
     */
    public OperationResult<NavigationSnapshot> resumeNavigation()
    {
        return runOnEventLoop(() -> doChangeStatus(NavigationStatus.PAUSED, NavigationStatus.ACTIVE));
    }

    /**
     * End the session, if any, and release the location subscription.
     *
     * @return the idle snapshot.
     */
    public OperationResult<NavigationSnapshot> stopNavigation()
    {
        return runOnEventLoop(this::doStop);
    }

    /**
     * Process a fix directly, bypassing the location provider.
     *
     * @param update The fix.
     * @return the snapshot after processing. Fixes that are dropped leave it
     *         unchanged.
     */
    public OperationResult<NavigationSnapshot> onLocationUpdate(LocationUpdate update)
    {
        return runOnEventLoop(() ->
        {
            doLocationUpdate(update);
            return OperationResult.ok(snapshot.get());
        });
    }

    /**
     * @return the latest published snapshot.
     */
    public NavigationSnapshot getSnapshot()
    {
        return snapshot.get();
    }

    public void addListener(NavigationListener listener)
    {
        listeners.add(listener);
    }

    public void removeListener(NavigationListener listener)
    {
        listeners.remove(listener);
    }

    public double getMetersOffRouteThreshold()
    {
        return metersOffRouteThreshold;
    }

    @PreDestroy
    public void shutdown()
    {
        if (eventLoop.isShutdown())
        {
            return;
        }

        logger.info("Shutting down the navigation engine.");

        try
        {
            stopNavigation();
        }
        finally
        {
            eventLoop.shutdown();
        }

        try
        {
            if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS))
            {
                eventLoop.shutdownNow();
            }
        }
        catch (InterruptedException e)
        {
            eventLoop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private OperationResult<NavigationSnapshot> doStart(SavedRoute route)
    {
        if ((route == null) || (route.getGeometry() == null) || (route.getGeometry().size() < 2))
        {
            return OperationResult.failure(FailureReason.INSUFFICIENT_GEOMETRY,
                    "A route needs at least 2 geometry points to navigate");
        }

        if (session != null)
        {
            doStop();
        }

        NavigationSession newSession = new NavigationSession(route);

        try
        {
            subscription = locationProvider.subscribe(update -> enqueueLocationUpdate(update, newSession));
        }
        catch (LocationUnavailableException e)
        {
            logger.warn("Cannot start navigation on route {}: {}", route.getId(), e.getMessage());
            newSession.release();
            subscription = null;
            return OperationResult.failure(FailureReason.LOCATION_UNAVAILABLE, e.getMessage());
        }

        session = newSession;
        publish();

        logger.info("Navigation started on route {} ({} m).", route.getId(), session.getTotalDistance());

        return OperationResult.ok(snapshot.get());
    }

    private OperationResult<NavigationSnapshot> doChangeStatus(NavigationStatus from, NavigationStatus to)
    {
        if ((session == null) || (session.getStatus() != from))
        {
            return OperationResult.failure(FailureReason.NOT_NAVIGATING, "Navigation is not " + from);
        }

        session.setStatus(to);
        publish();

        logger.info("Navigation on route {} is now {}.", session.getRouteId(), to);

        return OperationResult.ok(snapshot.get());
    }

    private OperationResult<NavigationSnapshot> doStop()
    {
        if (subscription != null)
        {
            subscription.close();
            subscription = null;
        }

        if (session != null)
        {
            logger.info("Navigation stopped on route {} after {} m.", session.getRouteId(),
                    session.getDistanceTraveled());
            session.release();
            session = null;
        }

        snapshot.set(NavigationSnapshot.IDLE);
        smoothedSpeed.set(0.0);
        progressPercent.set(0.0);

        return OperationResult.ok(NavigationSnapshot.IDLE);
    }

    private void doLocationUpdate(LocationUpdate update)
    {
        if ((session == null) || (session.getStatus() != NavigationStatus.ACTIVE) || (update == null))
        {
            return;
        }

        if (session.isRepeatOf(update))
        {
            logger.debug("Ignoring duplicate fix at {}.", update.getTimestamp());
            return;
        }

        boolean leftRoute;
        try
        {
            leftRoute = session.applyLocation(update, metersOffRouteThreshold);
        }
        catch (RuntimeException e)
        {
            logger.error("Failed to process location update {}", update, e);
            session.setError(e.getMessage());
            publish();
            return;
        }

        NavigationSnapshot current = publish();

        for (NavigationListener listener : listeners)
        {
            notifyListener(listener, current, false);
        }

        if (leftRoute)
        {
            logger.warn("Rider is {} m off route {}.", current.getDistanceFromRoute(), current.getRouteId());
            offRouteCounter.increment();
            for (NavigationListener listener : listeners)
            {
                notifyListener(listener, current, true);
            }
        }
    }

    private void notifyListener(NavigationListener listener, NavigationSnapshot current, boolean offRoute)
    {
        try
        {
            if (offRoute)
            {
                listener.onOffRoute(current);
            }
            else
            {
                listener.onProgress(current);
            }
        }
        catch (RuntimeException e)
        {
            logger.error("Navigation listener {} failed", listener, e);
        }
    }

    private NavigationSnapshot publish()
    {
        NavigationSnapshot current = session.toSnapshot();
        snapshot.set(current);
        smoothedSpeed.set(current.getSmoothedSpeed());
        progressPercent.set(current.getProgressPercent());
        return current;
    }

    // Provider callback; runs on the provider's thread. A fix only applies to
    // the session whose subscription received it.
    private void enqueueLocationUpdate(LocationUpdate update, NavigationSession target)
    {
        try
        {
            eventLoop.execute(() ->
            {
                if (session != target)
                {
                    logger.debug("Dropping fix at {} for a session that has ended.", update.getTimestamp());
                    return;
                }
                doLocationUpdate(update);
            });
        }
        catch (RejectedExecutionException e)
        {
            logger.warn("Navigation engine is shut down; dropping location update.");
        }
    }

    private <T> T runOnEventLoop(Callable<T> command)
    {
        try
        {
            if (Thread.currentThread() == eventLoopThread)
            {
                return command.call();
            }

            Future<T> future = eventLoop.submit(command);
            return future.get();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for the navigation event loop", e);
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
            {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Navigation command failed", cause);
        }
        catch (RuntimeException e)
        {
            throw e;
        }
        catch (Exception e)
        {
            throw new IllegalStateException("Navigation command failed", e);
        }
    }
}
