package io.catena.core.supervisor;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Bounded, non-blocking channel from executions to lifecycle subscribers.
///
/// Publishers offer events to a fixed-capacity queue and never wait: when the queue is
/// full the event is dropped and a warning is logged. A single daemon thread, started
/// by {@link #start()}, delivers queued events to subscribers in publish order.
///
/// ### Contracts
/// - **Non-blocking**: {@link #publish} returns immediately
/// - **Contained**: a subscriber exception is logged and delivery continues
/// - **Ordered**: each subscriber sees events in the order they were accepted
///
/// @implNote Thread-safe. Subscribers may be added or removed at any time.
public class LifecycleEventBus implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(LifecycleEventBus.class.getName());

    private final BlockingQueue<LifecycleEvent> queue;
    private final List<LifecycleSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final Thread dispatcher;
    private volatile boolean running;

    /// Creates a bus holding at most `capacity` undelivered events.
    ///
    /// @param capacity queue capacity, positive
    /// @throws IllegalArgumentException if capacity is not positive
    public LifecycleEventBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.dispatcher = new Thread(this::dispatchLoop, "catena-lifecycle-events");
        this.dispatcher.setDaemon(true);
    }

    /// Starts the dispatcher thread. Events published earlier are delivered in order.
    public synchronized void start() {
        if (!running && !dispatcher.isAlive()) {
            running = true;
            dispatcher.start();
        }
    }

    /// Offers an event without blocking.
    ///
    /// @param event event to publish, not null
    /// @return true if accepted, false if dropped because the queue is full
    public boolean publish(LifecycleEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (queue.offer(event)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        logger.warning(
                "Lifecycle event queue full, dropped "
                        + event.type()
                        + " for execution "
                        + event.executionId()
                        + " ("
                        + total
                        + " dropped so far)");
        return false;
    }

    /// Registers a subscriber.
    ///
    /// @param subscriber subscriber to add, not null
    /// @return handle removing the subscriber when closed, never null
    public AutoCloseable subscribe(LifecycleSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /// Returns the number of events dropped because the queue was full.
    public long getDroppedCount() {
        return dropped.get();
    }

    /// Returns the number of accepted events not yet delivered.
    public int getPendingCount() {
        return queue.size();
    }

    /// Stops the dispatcher. Undelivered events are discarded.
    @Override
    public void close() {
        running = false;
        dispatcher.interrupt();
    }

    private void dispatchLoop() {
        while (running) {
            LifecycleEvent event;
            try {
                event = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event != null) {
                deliver(event);
            }
        }
    }

    void deliver(LifecycleEvent event) {
        for (LifecycleSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(event);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Lifecycle subscriber failed on "
                                + event.type()
                                + " for execution "
                                + event.executionId(),
                        e);
            }
        }
    }
}
