package in.tradepulse.service.core;

import in.tradepulse.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe channel.
 *
 * Every subscriber owns a bounded queue drained by its own daemon thread, so
 * a slow subscriber never delays another and sees events in publish order.
 *
 * When a subscriber's queue is full:
 * - LOSSY channels drop the oldest queued event and count it
 * - LOSSLESS channels block the publisher until space frees up or the
 *   subscription is cancelled
 */
public final class EventChannel<T> {
    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);
    private static final long OFFER_WAIT_MS = 100;

    public enum Delivery {
        LOSSY,
        LOSSLESS
    }

    private final String name;
    private final Delivery delivery;
    private final int capacity;
    private final StreamMetrics metrics;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong(0);
    private volatile boolean closed = false;

    public EventChannel(String name, Delivery delivery, int capacity, StreamMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.name = name;
        this.delivery = delivery;
        this.capacity = capacity;
        this.metrics = metrics;
    }

    /**
     * Register a handler. Handler exceptions are logged and do not stop delivery.
     *
     * @param subscriberName used for the dispatcher thread name and logs
     */
    public Subscription subscribe(String subscriberName, Consumer<T> handler) {
        if (closed) {
            throw new IllegalStateException("Channel " + name + " is closed");
        }
        Subscription subscription = new Subscription(subscriberName, handler);
        subscriptions.add(subscription);
        subscription.start();
        log.info("[EVENT BUS] {} subscribed to {} ({}, capacity {})", subscriberName, name, delivery, capacity);
        return subscription;
    }

    /**
     * Deliver {@code event} to every subscriber queue.
     */
    public void publish(T event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (closed) {
            log.debug("[EVENT BUS] {} closed, dropping event", name);
            return;
        }
        for (Subscription subscription : subscriptions) {
            subscription.enqueue(event);
        }
    }

    public String name() {
        return name;
    }

    public Delivery delivery() {
        return delivery;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * @return events dropped across all subscribers since creation
     */
    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Stop every dispatcher. Undelivered events are discarded.
     */
    public void close() {
        closed = true;
        for (Subscription subscription : subscriptions) {
            subscription.cancel();
        }
        subscriptions.clear();
    }

    /**
     * One subscriber's queue and dispatcher thread.
     */
    public final class Subscription {
        private final String subscriberName;
        private final Consumer<T> handler;
        private final BlockingQueue<T> queue;
        private final Thread dispatcher;
        private volatile boolean running = true;

        private Subscription(String subscriberName, Consumer<T> handler) {
            this.subscriberName = subscriberName;
            this.handler = handler;
            this.queue = new LinkedBlockingQueue<>(capacity);
            this.dispatcher = new Thread(this::dispatchLoop, "bus-" + name + "-" + subscriberName);
            this.dispatcher.setDaemon(true);
        }

        private void start() {
            dispatcher.start();
        }

        private void enqueue(T event) {
            if (delivery == Delivery.LOSSLESS) {
                try {
                    while (!queue.offer(event, OFFER_WAIT_MS, TimeUnit.MILLISECONDS)) {
                        if (closed || !running) {
                            log.debug("[EVENT BUS] {}/{} cancelled, publisher released", name, subscriberName);
                            return;
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[EVENT BUS] Interrupted while publishing to {}/{}", name, subscriberName);
                }
                return;
            }

            while (!queue.offer(event)) {
                if (queue.poll() != null) {
                    dropped.incrementAndGet();
                    metrics.recordDroppedEvent(name);
                    log.debug("[EVENT BUS] {}/{} full, dropped oldest event", name, subscriberName);
                }
            }
        }

        private void dispatchLoop() {
            while (running) {
                T event;
                try {
                    event = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                try {
                    handler.accept(event);
                } catch (Exception e) {
                    log.error("[EVENT BUS] Subscriber {} failed on {} event: {}", subscriberName, name, e.getMessage(), e);
                }
            }
            log.debug("[EVENT BUS] Dispatcher {}/{} stopped", name, subscriberName);
        }

        public void cancel() {
            running = false;
            dispatcher.interrupt();
            subscriptions.remove(this);
        }
    }
}
