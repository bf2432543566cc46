package org.carball.queryopt.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publish/subscribe hub for optimizer notifications.
 * A handler that throws is logged and skipped; the remaining handlers still receive the payload.
 */
@Slf4j
public class EventBus {

    private final Map<EventChannel<?>, List<Consumer<?>>> handlers = new ConcurrentHashMap<>();

    /**
     * Handle returned by {@link #subscribe}.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    public <T> Subscription subscribe(EventChannel<T> channel, Consumer<? super T> handler) {
        List<Consumer<?>> channelHandlers = handlers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>());
        channelHandlers.add(handler);
        log.debug("Subscribed handler to {} ({} total)", channel, channelHandlers.size());
        return () -> channelHandlers.remove(handler);
    }

    @SuppressWarnings("unchecked")
    public <T> void publish(EventChannel<T> channel, T payload) {
        List<Consumer<?>> channelHandlers = handlers.get(channel);
        if (channelHandlers == null) {
            return;
        }
        for (Consumer<?> handler : channelHandlers) {
            try {
                ((Consumer<? super T>) handler).accept(payload);
            } catch (RuntimeException e) {
                log.warn("Handler for {} failed: {}", channel, e.getMessage(), e);
            }
        }
    }

    public int subscriberCount(EventChannel<?> channel) {
        List<Consumer<?>> channelHandlers = handlers.get(channel);
        return channelHandlers == null ? 0 : channelHandlers.size();
    }

    public void clear() {
        handlers.clear();
    }
}
