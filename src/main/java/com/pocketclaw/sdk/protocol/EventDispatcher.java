package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fans out events to an optional primary handler and a keyed listener registry.
 *
 * <p>Each dispatch iterates a snapshot taken when it starts, so listeners may add or
 * remove themselves or others from inside a callback. Callers must not rely on the
 * relative order of listeners. A listener that throws is logged and skipped.</p>
 */
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final Object lock = new Object();
    private final Map<String, EventListener> listeners = new LinkedHashMap<>();
    private volatile EventListener primaryHandler;

    public void setPrimaryHandler(EventListener handler) {
        this.primaryHandler = handler;
    }

    /**
     * Registers a listener, replacing any listener with the same id.
     *
     * @return the listener id
     */
    public String addListener(String id, EventListener listener) {
        synchronized (lock) {
            listeners.put(id, listener);
        }
        return id;
    }

    /**
     * Registers a listener ahead of all currently registered listeners.
     */
    public String addListenerFirst(String id, EventListener listener) {
        synchronized (lock) {
            Map<String, EventListener> rest = new LinkedHashMap<>(listeners);
            rest.remove(id);
            listeners.clear();
            listeners.put(id, listener);
            listeners.putAll(rest);
        }
        return id;
    }

    public boolean removeListener(String id) {
        synchronized (lock) {
            return listeners.remove(id) != null;
        }
    }

    public int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    public void dispatch(String event, JsonNode payload) {
        JsonNode body = payload != null && !payload.isNull() ? payload : JsonNodeFactory.instance.objectNode();
        Map<String, EventListener> snapshot;
        synchronized (lock) {
            snapshot = new LinkedHashMap<>(listeners);
        }

        EventListener primary = primaryHandler;
        if (primary != null) {
            deliver("primary", primary, event, body);
        }
        for (Map.Entry<String, EventListener> entry : snapshot.entrySet()) {
            deliver(entry.getKey(), entry.getValue(), event, body);
        }
    }

    private void deliver(String id, EventListener listener, String event, JsonNode payload) {
        try {
            listener.onEvent(event, payload);
        } catch (RuntimeException e) {
            logger.warn("Event listener {} failed on {}: {}", id, event, e.getMessage(), e);
        }
    }
}
