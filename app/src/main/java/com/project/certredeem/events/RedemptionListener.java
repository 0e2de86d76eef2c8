package com.project.certredeem.events;

import com.project.certredeem.crypto.ErrorLogger;

import java.util.List;

@FunctionalInterface
public interface RedemptionListener {

    RedemptionListener NOOP = event -> { };

    void onEvent(RedemptionEvent event);

    /**
     * Fan out to every listener. A failing listener is logged and does not stop the others,
     * nor the state change that produced the event.
     */
    static RedemptionListener compose(List<RedemptionListener> listeners) {
        List<RedemptionListener> copy = List.copyOf(listeners);
        return event -> {
            for (RedemptionListener listener : copy) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    ErrorLogger.logError("RedemptionListener.onEvent",
                        "Listener failed for event " + event.type(), e);
                }
            }
        };
    }
}
