package com.project.certredeem.events;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory, append-only record of every event seen.
 */
public class EventLog implements RedemptionListener {

    private final List<RedemptionEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(RedemptionEvent event) {
        events.add(event);
    }

    public List<RedemptionEvent> events() {
        return List.copyOf(events);
    }

    public <T extends RedemptionEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    public int size() {
        return events.size();
    }
}
