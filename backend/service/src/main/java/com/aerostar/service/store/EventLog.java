package com.aerostar.service.store;

import com.aerostar.core.events.Event;

import java.util.List;

public interface EventLog {
    void append(Event event);

    List<Event> readAll();
}
