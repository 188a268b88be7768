package org.causalcalc.server.handlers;

import org.causalcalc.interfaces.CalculatorService;
import org.causalcalc.interfaces.EventLog;
import org.causalcalc.interfaces.RouteHandler;
import org.causalcalc.interfaces.http.HttpRequest;
import org.causalcalc.interfaces.http.HttpResponse;
import org.causalcalc.model.TimelineEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** GET /events?limit=N: event type summary plus the last N events with their causal relation to the previous one. */
public class EventsHandler implements RouteHandler {
    static final int DEFAULT_LIMIT = 10;

    private final CalculatorService service;

    public EventsHandler(CalculatorService service) { this.service = service; }

    record EventView(int position, String eventId, String eventType, String processId,
                     Map<String, Integer> vectorClock, String timestamp, String description,
                     String relationToPrevious) {}

    record EventsView(String processId, int total, Map<String, Long> byType, List<EventView> timeline) {}

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        int limit = DEFAULT_LIMIT;
        String raw = req.query("limit");
        if (raw != null) {
            try {
                limit = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                JsonResponses.error(res, 400, "Bad Request", "limit must be an integer", service.clock());
                return;
            }
        }

        EventLog log = service.eventLog();
        List<EventView> timeline = new ArrayList<>();
        for (TimelineEntry t : log.timeline(limit)) {
            timeline.add(new EventView(t.position(), t.event().eventId(), t.event().eventType(),
                    t.event().processId(), t.event().clock().asMap(), t.event().timestamp().toString(),
                    t.event().description(), t.relationToPrevious().map(r -> r.name()).orElse(null)));
        }
        JsonResponses.ok(res, new EventsView(log.processId(), log.size(), log.summarizeByType(), timeline),
                service.clock());
    }
}
