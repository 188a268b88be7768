package org.causalcalc.server.handlers;

import org.causalcalc.interfaces.CalculatorService;
import org.causalcalc.interfaces.RouteHandler;
import org.causalcalc.interfaces.VectorClock;
import org.causalcalc.interfaces.http.HttpRequest;
import org.causalcalc.interfaces.http.HttpResponse;
import org.causalcalc.model.ClockSnapshot;

import java.util.Map;

/** GET /clock: read-only view of the server clock. */
public class ClockHandler implements RouteHandler {
    private final CalculatorService service;

    public ClockHandler(CalculatorService service) { this.service = service; }

    record ClockView(String processId, Map<String, Integer> vectorClock, String formatted) {}

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        VectorClock clock = service.clock();
        ClockSnapshot snap = clock.snapshot();
        JsonResponses.ok(res, new ClockView(clock.processId(), snap.asMap(), snap.format()), clock);
    }
}
