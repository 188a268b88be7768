package org.causalcalc.server.handlers;

import org.causalcalc.interfaces.RouteHandler;
import org.causalcalc.interfaces.VectorClock;
import org.causalcalc.interfaces.http.HttpRequest;
import org.causalcalc.interfaces.http.HttpResponse;

public class NotFoundHandler implements RouteHandler {
    private final VectorClock clock;

    public NotFoundHandler(VectorClock clock) { this.clock = clock; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonResponses.error(res, 404, "Not Found", "no route for " + req.method() + " " + req.path(), clock);
    }
}
