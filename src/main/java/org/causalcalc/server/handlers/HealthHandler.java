package org.causalcalc.server.handlers;

import org.causalcalc.interfaces.CalculatorService;
import org.causalcalc.interfaces.RouteHandler;
import org.causalcalc.interfaces.http.HttpRequest;
import org.causalcalc.interfaces.http.HttpResponse;

/** GET /health */
public class HealthHandler implements RouteHandler {
    private final CalculatorService service;

    public HealthHandler(CalculatorService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        String clientId = req.header("X-Client-Id");
        if (clientId == null || clientId.isBlank()) clientId = "client-unknown";
        JsonResponses.ok(res, service.health(clientId), service.clock());
    }
}
