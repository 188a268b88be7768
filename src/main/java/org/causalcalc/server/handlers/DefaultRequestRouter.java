package org.causalcalc.server.handlers;

import org.causalcalc.interfaces.CalculatorService;
import org.causalcalc.interfaces.RequestRouter;
import org.causalcalc.interfaces.RouteHandler;
import org.causalcalc.interfaces.http.HttpRequest;

public class DefaultRequestRouter implements RequestRouter {

    public static final String SUM_PATH = "/sum";
    public static final String HEALTH_PATH = "/health";
    public static final String CLOCK_PATH = "/clock";
    public static final String EVENTS_PATH = "/events";

    private final CalculatorService service;

    public DefaultRequestRouter(CalculatorService service) { this.service = service; }

    @Override
    public RouteHandler route(HttpRequest req) {
        String m = req.method() == null ? "" : req.method().toUpperCase();
        String p = req.path();

        if ("POST".equals(m) && SUM_PATH.equals(p)) return new PartialSumHandler(service);
        if ("GET".equals(m)) {
            if (HEALTH_PATH.equals(p)) return new HealthHandler(service);
            if (CLOCK_PATH.equals(p)) return new ClockHandler(service);
            if (EVENTS_PATH.equals(p)) return new EventsHandler(service);
        }
        return new NotFoundHandler(service.clock());
    }
}
