package org.causalcalc.interfaces;

import org.causalcalc.interfaces.http.HttpRequest;

/** Picks the handler for a parsed request. */
public interface RequestRouter {
    RouteHandler route(HttpRequest req);
}
