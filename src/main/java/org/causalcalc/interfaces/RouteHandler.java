package org.causalcalc.interfaces;

import org.causalcalc.interfaces.http.HttpRequest;
import org.causalcalc.interfaces.http.HttpResponse;

public interface RouteHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
