package org.causalcalc.server.handlers;

import com.google.gson.JsonParseException;
import org.causalcalc.interfaces.CalculatorService;
import org.causalcalc.interfaces.RouteHandler;
import org.causalcalc.interfaces.http.HttpRequest;
import org.causalcalc.interfaces.http.HttpResponse;
import org.causalcalc.model.dto.PartialSumRequest;
import org.causalcalc.model.dto.SumReply;

import java.nio.charset.StandardCharsets;

/** POST /sum */
public class PartialSumHandler implements RouteHandler {
    private final CalculatorService service;

    public PartialSumHandler(CalculatorService service) { this.service = service; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        byte[] bytes = req.body();
        String payload = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8).trim();
        if (payload.isEmpty()) {
            JsonResponses.error(res, 400, "Bad Request", "missing request body", service.clock());
            return;
        }

        PartialSumRequest request;
        try {
            request = JsonResponses.GSON.fromJson(payload, PartialSumRequest.class);
        } catch (JsonParseException e) {
            JsonResponses.error(res, 400, "Bad Request", "invalid json", service.clock());
            return;
        }

        try {
            SumReply reply = service.partialSum(request);
            JsonResponses.ok(res, reply, service.clock());
        } catch (IllegalArgumentException e) {
            // nothing was merged: validation runs before the clock is touched
            JsonResponses.error(res, 400, "Bad Request", e.getMessage(), service.clock());
        }
    }
}
