package org.causalcalc.server.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.causalcalc.interfaces.VectorClock;
import org.causalcalc.interfaces.http.HttpResponse;
import org.causalcalc.model.dto.ErrorReply;

/** Shared JSON response writing; every reply carries the server's node id and current clock. */
public final class JsonResponses {

    static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private JsonResponses() {}

    static void write(HttpResponse res, int code, String reason, Object body, VectorClock clock) {
        res.status(code, reason);
        res.header("Content-Type", "application/json; charset=utf-8");
        if (clock != null) {
            res.header("X-Vector-Node", clock.processId());
            res.header("X-Vector-Clock", clock.format());
        }
        res.body(GSON.toJson(body));
    }

    static void ok(HttpResponse res, Object body, VectorClock clock) {
        write(res, 200, "OK", body, clock);
    }

    public static void error(HttpResponse res, int code, String reason, String message, VectorClock clock) {
        write(res, code, reason, new ErrorReply(message), clock);
    }
}
