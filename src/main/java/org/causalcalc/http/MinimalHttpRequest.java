package org.causalcalc.http;

import org.causalcalc.interfaces.http.HttpRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final Map<String,String> headers;
    private final Map<String,String> query;
    private final byte[] body;

    /**
     * @param target request target as sent, e.g. {@code /events?limit=5}
     * @param headers header map; lookups fall back to lower-case names
     */
    public MinimalHttpRequest(String method, String target,
                              Map<String,String> headers, byte[] body){
        String t = target == null ? "/" : target;
        int q = t.indexOf('?');
        this.method = method;
        this.path = (q >= 0) ? t.substring(0, q) : t;
        this.query = (q >= 0) ? parseQuery(t.substring(q + 1)) : Map.of();
        this.headers = headers == null ? Map.of() : headers;
        this.body = body == null ? new byte[0] : body;
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }

    @Override
    public String header(String name){
        if (name == null) return null;
        String v = headers.get(name);
        return v != null ? v : headers.get(name.toLowerCase());
    }

    @Override
    public String query(String name) {
        return name == null ? null : query.get(name);
    }

    @Override public byte[] body() { return body; }

    private static Map<String,String> parseQuery(String qs) {
        Map<String,String> out = new LinkedHashMap<>();
        for (String pair : qs.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String k = eq >= 0 ? pair.substring(0, eq) : pair;
            String v = eq >= 0 ? pair.substring(eq + 1) : "";
            out.put(URLDecoder.decode(k, StandardCharsets.UTF_8), URLDecoder.decode(v, StandardCharsets.UTF_8));
        }
        return out;
    }
}
